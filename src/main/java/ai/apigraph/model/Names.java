package ai.apigraph.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Name conventions shared by the graph and its writers.
 * <p>
 * Fully qualified names have the form {@code module::Outer.Inner.member};
 * a module's fully qualified name is just the module name.
 */
public final class Names {

    public static final String MODULE_SEPARATOR = "::";

    private Names() {
    }

    public static boolean isSpecial(String name) {
        return name.startsWith("__");
    }

    public static boolean isPrivate(String name) {
        return !isSpecial(name) && name.startsWith("_");
    }

    public static String fullyQualified(String module, String qualifiedName) {
        Objects.requireNonNull(module, "module");
        if (qualifiedName == null || qualifiedName.isEmpty()) {
            return module;
        }
        return module + MODULE_SEPARATOR + qualifiedName;
    }

    /**
     * Name of a member reached through a parent with the given fully qualified
     * name: {@code mod} + {@code x} gives {@code mod::x}, {@code mod::Cls} +
     * {@code x} gives {@code mod::Cls.x}.
     */
    public static String member(String parentFqn, String name) {
        Objects.requireNonNull(parentFqn, "parentFqn");
        Objects.requireNonNull(name, "name");
        if (parentFqn.contains(MODULE_SEPARATOR)) {
            return parentFqn + "." + name;
        }
        return parentFqn + MODULE_SEPARATOR + name;
    }

    /**
     * Splits a fully qualified name into segments; the first entry is always
     * the module.
     */
    public static List<String> parseFqn(String fqn) {
        Objects.requireNonNull(fqn, "fqn");
        final int sep = fqn.indexOf(MODULE_SEPARATOR);
        if (sep < 0) {
            return List.of(fqn);
        }
        final List<String> parts = new ArrayList<>();
        parts.add(fqn.substring(0, sep));
        parts.addAll(Arrays.asList(fqn.substring(sep + MODULE_SEPARATOR.length()).split("\\.")));
        return parts;
    }

    public static String moduleOf(String fqn) {
        final int sep = fqn.indexOf(MODULE_SEPARATOR);
        return sep >= 0 ? fqn.substring(0, sep) : fqn;
    }

    public static String simpleNameOf(String qualifiedName) {
        final int i = qualifiedName.lastIndexOf('.');
        return i >= 0 ? qualifiedName.substring(i + 1) : qualifiedName;
    }

    public static String parentOf(String qualifiedName) {
        final int i = qualifiedName.lastIndexOf('.');
        return i >= 0 ? qualifiedName.substring(0, i) : "";
    }

    public static String abbreviate(String text, int limit) {
        if (text == null) {
            return "";
        }
        return text.length() > limit ? text.substring(0, limit - 3) + "..." : text;
    }
}
