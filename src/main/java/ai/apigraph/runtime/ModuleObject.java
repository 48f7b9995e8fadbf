package ai.apigraph.runtime;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A loaded module: a named namespace of attributes.
 * <p>
 * {@code loadsOnAccess} lists modules that get loaded as a side effect the
 * first time this module's members are enumerated.
 */
public final class ModuleObject {

    private final String name;
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private final List<String> loadsOnAccess = new ArrayList<>();
    private Path sourceFile;

    public ModuleObject(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
        return name;
    }

    public ModuleObject set(String attribute, Object value) {
        attributes.put(Objects.requireNonNull(attribute, "attribute"), value);
        return this;
    }

    public Map<String, Object> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public ModuleObject loadsOnAccess(String... modules) {
        loadsOnAccess.addAll(List.of(modules));
        return this;
    }

    public List<String> loadsOnAccess() {
        return Collections.unmodifiableList(loadsOnAccess);
    }

    public ModuleObject withSourceFile(Path file) {
        this.sourceFile = file;
        return this;
    }

    public Optional<Path> sourceFile() {
        return Optional.ofNullable(sourceFile);
    }

    @Override
    public String toString() {
        return "<module " + name + ">";
    }
}
