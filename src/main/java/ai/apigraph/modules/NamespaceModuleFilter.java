package ai.apigraph.modules;

import java.util.Objects;

/**
 * Default module policy. A module belongs to package {@code p} when its name
 * starts with {@code p.}; it is private when any segment below {@code p}
 * starts with an underscore.
 */
public final class NamespaceModuleFilter implements PackageModuleFilter {

    static final NamespaceModuleFilter INSTANCE = new NamespaceModuleFilter();

    private NamespaceModuleFilter() {
    }

    @Override
    public ModuleExclusion classify(String packageName, String moduleName, boolean genuineModule) {
        Objects.requireNonNull(packageName, "packageName");
        Objects.requireNonNull(moduleName, "moduleName");

        final String prefix = packageName + ".";
        if (!moduleName.startsWith(prefix)) {
            return ModuleExclusion.EXTERNAL;
        }
        for (String segment : moduleName.substring(prefix.length()).split("\\.")) {
            if (segment.startsWith("_")) {
                return ModuleExclusion.PRIVATE;
            }
        }
        if (!genuineModule) {
            return ModuleExclusion.NON_MODULE;
        }
        return ModuleExclusion.INCLUDED;
    }
}
