package ai.apigraph.modules;

/**
 * Host policy deciding which loaded modules belong to the package.
 */
@FunctionalInterface
public interface PackageModuleFilter {

    /**
     * @param packageName   root package being analyzed
     * @param moduleName    loaded module name
     * @param genuineModule whether the loaded entry is a real module object
     */
    ModuleExclusion classify(String packageName, String moduleName, boolean genuineModule);

    static PackageModuleFilter defaults() {
        return NamespaceModuleFilter.INSTANCE;
    }
}
