package ai.apigraph.modules;

/**
 * Outcome of classifying a loaded module against the package being analyzed.
 */
public enum ModuleExclusion {
    /** Part of the documented package. */
    INCLUDED,
    /** Outside the package namespace; its members mark values as external. */
    EXTERNAL,
    /** Inside the namespace but private; tracked for imports only. */
    PRIVATE,
    /** Inside the namespace but not a genuine module object. */
    NON_MODULE;

    public boolean isExcluded() {
        return this != INCLUDED;
    }
}
