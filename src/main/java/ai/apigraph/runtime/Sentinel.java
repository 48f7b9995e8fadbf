package ai.apigraph.runtime;

/**
 * The two language-level singletons besides null.
 */
public enum Sentinel {
    NOT_IMPLEMENTED,
    ELLIPSIS
}
