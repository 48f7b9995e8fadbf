package ai.apigraph.model;

/**
 * Which form of a class an attribute is bound to.
 * <p>
 * SINGLETON is the outlier: a routine bound to one pre-existing instance of
 * the class. It reads like an instance method but never rebinds to new
 * instances.
 */
public enum Binding {
    STATIC,
    CLASS,
    SINGLETON,
    INSTANCE
}
