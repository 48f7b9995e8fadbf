package ai.apigraph.model;

/**
 * Coarse value categories. DATA is the catch-all for anything that is not a
 * module, class or routine.
 */
public enum ValueKind {
    MODULE,
    CLASS,
    ROUTINE,
    DATA
}
