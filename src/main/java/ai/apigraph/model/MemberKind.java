package ai.apigraph.model;

/**
 * Kind of a class attribute.
 */
public enum MemberKind {
    METHOD,
    PROPERTY,
    INNER_CLASS,
    DATA
}
