package ai.apigraph.runtime;

/**
 * Shape of a raw class-body attribute, before the class binds it.
 */
public enum DescriptorShape {
    /** Always bound to the class. */
    CLASS_METHOD,
    /** Never auto-bound. */
    STATIC_METHOD,
    PROPERTY,
    /** Computed once, then cached on the instance. */
    CACHED_PROPERTY,
    /** Any other callable: functions, bound methods, partials. */
    ROUTINE,
    DATA
}
