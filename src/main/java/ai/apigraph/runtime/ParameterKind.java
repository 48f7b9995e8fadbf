package ai.apigraph.runtime;

public enum ParameterKind {
    POSITIONAL_ONLY,
    POSITIONAL_OR_KEYWORD,
    VAR_POSITIONAL,
    KEYWORD_ONLY,
    VAR_KEYWORD;

    /** Whether a receiver could be passed in this position. */
    public boolean acceptsPositional() {
        return this == POSITIONAL_ONLY || this == POSITIONAL_OR_KEYWORD || this == VAR_POSITIONAL;
    }
}
