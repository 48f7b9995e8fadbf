package ai.apigraph.runtime;

import java.util.Objects;

/**
 * Property computed on first access and then stored on the instance.
 */
public final class CachedProperty {

    private final Object function;

    public CachedProperty(Object function) {
        this.function = Objects.requireNonNull(function, "function");
    }

    public Object function() {
        return function;
    }

    @Override
    public String toString() {
        return "<cached property " + function + ">";
    }
}
