package ai.apigraph.runtime;

import java.util.Objects;

/**
 * Class-body wrapper that is never bound automatically.
 */
public final class StaticMethod {

    private final Object function;

    public StaticMethod(Object function) {
        this.function = Objects.requireNonNull(function, "function");
    }

    public Object function() {
        return function;
    }

    @Override
    public String toString() {
        return "<staticmethod " + function + ">";
    }
}
