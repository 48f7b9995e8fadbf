package ai.apigraph.runtime;

import java.util.Objects;

/**
 * Partial application: a function with its first {@code boundArguments}
 * positional arguments already supplied.
 */
public final class Partial {

    private final Object function;
    private final int boundArguments;

    public Partial(Object function, int boundArguments) {
        this.function = Objects.requireNonNull(function, "function");
        if (boundArguments < 0) {
            throw new IllegalArgumentException("boundArguments must be >= 0");
        }
        this.boundArguments = boundArguments;
    }

    public Object function() {
        return function;
    }

    public int boundArguments() {
        return boundArguments;
    }

    @Override
    public String toString() {
        return "<partial " + function + " (" + boundArguments + " bound)>";
    }
}
