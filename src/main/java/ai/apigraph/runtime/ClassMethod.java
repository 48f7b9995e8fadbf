package ai.apigraph.runtime;

import java.util.Objects;

/**
 * Class-body wrapper that always binds its function to the class.
 */
public final class ClassMethod {

    private final Object function;

    public ClassMethod(Object function) {
        this.function = Objects.requireNonNull(function, "function");
    }

    public Object function() {
        return function;
    }

    @Override
    public String toString() {
        return "<classmethod " + function + ">";
    }
}
