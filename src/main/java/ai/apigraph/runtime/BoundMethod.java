package ai.apigraph.runtime;

import java.util.Objects;

/**
 * A callable permanently bound to a receiver.
 */
public final class BoundMethod {

    private final Object receiver;
    private final Object function;

    public BoundMethod(Object receiver, Object function) {
        this.receiver = receiver;
        this.function = Objects.requireNonNull(function, "function");
    }

    public Object receiver() {
        return receiver;
    }

    public Object function() {
        return function;
    }

    @Override
    public String toString() {
        return "<bound method " + function + " of " + receiver + ">";
    }
}
