package ai.apigraph.runtime;

/**
 * One layer of a wrapped callable.
 *
 * @param bound    whether this layer carries an implicitly bound receiver
 * @param receiver the bound receiver (may legitimately be null when bound)
 * @param next     the callable this layer wraps
 */
public record BindingLayer(boolean bound, Object receiver, Object next) {

    public static BindingLayer bound(Object receiver, Object next) {
        return new BindingLayer(true, receiver, next);
    }

    public static BindingLayer unbound(Object next) {
        return new BindingLayer(false, null, next);
    }
}
