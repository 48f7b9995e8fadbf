package ai.apigraph.runtime;

import java.util.Objects;

public final class Property {

    private final Object getter;

    public Property(Object getter) {
        this.getter = Objects.requireNonNull(getter, "getter");
    }

    public Object getter() {
        return getter;
    }

    @Override
    public String toString() {
        return "<property " + getter + ">";
    }
}
