package ai.apigraph.graph;

import java.util.Objects;

/**
 * Stands in for a documented instance attribute that has no value on the
 * class itself.
 */
public final class InstancePlaceholder {

    private final String owner;
    private final String attribute;

    InstancePlaceholder(String owner, String attribute) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.attribute = Objects.requireNonNull(attribute, "attribute");
    }

    public String owner() {
        return owner;
    }

    public String attribute() {
        return attribute;
    }

    @Override
    public String toString() {
        return "<instance attribute " + owner + "." + attribute + ">";
    }
}
