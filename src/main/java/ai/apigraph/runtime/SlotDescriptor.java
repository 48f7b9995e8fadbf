package ai.apigraph.runtime;

import java.util.Objects;

/**
 * Class-body placeholder for an instance slot.
 */
public final class SlotDescriptor {

    private final ClassObject owner;
    private final String name;

    SlotDescriptor(ClassObject owner, String name) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.name = Objects.requireNonNull(name, "name");
    }

    public ClassObject owner() {
        return owner;
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return "<slot " + name + " of " + owner + ">";
    }
}
