package ai.apigraph.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An instance of a {@link ClassObject}.
 */
public final class InstanceObject {

    private final ClassObject type;
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    public InstanceObject(ClassObject type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    public ClassObject type() {
        return type;
    }

    public InstanceObject set(String attribute, Object value) {
        attributes.put(Objects.requireNonNull(attribute, "attribute"), value);
        return this;
    }

    public Map<String, Object> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    @Override
    public String toString() {
        return "<" + type.qualifiedName() + " instance>";
    }
}
