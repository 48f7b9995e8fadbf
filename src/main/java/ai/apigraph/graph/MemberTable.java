package ai.apigraph.graph;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Members of a node by name. Aliases of one value share a single payload: the
 * first payload stored for a value is reused for every later name.
 */
public final class MemberTable<M> {

    private final Map<String, M> byName = new LinkedHashMap<>();
    private final Map<ValueNode, M> byValue = new IdentityHashMap<>();

    /** Stores a member and returns the payload actually kept for it. */
    public M add(String name, ValueNode value, M payload) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(payload, "payload");
        final M stored = byValue.computeIfAbsent(value, k -> payload);
        byName.put(name, stored);
        return stored;
    }

    public Optional<M> get(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public Map<String, M> asMap() {
        return Collections.unmodifiableMap(byName);
    }

    public int size() {
        return byName.size();
    }
}
