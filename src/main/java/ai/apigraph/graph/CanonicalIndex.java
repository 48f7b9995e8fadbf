package ai.apigraph.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Package-wide fully-qualified-name lookup:
 * - modules by module name
 * - classes and routines by their declared {@code module::qualname}
 * - every resolved node by its canonical name, once resolution finished
 */
public final class CanonicalIndex {

    private final Map<String, ValueNode> byName = new LinkedHashMap<>();

    /** First writer wins. */
    void register(String fqn, ValueNode node) {
        byName.putIfAbsent(Objects.requireNonNull(fqn, "fqn"), Objects.requireNonNull(node, "node"));
    }

    void replace(String fqn, ValueNode node) {
        byName.put(Objects.requireNonNull(fqn, "fqn"), Objects.requireNonNull(node, "node"));
    }

    public Optional<ValueNode> lookup(String fqn) {
        return Optional.ofNullable(byName.get(fqn));
    }

    public boolean contains(String fqn) {
        return byName.containsKey(fqn);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(byName.keySet()));
    }

    public int size() {
        return byName.size();
    }
}
