package ai.apigraph.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import ai.apigraph.runtime.Sentinel;

/**
 * Deduplicates reflected values by identity.
 * <p>
 * Immutable scalars are the exception: identity says nothing useful about
 * them (two unrelated literals {@code 0} are not the same declared value), so
 * each occurrence gets its own node. Node order is kept so that iteration is
 * deterministic.
 */
final class IdentityTable {

    private final Map<Object, ValueNode> byIdentity = new IdentityHashMap<>();
    private final List<ValueNode> nodes = new ArrayList<>();

    static boolean isImmutable(Object value) {
        return value == null
                || value instanceof String
                || value instanceof Number
                || value instanceof Boolean
                || value instanceof Character
                || value instanceof Sentinel;
    }

    ValueNode find(Object value) {
        if (isImmutable(value)) {
            return null;
        }
        return byIdentity.get(value);
    }

    /** Returns the node for {@code value}, creating it with {@code factory} on first sight. */
    ValueNode register(Object value, Function<Object, ValueNode> factory) {
        final ValueNode existing = find(value);
        if (existing != null) {
            return existing;
        }
        final ValueNode node = factory.apply(value);
        if (!isImmutable(value)) {
            byIdentity.put(value, node);
        }
        nodes.add(node);
        return node;
    }

    List<ValueNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    int size() {
        return nodes.size();
    }
}
