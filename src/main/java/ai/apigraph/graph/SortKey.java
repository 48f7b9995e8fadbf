package ai.apigraph.graph;

import java.util.Comparator;

/**
 * Source ordering of a reference: declaration rank first, then name.
 */
public record SortKey(int rank, String name) implements Comparable<SortKey> {

    private static final Comparator<SortKey> ORDER = Comparator.comparingInt(SortKey::rank)
            .thenComparing(SortKey::name);

    @Override
    public int compareTo(SortKey other) {
        return ORDER.compare(this, other);
    }
}
