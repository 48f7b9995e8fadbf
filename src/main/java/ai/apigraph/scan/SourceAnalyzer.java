package ai.apigraph.scan;

import java.util.List;
import java.util.Set;

/**
 * Per-module source analysis: the two facts runtime reflection cannot give,
 * declaration order and documented instance attributes. Implementations never
 * throw; without source they answer "unknown" or empty.
 */
public interface SourceAnalyzer {

    int UNKNOWN_ORDER = Integer.MAX_VALUE;

    SourceAnalyzer NONE = new SourceAnalyzer() {
        @Override
        public int memberOrder(String qualifiedLocalName) {
            return UNKNOWN_ORDER;
        }

        @Override
        public Set<String> instanceAttributeNames(String classQualifiedName) {
            return Set.of();
        }

        @Override
        public List<String> instanceAttributeDocs(String classQualifiedName, String attribute) {
            return List.of();
        }

        @Override
        public String toString() {
            return "SourceAnalyzer.NONE";
        }
    };

    /**
     * Rank of a declaration in its source file, usable as a sort key;
     * {@link #UNKNOWN_ORDER} when not found.
     */
    int memberOrder(String qualifiedLocalName);

    /** Documented attribute names of a class, in declaration order. */
    Set<String> instanceAttributeNames(String classQualifiedName);

    /** Raw documentation lines of one attribute. */
    List<String> instanceAttributeDocs(String classQualifiedName, String attribute);
}
