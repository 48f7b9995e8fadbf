package ai.apigraph.graph;

/**
 * Host policy deciding which references are recorded.
 */
@FunctionalInterface
public interface VariableFilter {

    /**
     * @param pkg    the graph being built
     * @param parent the node the value was found in
     * @param value  the referenced value
     * @param name   the name {@code parent} uses for it
     * @return true to drop the reference
     */
    boolean exclude(PackageGraph pkg, ValueNode parent, ValueNode value, String name);

    static VariableFilter defaults() {
        return DefaultVariableFilter.INSTANCE;
    }

    static VariableFilter none() {
        return (pkg, parent, value, name) -> false;
    }
}
