package ai.apigraph.graph;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.apigraph.runtime.ReflectionException;
import ai.apigraph.runtime.Reflector;

/**
 * Caller-owned memo of analyzed packages, keyed by package name. Entries stay
 * until explicitly invalidated.
 */
public final class PackageCache {

    private static final Logger LOG = LoggerFactory.getLogger(PackageCache.class);

    private final Map<String, PackageGraph> graphs = new LinkedHashMap<>();

    /**
     * Cached graph for {@code packageName}, analyzing it on first request.
     *
     * @throws ReflectionException if no loaded module has that name
     */
    public PackageGraph analyze(String packageName, Reflector reflector, IntrospectOptions options)
            throws ReflectionException {
        Objects.requireNonNull(packageName, "packageName");
        final PackageGraph cached = graphs.get(packageName);
        if (cached != null) {
            LOG.debug("Using cached graph for package {}", packageName);
            return cached;
        }
        final Object root = reflector.loadedModules().get(packageName);
        if (root == null) {
            throw new ReflectionException("No module named " + packageName);
        }
        final PackageGraph graph = PackageGraph.analyze(reflector, root, options);
        graphs.put(packageName, graph);
        return graph;
    }

    public Optional<PackageGraph> get(String packageName) {
        return Optional.ofNullable(graphs.get(packageName));
    }

    public boolean invalidate(String packageName) {
        return graphs.remove(packageName) != null;
    }

    public void clear() {
        graphs.clear();
    }

    public int size() {
        return graphs.size();
    }
}
