package ai.apigraph.graph;

import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.apigraph.model.Names;

/**
 * Drops private names, external values outside classes, and special names.
 * Special names survive in two cases: {@code __all__} and
 * {@code __version__} on the root package, and routines found in a class body
 * or linked as {@code __func__}.
 */
final class DefaultVariableFilter implements VariableFilter {

    static final DefaultVariableFilter INSTANCE = new DefaultVariableFilter();

    private static final Logger LOG = LoggerFactory.getLogger(DefaultVariableFilter.class);
    private static final Set<String> ROOT_SPECIALS = Set.of("__all__", "__version__");

    private DefaultVariableFilter() {
    }

    @Override
    public boolean exclude(PackageGraph pkg, ValueNode parent, ValueNode value, String name) {
        final boolean classMember = parent instanceof ClassNode;
        if (Names.isPrivate(name)) {
            LOG.debug("Excluding {} (private); {}", name, value);
            return true;
        }
        if (!classMember && value.isExternal()) {
            LOG.debug("Excluding {} (external); {}", name, value);
            return true;
        }
        if (Names.isSpecial(name)) {
            final boolean rootSpecial = ROOT_SPECIALS.contains(name) && parent == pkg.root();
            final boolean routine = value instanceof RoutineNode && (classMember || "__func__".equals(name));
            if (!rootSpecial && !routine) {
                LOG.debug("Excluding {} (special); {}", name, value);
                return true;
            }
        }
        return false;
    }
}
