package ai.apigraph.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Import graph over the modules that reference one value, used to guess which
 * of them the value came from.
 * <p>
 * An edge {@code A -> B} means A imports B. Cycles are found by depth-first
 * traversal and collapsed into meta vertices until the graph is acyclic.
 * Vertices that import nothing are the source candidates; a meta vertex
 * contributes all of its modules.
 *
 * @param <M> module type
 */
public final class ImportGraph<M> {

    private static final Logger LOG = LoggerFactory.getLogger(ImportGraph.class);

    private final Function<M, String> nameOf;
    private final Map<M, Atom<M>> atoms = new LinkedHashMap<>();
    private final List<Vertex> vertices = new ArrayList<>();
    private int collapsed;

    /**
     * @param modules   modules referencing the value
     * @param importsOf modules each module imports; modules outside
     *                  {@code modules} are ignored
     * @param nameOf    module name, used for hints and the final tie-break
     */
    public ImportGraph(Collection<M> modules, Function<M, ? extends Collection<M>> importsOf,
            Function<M, String> nameOf) {
        Objects.requireNonNull(modules, "modules");
        Objects.requireNonNull(importsOf, "importsOf");
        this.nameOf = Objects.requireNonNull(nameOf, "nameOf");

        for (M m : modules) {
            atoms.computeIfAbsent(m, Atom::new);
        }
        for (Atom<M> atom : atoms.values()) {
            for (M dep : importsOf.apply(atom.module)) {
                final Atom<M> target = atoms.get(dep);
                if (target != null && atom.imports.add(target)) {
                    target.importedBy++;
                    atom.importCount++;
                }
            }
        }
        vertices.addAll(atoms.values());
        collapseCycles();
    }

    private void collapseCycles() {
        List<Vertex> cycle;
        while ((cycle = findCycle()) != null) {
            final Meta meta = new Meta(cycle);
            removeAll(vertices, cycle);
            for (Vertex other : vertices) {
                if (removeAll(other.imports, cycle)) {
                    other.imports.add(meta);
                }
            }
            vertices.add(meta);
            collapsed++;
        }
        if (collapsed > 0) {
            LOG.debug("Collapsed {} import cycles", collapsed);
        }
    }

    private List<Vertex> findCycle() {
        final Set<Vertex> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        final List<Vertex> stack = new ArrayList<>();
        for (Vertex v : vertices) {
            final List<Vertex> cycle = visit(v, visited, stack);
            if (cycle != null) {
                return cycle;
            }
        }
        return null;
    }

    // cycle: the stack suffix starting at the first repeated vertex
    private static List<Vertex> visit(Vertex v, Set<Vertex> visited, List<Vertex> stack) {
        if (visited.contains(v)) {
            final int i = indexOf(stack, v);
            return i >= 0 ? new ArrayList<>(stack.subList(i, stack.size())) : null;
        }
        visited.add(v);
        if (v.imports.isEmpty()) {
            return null;
        }
        stack.add(v);
        for (Vertex dep : v.imports) {
            final List<Vertex> cycle = visit(dep, visited, stack);
            if (cycle != null) {
                return cycle;
            }
        }
        stack.remove(stack.size() - 1);
        return null;
    }

    private static int indexOf(List<Vertex> list, Vertex v) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) == v) {
                return i;
            }
        }
        return -1;
    }

    private static boolean removeAll(Collection<Vertex> from, List<Vertex> drop) {
        return from.removeIf(v -> indexOf(drop, v) >= 0);
    }

    /** Modules that import no other module of the graph, after cycle collapse. */
    public List<M> candidates() {
        final List<M> out = new ArrayList<>();
        for (Atom<M> atom : candidateAtoms()) {
            out.add(atom.module);
        }
        return out;
    }

    private List<Atom<M>> candidateAtoms() {
        final List<Atom<M>> out = new ArrayList<>();
        for (Vertex v : vertices) {
            if (!v.imports.isEmpty()) {
                continue;
            }
            if (v instanceof Meta meta) {
                for (Atom<?> member : meta.members) {
                    out.add(cast(member));
                }
            } else {
                out.add(cast(v));
            }
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private Atom<M> cast(Vertex v) {
        return (Atom<M>) v;
    }

    /**
     * Picks the source module:
     * - the only candidate, if there is one
     * - else the first of {@code ownerHints} naming a candidate
     * - else the candidate imported by the most modules, then importing the
     *   fewest, then by name
     *
     * @param ownerHints  module names declared along the value's type lineage,
     *                    nearest type first
     * @param description value description for the error message
     * @throws InvariantViolationException if there is no candidate
     */
    public M resolveSource(List<String> ownerHints, String description) {
        final List<Atom<M>> candidates = candidateAtoms();
        if (candidates.isEmpty()) {
            throw new InvariantViolationException("Import graph has no source candidate for " + description);
        }
        if (candidates.size() == 1) {
            return candidates.get(0).module;
        }
        final Map<String, M> byName = new LinkedHashMap<>();
        for (Atom<M> atom : candidates) {
            byName.putIfAbsent(nameOf.apply(atom.module), atom.module);
        }
        for (String hint : ownerHints) {
            final M hinted = byName.get(hint);
            if (hinted != null) {
                return hinted;
            }
        }
        final List<Atom<M>> ranked = new ArrayList<>(candidates);
        ranked.sort(Comparator.<Atom<M>>comparingInt(a -> -a.importedBy)
                .thenComparingInt(a -> a.importCount)
                .thenComparing(a -> nameOf.apply(a.module)));
        return ranked.get(0).module;
    }

    public int importedBy(M module) {
        final Atom<M> atom = atoms.get(module);
        return atom == null ? 0 : atom.importedBy;
    }

    public int importCount(M module) {
        final Atom<M> atom = atoms.get(module);
        return atom == null ? 0 : atom.importCount;
    }

    private abstract static class Vertex {
        final Set<Vertex> imports = new LinkedHashSet<>();
    }

    private static final class Atom<M> extends Vertex {
        final M module;
        int importedBy;
        int importCount;

        Atom(M module) {
            this.module = module;
        }
    }

    private static final class Meta extends Vertex {
        final List<Atom<?>> members = new ArrayList<>();

        Meta(List<Vertex> cycle) {
            for (Vertex v : cycle) {
                if (v instanceof Meta nested) {
                    members.addAll(nested.members);
                } else {
                    members.add((Atom<?>) v);
                }
                imports.addAll(v.imports);
            }
            removeAll(imports, cycle);
        }
    }
}
