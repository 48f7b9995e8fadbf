package ai.apigraph.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.apigraph.model.Names;
import ai.apigraph.model.ValueKind;
import ai.apigraph.runtime.ReflectionException;
import ai.apigraph.runtime.Reflector;

/**
 * The introspected package: every value reachable from the root module, the
 * names referring to each one, and the canonical definition site chosen for
 * it.
 * <p>
 * Built by {@link #analyze} in three steps:
 * - discovery of loaded modules, repeated until no new module appears
 * - member analysis from a work queue, drained to fixpoint
 * - provenance resolution: declared names first, then import-graph analysis
 *   for whatever is still ambiguous
 */
public final class PackageGraph {

    private static final Logger LOG = LoggerFactory.getLogger(PackageGraph.class);

    private static final String LOCALS_MARKER = "<locals>";

    private final Reflector reflector;
    private final IntrospectOptions options;
    private final String name;
    private final IdentityTable table = new IdentityTable();
    private final Map<String, ModuleNode> internalModules = new LinkedHashMap<>();
    private final Map<String, ModuleNode> packageModules = new LinkedHashMap<>();
    private final Map<Object, List<String>> externalRegistry = new IdentityHashMap<>();
    private final CanonicalIndex index = new CanonicalIndex();
    private final Set<String> modulesSeen = new HashSet<>();
    private List<ValueNode> pending = new ArrayList<>();
    private ModuleNode root;

    private PackageGraph(Reflector reflector, IntrospectOptions options, String name) {
        this.reflector = reflector;
        this.options = options;
        this.name = name;
    }

    /**
     * Introspects the package rooted at {@code rootModule}.
     *
     * @throws IllegalArgumentException    if {@code rootModule} is not a module
     * @throws InvariantViolationException on an internal consistency failure
     */
    public static PackageGraph analyze(Reflector reflector, Object rootModule, IntrospectOptions options) {
        Objects.requireNonNull(reflector, "reflector");
        Objects.requireNonNull(options, "options");
        if (rootModule == null || !reflector.isModule(rootModule)
                || reflector.kindOf(rootModule) != ValueKind.MODULE) {
            throw new IllegalArgumentException("Package root must be a module: " + rootModule);
        }
        final PackageGraph graph = new PackageGraph(reflector, options, reflector.moduleName(rootModule));
        graph.build(rootModule);
        return graph;
    }

    private void build(Object rootModule) {
        modulesSeen.add(name);
        root = (ModuleNode) register(rootModule, true, true, true);

        discoverModules();
        LOG.debug("{} internal modules, {} in package, {} externally exposed values",
                internalModules.size(), packageModules.size(), externalRegistry.size());

        analyzePending();
        resolveSources();
        LOG.info("Analyzed package {}: {} modules, {} values, {} indexed names",
                name, packageModules.size(), table.size(), index.size());
    }

    // -- discovery ---

    /**
     * Classifies modules loaded since the last call. Inspecting a module can
     * load others, so this repeats until a pass finds nothing new.
     */
    void discoverModules() {
        boolean seenNew = true;
        while (seenNew) {
            seenNew = false;
            final Map<String, Object> loaded = reflector.loadedModules();
            for (String moduleName : new TreeSet<>(loaded.keySet())) {
                if (!modulesSeen.add(moduleName)) {
                    continue;
                }
                seenNew = true;
                final Object module = loaded.get(moduleName);
                switch (options.moduleFilter().classify(name, moduleName, reflector.isModule(module))) {
                    case EXTERNAL -> {
                        LOG.debug("Excluding module {} (external)", moduleName);
                        markExternalModule(moduleName, module);
                    }
                    case PRIVATE -> {
                        LOG.debug("Excluding module {} (private)", moduleName);
                        register(module, true, false, false);
                    }
                    case NON_MODULE -> {
                        LOG.debug("Excluding module {} (non-module)", moduleName);
                        register(module, true, false, false);
                    }
                    case INCLUDED -> register(module, true, true, true);
                }
            }
        }
    }

    private void markExternalModule(String moduleName, Object module) {
        if (!reflector.isModule(module)) {
            LOG.debug("Skipping external non-module {}", moduleName);
            return;
        }
        final Map<String, Object> members;
        try {
            members = reflector.moduleMembers(module);
        } catch (ReflectionException ex) {
            LOG.debug("Cannot list members of external module {}: {}", moduleName, ex.getMessage());
            return;
        }
        for (Object value : members.values()) {
            if (!IdentityTable.isImmutable(value)) {
                markExternal(value, moduleName);
            }
        }
        markExternal(module, moduleName);
    }

    private void markExternal(Object value, String moduleName) {
        externalRegistry.computeIfAbsent(value, k -> new ArrayList<>()).add(moduleName);
        final ValueNode existing = table.find(value);
        if (existing != null) {
            existing.addExternalMarks(List.of(moduleName));
        }
    }

    // -- registration ---

    /** Node for {@code value}, created and queued for analysis on first sight. */
    public ValueNode register(Object value) {
        return register(value, false, false, true);
    }

    /**
     * @param asModule  whether a module value may become a {@link ModuleNode}
     * @param inPackage whether such a module counts as part of the package
     * @param analyze   whether to queue the new node for member analysis
     */
    ValueNode register(Object value, boolean asModule, boolean inPackage, boolean analyze) {
        final ValueNode existing = table.find(value);
        if (existing != null) {
            return existing;
        }
        final ValueNode node = table.register(value, v -> create(v, asModule));
        if (!node.isImmutable()) {
            final List<String> marks = externalRegistry.get(value);
            if (marks != null) {
                node.addExternalMarks(marks);
            }
        }
        if (node instanceof ModuleNode m) {
            internalModules.putIfAbsent(m.name(), m);
            index.register(m.name(), m);
            if (inPackage) {
                packageModules.putIfAbsent(m.name(), m);
            }
        } else if (node instanceof ClassNode c) {
            index.register(c.declaredFullyQualifiedName(), c);
        } else if (node instanceof RoutineNode r) {
            index.register(r.declaredFullyQualifiedName(), r);
        }
        if (analyze) {
            pending.add(node);
        }
        return node;
    }

    // classes and routines only specialize when declared in an internal module
    private ValueNode create(Object value, boolean asModule) {
        final ValueKind kind = reflector.kindOf(value);
        if (kind == ValueKind.MODULE && asModule) {
            return new ModuleNode(this, value);
        }
        if (kind == ValueKind.CLASS || kind == ValueKind.ROUTINE) {
            final Optional<String> module = reflector.declaringModule(value);
            final Optional<String> qualifiedName = reflector.qualifiedName(value);
            if (module.isPresent() && qualifiedName.isPresent() && internalModules.containsKey(module.get())) {
                return kind == ValueKind.CLASS
                        ? new ClassNode(this, value, module.get(), qualifiedName.get())
                        : new RoutineNode(this, value, module.get(), qualifiedName.get());
            }
        }
        return new ValueNode(this, value, kind);
    }

    void indexCanonical(String fqn, ValueNode node) {
        index.replace(fqn, node);
    }

    private void analyzePending() {
        int pass = 1;
        while (!pending.isEmpty()) {
            LOG.debug("Analyzing nested members (pass {}, {} values)", pass, pending.size());
            final List<ValueNode> batch = pending;
            pending = new ArrayList<>();
            for (ValueNode node : batch) {
                node.analyze();
            }
            pass++;
        }
        LOG.debug("Finished analyzing members after {} passes", pass - 1);
    }

    // -- provenance resolution ---

    private void resolveSources() {
        final List<ValueNode> nodes = new ArrayList<>(table.nodes());
        for (ValueNode node : nodes) {
            if (!skipResolution(node)) {
                if (node instanceof ClassNode c) {
                    resolveDeclared(c, c.declaredModule(), c.declaredQualifiedName());
                } else if (node instanceof RoutineNode r) {
                    resolveDeclared(r, r.declaredModule(), r.declaredQualifiedName());
                }
            }
        }
        for (ValueNode node : nodes) {
            if (!skipResolution(node)) {
                resolveByImports(node);
            }
        }
        for (ValueNode node : nodes) {
            if (node instanceof RoutineNode r && r.isBound()) {
                continue;
            }
            node.tryFullyQualifiedName().ifPresent(fqn -> index.register(fqn, node));
        }
    }

    private static boolean skipResolution(ValueNode node) {
        return node.isExternal()
                || node.isResolved()
                || node.references().isEmpty()
                || node instanceof ModuleNode;
    }

    private void resolveDeclared(ValueNode node, String module, String qualifiedName) {
        final ModuleNode owner = packageModules.get(module);
        if (owner == null) {
            // declared in an excluded module; left to import analysis
            return;
        }
        final String parentFqn = Names.fullyQualified(module, Names.parentOf(qualifiedName));
        if (!parentFqn.contains(LOCALS_MARKER)) {
            final ValueNode parent = index.lookup(parentFqn).orElseThrow(() -> new InvariantViolationException(
                    "Declared name " + Names.fullyQualified(module, qualifiedName) + " has no indexed parent "
                            + parentFqn));
            if (node.acceptsCanonicalRef(parent)) {
                LOG.debug("Set canonical reference: {} -> {}", parentFqn, node);
                node.setCanonicalRef(parent);
            } else {
                LOG.debug("Cannot use declared parent {} for {}: reference was excluded", parentFqn, node);
            }
        }

        for (ValueNode referrer : node.references().keySet()) {
            final String referrerModule = owningModuleName(referrer);
            if (referrerModule != null && !referrerModule.equals(module)) {
                final ModuleNode m = packageModules.get(referrerModule);
                if (m != null) {
                    m.addMaybeImport(owner);
                }
            }
        }
    }

    private static String owningModuleName(ValueNode node) {
        if (node instanceof ModuleNode m) {
            return m.name();
        }
        if (node instanceof ClassNode c) {
            return c.declaredModule();
        }
        if (node instanceof RoutineNode r) {
            return r.declaredModule();
        }
        return null;
    }

    private void resolveByImports(ValueNode node) {
        final List<ValueNode> referrers = node.resolutionReferrers();
        // module referrers first, so a module referencing the value sits at the head of its list
        final Map<ModuleNode, List<ValueNode>> byModule = new LinkedHashMap<>();
        for (ValueNode referrer : referrers) {
            if (referrer instanceof ModuleNode m) {
                byModule.computeIfAbsent(m, k -> new ArrayList<>()).add(m);
            }
        }
        for (ValueNode referrer : referrers) {
            if (referrer instanceof ClassNode c) {
                final ModuleNode m = packageModules.get(c.declaredModule());
                if (m != null) {
                    byModule.computeIfAbsent(m, k -> new ArrayList<>()).add(c);
                }
            }
        }
        if (byModule.isEmpty()) {
            return;
        }

        final ModuleNode best;
        if (byModule.size() == 1) {
            best = byModule.keySet().iterator().next();
        } else {
            best = new ImportGraph<>(byModule.keySet(), ModuleNode::dependencies, ModuleNode::name)
                    .resolveSource(ownerHints(node), node.displayName());
        }

        final List<ValueNode> candidates = byModule.get(best);
        final ValueNode chosen;
        if (candidates.get(0) == best) {
            chosen = best;
        } else {
            final List<ValueNode> ranked = new ArrayList<>();
            for (ValueNode candidate : candidates) {
                if (!canonicalChainReaches(candidate, node)) {
                    ranked.add(candidate);
                }
            }
            if (ranked.isEmpty()) {
                LOG.debug("Leaving {} unresolved: every class referrer in {} is named through it", node, best.name());
                return;
            }
            ranked.sort(Comparator.<ValueNode>comparingInt(PackageGraph::referenceCount).reversed()
                    .thenComparing(c -> ((ClassNode) c).declaredQualifiedName()));
            chosen = ranked.get(0);
        }
        LOG.debug("Resolved {} to {} via module {}", node, chosen, best.name());
        node.setCanonicalRef(chosen);
    }

    // true when target lies on the canonical chain starting at node
    private static boolean canonicalChainReaches(ValueNode node, ValueNode target) {
        final Set<ValueNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        ValueNode current = node;
        while (current != null && seen.add(current)) {
            if (current == target) {
                return true;
            }
            current = current.canonicalRef().orElse(null);
        }
        return false;
    }

    private static int referenceCount(ValueNode node) {
        int count = 0;
        for (List<String> names : node.references().values()) {
            count += names.size();
        }
        return count;
    }

    private List<String> ownerHints(ValueNode node) {
        final List<String> hints = new ArrayList<>();
        for (Object type : reflector.typeLineage(node.value())) {
            reflector.declaringModule(type).ifPresent(hints::add);
        }
        return hints;
    }

    // -- accessors ---

    public String name() {
        return name;
    }

    public ModuleNode root() {
        return root;
    }

    public Reflector reflector() {
        return reflector;
    }

    public IntrospectOptions options() {
        return options;
    }

    /** Modules belonging to the package, by name. */
    public Map<String, ModuleNode> packageModules() {
        return Collections.unmodifiableMap(packageModules);
    }

    /** Package modules plus excluded internal ones (private, non-module entries). */
    public Map<String, ModuleNode> internalModules() {
        return Collections.unmodifiableMap(internalModules);
    }

    public Optional<ModuleNode> internalModule(String moduleName) {
        return Optional.ofNullable(internalModules.get(moduleName));
    }

    /** Every node, in registration order. */
    public List<ValueNode> nodes() {
        return table.nodes();
    }

    /** Node of a non-scalar value, if one was registered. */
    public Optional<ValueNode> node(Object value) {
        return Optional.ofNullable(table.find(value));
    }

    public Optional<ValueNode> lookup(String fullyQualifiedName) {
        return index.lookup(fullyQualifiedName);
    }

    public CanonicalIndex index() {
        return index;
    }

    /** External module names exposing {@code value}. */
    public List<String> externalModulesOf(Object value) {
        final List<String> marks = externalRegistry.get(value);
        return marks == null ? List.of() : Collections.unmodifiableList(marks);
    }
}
