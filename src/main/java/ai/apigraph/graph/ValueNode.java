package ai.apigraph.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import ai.apigraph.model.Names;
import ai.apigraph.model.ValueKind;
import ai.apigraph.scan.SourceAnalyzer;

/**
 * One reflected value of the package, with every name that refers to it.
 * <p>
 * Nodes are created by {@link PackageGraph#register(Object)} and never
 * removed. The canonical reference is the referrer the value is considered to
 * be defined in; the chain of canonical references ends at a module and makes
 * up the fully qualified name.
 */
public class ValueNode {

    private static final int ANONYMOUS_LIMIT = 50;

    protected final PackageGraph pkg;
    private final Object value;
    private final ValueKind kind;
    private final boolean immutable;
    private final Map<ValueNode, List<String>> references = new LinkedHashMap<>();
    private final Set<String> externalMarks = new LinkedHashSet<>();
    ValueNode canonical;
    private boolean analyzed;

    ValueNode(PackageGraph pkg, Object value, ValueKind kind) {
        this.pkg = Objects.requireNonNull(pkg, "pkg");
        this.value = value;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.immutable = IdentityTable.isImmutable(value);
    }

    public Object value() {
        return value;
    }

    public ValueKind kind() {
        return kind;
    }

    public PackageGraph packageGraph() {
        return pkg;
    }

    // -- references ---

    /**
     * Records that {@code referrer} reaches this value under {@code name}.
     *
     * @return false when the variable filter rejected the reference
     * @throws InvariantViolationException if the pair was already recorded
     */
    public boolean addReference(ValueNode referrer, String name) {
        Objects.requireNonNull(referrer, "referrer");
        Objects.requireNonNull(name, "name");
        if (pkg.options().variableFilter().exclude(pkg, referrer, this, name)) {
            return false;
        }
        final List<String> names = references.computeIfAbsent(referrer, k -> new ArrayList<>(1));
        if (names.contains(name)) {
            throw new InvariantViolationException("Duplicate reference " + name + " from "
                    + referrer.displayName() + " to " + displayName());
        }
        names.add(name);
        return true;
    }

    public boolean hasReference(ValueNode referrer, String name) {
        final List<String> names = references.get(referrer);
        return names != null && names.contains(name);
    }

    /** Referrer to names, in the order references were recorded. */
    public Map<ValueNode, List<String>> references() {
        return Collections.unmodifiableMap(references);
    }

    public List<Reference> referenceList() {
        final List<Reference> out = new ArrayList<>();
        for (var e : references.entrySet()) {
            for (String name : e.getValue()) {
                out.add(new Reference(e.getKey(), name));
            }
        }
        return out;
    }

    public Optional<Reference> anyReference() {
        for (var e : references.entrySet()) {
            return Optional.of(new Reference(e.getKey(), e.getValue().get(0)));
        }
        return Optional.empty();
    }

    /**
     * Names under which {@code ref} reaches this value.
     *
     * @throws IllegalArgumentException if {@code ref} does not reference it
     */
    public List<String> aliases(ValueNode ref) {
        final List<String> names = references.get(ref);
        if (names == null) {
            throw new IllegalArgumentException(describeRef(ref) + " does not reference " + displayName());
        }
        return Collections.unmodifiableList(names);
    }

    static String describeRef(ValueNode ref) {
        return ref == null ? "null" : ref.displayName();
    }

    void addExternalMarks(List<String> modules) {
        externalMarks.addAll(modules);
    }

    public Set<String> externalMarks() {
        return Collections.unmodifiableSet(externalMarks);
    }

    /** Named members; empty for values that are not modules or classes. */
    public Map<String, ?> members() {
        return Map.of();
    }

    // -- canonical reference ---

    public Optional<ValueNode> canonicalRef() {
        return Optional.ofNullable(canonical);
    }

    /**
     * Sets the canonical reference once. Setting the same reference again is a
     * no-op.
     *
     * @throws InvariantViolationException if another reference is already set
     *                                     or {@code ref} does not reference this value
     */
    public void setCanonicalRef(ValueNode ref) {
        Objects.requireNonNull(ref, "ref");
        if (canonical == ref) {
            return;
        }
        if (canonical != null) {
            throw new InvariantViolationException("Canonical reference of " + displayName()
                    + " already set to " + canonical.displayName());
        }
        if (!acceptsCanonicalRef(ref)) {
            throw new InvariantViolationException(ref.displayName() + " does not reference " + displayName());
        }
        canonical = ref;
    }

    public boolean acceptsCanonicalRef(ValueNode ref) {
        return references.containsKey(ref);
    }

    /** Referrers provenance resolution chooses among. */
    List<ValueNode> resolutionReferrers() {
        return new ArrayList<>(references.keySet());
    }

    public boolean isResolved() {
        return canonicalRef().isPresent();
    }

    // -- naming ---

    /**
     * Primary name under the canonical reference.
     *
     * @throws IllegalStateException if unresolved
     */
    public String name() {
        final ValueNode ref = canonicalRef().orElseThrow(
                () -> new IllegalStateException("No canonical reference for " + displayName()));
        return preferredAlias(aliases(ref));
    }

    /** Name hint used to pick among aliases; classes and routines know their declared name. */
    Optional<String> declaredName() {
        return Optional.empty();
    }

    private String preferredAlias(List<String> aliases) {
        final Optional<String> declared = declaredName();
        if (declared.isPresent() && aliases.contains(declared.get())) {
            return declared.get();
        }
        return aliases.get(0);
    }

    /** Never throws: {@code ?<value>} when unresolved. */
    public String displayName() {
        if (!isResolved()) {
            return "?<" + Names.abbreviate(pkg.reflector().describe(value), ANONYMOUS_LIMIT) + ">";
        }
        return name();
    }

    /**
     * Qualified name without the module, built along the canonical chain.
     *
     * @throws IllegalStateException if any link of the chain is unresolved
     */
    public String qualifiedName() {
        final Deque<String> parts = new ArrayDeque<>();
        final ModuleNode module = walkCanonicalChain(parts);
        return module == this ? "" : String.join(".", parts);
    }

    public String moduleName() {
        return walkCanonicalChain(new ArrayDeque<>()).name();
    }

    public String fullyQualifiedName() {
        final Deque<String> parts = new ArrayDeque<>();
        final ModuleNode module = walkCanonicalChain(parts);
        return Names.fullyQualified(module.name(), String.join(".", parts));
    }

    public Optional<String> tryFullyQualifiedName() {
        try {
            return Optional.of(fullyQualifiedName());
        } catch (InvariantViolationException ex) {
            throw ex;
        } catch (IllegalStateException ex) {
            return Optional.empty();
        }
    }

    private ModuleNode walkCanonicalChain(Deque<String> parts) {
        final Set<ValueNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        ValueNode node = this;
        while (!(node instanceof ModuleNode)) {
            if (!seen.add(node)) {
                throw new InvariantViolationException("Canonical reference cycle at " + node.displayName());
            }
            final ValueNode ref = node.canonicalRef().orElse(null);
            if (ref == null) {
                throw new IllegalStateException("No canonical reference for " + node.displayName());
            }
            parts.addFirst(node.name());
            node = ref;
        }
        return (ModuleNode) node;
    }

    // -- classification ---

    /** A class, routine or module declared outside the package's internal modules. */
    public boolean isForeign() {
        return getClass() == ValueNode.class && kind != ValueKind.DATA;
    }

    public boolean isExternal() {
        return isForeign() || (!externalMarks.isEmpty() && !isResolved());
    }

    public boolean isPrivate() {
        return Names.isPrivate(currentName());
    }

    public boolean isSpecial() {
        return Names.isSpecial(currentName());
    }

    private String currentName() {
        if (isResolved()) {
            return name();
        }
        return anyReference().map(Reference::name).orElse("");
    }

    public boolean isImmutable() {
        return immutable;
    }

    // -- ordering ---

    /** Source order under the canonical reference, or the first reference when unresolved. */
    public SortKey order() {
        final Optional<ValueNode> ref = canonicalRef();
        if (ref.isPresent() && ref.get() != this) {
            return order(ref.get(), name());
        }
        return anyReference()
                .map(r -> order(r.referrer(), r.name()))
                .orElse(new SortKey(SourceAnalyzer.UNKNOWN_ORDER, ""));
    }

    /** Source order of this value as {@code name} inside {@code ref}. */
    public SortKey order(ValueNode ref, String name) {
        int rank = SourceAnalyzer.UNKNOWN_ORDER;
        if (ref instanceof ModuleNode m) {
            rank = m.memberOrder(name);
        } else if (ref instanceof ClassNode c) {
            final Optional<ModuleNode> owner = pkg.internalModule(c.declaredModule());
            if (owner.isPresent()) {
                rank = owner.get().memberOrder(c.declaredQualifiedName() + "." + name);
            }
        }
        return new SortKey(rank, name);
    }

    // -- analysis ---

    public boolean isAnalyzed() {
        return analyzed;
    }

    /** Runs member analysis once; later calls do nothing. */
    final void analyze() {
        if (analyzed) {
            return;
        }
        analyzed = true;
        analyzeMembers();
    }

    void analyzeMembers() {
    }

    @Override
    public String toString() {
        return "<" + getClass().getSimpleName() + ": " + displayName() + ">";
    }
}
