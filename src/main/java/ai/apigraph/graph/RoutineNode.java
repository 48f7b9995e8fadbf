package ai.apigraph.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import ai.apigraph.model.Names;
import ai.apigraph.model.ValueKind;
import ai.apigraph.runtime.BindingLayer;

/**
 * A routine declared in one of the package's internal modules.
 * <p>
 * Wrapped routines (bound methods, class and static method wrappers,
 * property getters, partials, cached properties) are unwrapped to their root
 * callable, the base routine. A wrapper takes its canonical reference, name
 * and aliases from the base, so every binding of a function points back at
 * the one place it was defined.
 */
public final class RoutineNode extends ValueNode {

    private final String declaredModule;
    private final String declaredQualifiedName;
    private final List<ValueNode> boundReceivers = new ArrayList<>();
    private ValueNode baseRoutine = this;

    RoutineNode(PackageGraph pkg, Object routine, String declaredModule, String declaredQualifiedName) {
        super(pkg, routine, ValueKind.ROUTINE);
        this.declaredModule = Objects.requireNonNull(declaredModule, "declaredModule");
        this.declaredQualifiedName = Objects.requireNonNull(declaredQualifiedName, "declaredQualifiedName");
    }

    public String declaredModule() {
        return declaredModule;
    }

    public String declaredQualifiedName() {
        return declaredQualifiedName;
    }

    public String declaredFullyQualifiedName() {
        return Names.fullyQualified(declaredModule, declaredQualifiedName);
    }

    /** Receivers this routine is bound to, outermost first. */
    public List<ValueNode> boundReceivers() {
        return Collections.unmodifiableList(boundReceivers);
    }

    /** The unwrapped root callable; this node when nothing wraps it. */
    public ValueNode baseRoutine() {
        return baseRoutine;
    }

    public boolean isBound() {
        return baseRoutine != this;
    }

    private RoutineNode delegate() {
        return baseRoutine instanceof RoutineNode base && base != this ? base : null;
    }

    @Override
    Optional<String> declaredName() {
        return Optional.of(Names.simpleNameOf(declaredQualifiedName));
    }

    @Override
    public Optional<ValueNode> canonicalRef() {
        final RoutineNode base = delegate();
        return base != null ? base.canonicalRef() : super.canonicalRef();
    }

    @Override
    public void setCanonicalRef(ValueNode ref) {
        final RoutineNode base = delegate();
        if (base != null) {
            base.setCanonicalRef(ref);
        } else {
            super.setCanonicalRef(ref);
        }
    }

    /**
     * Valid references of a base routine: its own referrers, plus the
     * referrers of any wrapper bound to it.
     */
    @Override
    public boolean acceptsCanonicalRef(ValueNode ref) {
        final RoutineNode base = delegate();
        if (base != null) {
            return base.acceptsCanonicalRef(ref);
        }
        if (references().containsKey(ref)) {
            return true;
        }
        for (ValueNode wrapper : wrappers()) {
            if (wrapper.references().containsKey(ref)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public List<String> aliases(ValueNode ref) {
        final RoutineNode base = delegate();
        if (base != null) {
            return base.aliases(ref);
        }
        final List<String> own = references().get(ref);
        if (own != null) {
            return Collections.unmodifiableList(own);
        }
        for (ValueNode wrapper : wrappers()) {
            final List<String> names = wrapper.references().get(ref);
            if (names != null) {
                return Collections.unmodifiableList(names);
            }
        }
        throw new IllegalArgumentException(describeRef(ref) + " does not reference, and is not bound to, "
                + displayName());
    }

    /** Own referrers plus those of the wrappers bound to this base routine. */
    @Override
    List<ValueNode> resolutionReferrers() {
        final RoutineNode base = delegate();
        if (base != null) {
            return base.resolutionReferrers();
        }
        final List<ValueNode> out = new ArrayList<>(references().keySet());
        for (ValueNode wrapper : wrappers()) {
            for (ValueNode referrer : wrapper.references().keySet()) {
                if (!out.contains(referrer)) {
                    out.add(referrer);
                }
            }
        }
        return out;
    }

    // referrers of this base that are wrappers of it
    private List<RoutineNode> wrappers() {
        final List<RoutineNode> out = new ArrayList<>();
        for (ValueNode referrer : references().keySet()) {
            if (referrer instanceof RoutineNode r && r != this && r.baseRoutine == this) {
                out.add(r);
            }
        }
        return out;
    }

    @Override
    void analyzeMembers() {
        final Set<Object> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Object root = value();
        while (root != null && seen.add(root)) {
            final Optional<BindingLayer> layer = pkg.reflector().unwrapBinding(root);
            if (layer.isEmpty()) {
                break;
            }
            if (layer.get().bound()) {
                final ValueNode receiver = pkg.register(layer.get().receiver());
                if (!receiver.hasReference(this, "__self__")) {
                    receiver.addReference(this, "__self__");
                }
                boundReceivers.add(receiver);
            }
            root = layer.get().next();
        }

        if (root != value()) {
            final ValueNode base = pkg.register(root);
            if (!base.hasReference(this, "__func__")) {
                base.addReference(this, "__func__");
            }
            baseRoutine = base;
            if (base instanceof RoutineNode r) {
                pkg.indexCanonical(r.declaredFullyQualifiedName(), r);
            }
        }
    }
}
