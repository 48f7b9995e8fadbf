package ai.apigraph.graph;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.apigraph.model.Binding;
import ai.apigraph.model.MemberKind;
import ai.apigraph.model.Names;
import ai.apigraph.model.ValueKind;
import ai.apigraph.runtime.ClassAttribute;
import ai.apigraph.runtime.Reflector;

/**
 * A class declared in one of the package's internal modules. Its members are
 * {@link ClassMember}s carrying the binding category of each attribute.
 */
public final class ClassNode extends ValueNode {

    private static final Logger LOG = LoggerFactory.getLogger(ClassNode.class);

    // receiver attribute assigned at a statement start: self.x = ... / this.x = ...
    private static final Pattern INSTANCE_ASSIGNMENT =
            Pattern.compile("(?m)(?:^|[;{])[ \\t]*(?:self|this)\\.(\\w+)\\s*=(?!=)");

    private final String declaredModule;
    private final String declaredQualifiedName;
    private final MemberTable<ClassMember> members = new MemberTable<>();

    ClassNode(PackageGraph pkg, Object cls, String declaredModule, String declaredQualifiedName) {
        super(pkg, cls, ValueKind.CLASS);
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

    @Override
    Optional<String> declaredName() {
        return Optional.of(Names.simpleNameOf(declaredQualifiedName));
    }

    @Override
    public Map<String, ClassMember> members() {
        return members.asMap();
    }

    public Optional<ClassMember> member(String name) {
        return members.get(name);
    }

    /** Raw doc lines the declaring module's source gives for an instance attribute. */
    public List<String> instanceAttributeDocs(String attribute) {
        return pkg.internalModule(declaredModule)
                .map(m -> m.instanceAttributeDocs(declaredQualifiedName, attribute))
                .orElse(List.of());
    }

    @Override
    void analyzeMembers() {
        final Reflector reflector = pkg.reflector();
        final MemberClassifier classifier = new MemberClassifier(reflector);
        final Set<String> slots = reflector.slots(value());

        final Map<String, Pending> pending = new LinkedHashMap<>();
        for (ClassAttribute attribute : reflector.classAttributes(value())) {
            final MemberClassifier.Classification c = classifier.classify(value(), attribute, slots);
            pending.put(attribute.name(), new Pending(c.kind(), c.binding(), c.reason(), attribute.bound()));
        }
        mergeDocumentedAttributes(pending);

        for (var e : pending.entrySet()) {
            final String name = e.getKey();
            final Pending p = e.getValue();
            final ValueNode node = pkg.register(p.value);
            if (!node.addReference(this, name)) {
                continue;
            }
            final MemberKind kind = isDirectlyNested(node) ? MemberKind.INNER_CLASS : p.kind;
            LOG.debug("Found {}.{}: {}, {} ({})", declaredQualifiedName, name, kind, p.binding, p.reason);
            members.add(name, node, new ClassMember(kind, p.binding, p.reason, node));
        }
    }

    // documented attributes from source, upgraded to instance binding when the constructor assigns them
    private void mergeDocumentedAttributes(Map<String, Pending> pending) {
        final Optional<ModuleNode> owner = pkg.internalModule(declaredModule);
        if (owner.isEmpty()) {
            return;
        }
        final Set<String> documented = owner.get().instanceAttributeNames(declaredQualifiedName);
        if (documented.isEmpty()) {
            return;
        }
        final Set<String> assigned = constructorAssignments();
        for (String name : documented) {
            final boolean instance = assigned.contains(name);
            final Pending existing = pending.get(name);
            if (existing != null) {
                if (instance && existing.kind == MemberKind.DATA && existing.binding != Binding.INSTANCE) {
                    existing.binding = Binding.INSTANCE;
                    existing.reason = "moduleanalyzer";
                }
            } else {
                pending.put(name, new Pending(MemberKind.DATA, instance ? Binding.INSTANCE : Binding.STATIC,
                        "moduleanalyzer", new InstancePlaceholder(declaredFullyQualifiedName(), name)));
            }
        }
    }

    private Set<String> constructorAssignments() {
        final Optional<String> source = pkg.reflector().constructorSource(value());
        if (source.isEmpty()) {
            return Set.of();
        }
        final Set<String> names = new HashSet<>();
        final Matcher m = INSTANCE_ASSIGNMENT.matcher(source.get());
        while (m.find()) {
            names.add(m.group(1));
        }
        return Collections.unmodifiableSet(names);
    }

    private boolean isDirectlyNested(ValueNode node) {
        return node instanceof ClassNode inner
                && inner.declaredModule.equals(declaredModule)
                && inner.declaredQualifiedName.startsWith(declaredQualifiedName + ".")
                && inner.declaredQualifiedName.indexOf('.', declaredQualifiedName.length() + 1) < 0;
    }

    private static final class Pending {
        final MemberKind kind;
        Binding binding;
        String reason;
        final Object value;

        Pending(MemberKind kind, Binding binding, String reason, Object value) {
            this.kind = kind;
            this.binding = binding;
            this.reason = reason;
            this.value = value;
        }
    }
}
