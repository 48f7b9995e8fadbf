package ai.apigraph.graph;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.apigraph.model.Names;
import ai.apigraph.model.ValueKind;
import ai.apigraph.runtime.ReflectionException;
import ai.apigraph.scan.SourceAnalyzer;

/**
 * An internal module. Tracks which other internal modules it imports and
 * answers source-order questions through its {@link SourceAnalyzer}.
 */
public final class ModuleNode extends ValueNode {

    private static final Logger LOG = LoggerFactory.getLogger(ModuleNode.class);

    private final String name;
    private final Set<ModuleNode> imports = new LinkedHashSet<>();
    private final Set<ModuleNode> maybeImports = new LinkedHashSet<>();
    private final MemberTable<ValueNode> members = new MemberTable<>();
    private final SourceAnalyzer analyzer;

    ModuleNode(PackageGraph pkg, Object module) {
        super(pkg, module, ValueKind.MODULE);
        this.name = pkg.reflector().moduleName(module);
        this.analyzer = pkg.options().sourceAnalyzers().forModule(name, pkg.reflector().sourceFile(module));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String displayName() {
        return name;
    }

    /** Modules are their own canonical reference. */
    @Override
    public Optional<ValueNode> canonicalRef() {
        return Optional.of(this);
    }

    @Override
    public void setCanonicalRef(ValueNode ref) {
        if (ref != this) {
            throw new InvariantViolationException("Module " + name + " is its own canonical reference");
        }
    }

    @Override
    public boolean acceptsCanonicalRef(ValueNode ref) {
        return ref == this;
    }

    @Override
    public boolean isExternal() {
        return false;
    }

    @Override
    public Map<String, ValueNode> members() {
        return members.asMap();
    }

    /** Modules this one holds as members. */
    public Set<ModuleNode> imports() {
        return Collections.unmodifiableSet(imports);
    }

    /** Modules this one probably imported a class or routine from. */
    public Set<ModuleNode> maybeImports() {
        return Collections.unmodifiableSet(maybeImports);
    }

    void addMaybeImport(ModuleNode module) {
        if (module != this) {
            maybeImports.add(module);
        }
    }

    /** {@code imports} followed by {@code maybeImports}, without repeats. */
    public Set<ModuleNode> dependencies() {
        final Set<ModuleNode> all = new LinkedHashSet<>(imports);
        all.addAll(maybeImports);
        return all;
    }

    public SourceAnalyzer analyzer() {
        return analyzer;
    }

    public boolean inPackage() {
        return pkg.packageModules().containsKey(name);
    }

    /**
     * Declaration rank of a member, keyed by its qualified local name;
     * {@link SourceAnalyzer#UNKNOWN_ORDER} when unknown.
     */
    public int memberOrder(String qualifiedLocalName) {
        return analyzer.memberOrder(qualifiedLocalName);
    }

    public Set<String> instanceAttributeNames(String classQualifiedName) {
        return analyzer.instanceAttributeNames(classQualifiedName);
    }

    public List<String> instanceAttributeDocs(String classQualifiedName, String attribute) {
        return analyzer.instanceAttributeDocs(classQualifiedName, attribute);
    }

    @Override
    void analyzeMembers() {
        final Map<String, Object> values;
        try {
            values = new TreeMap<>(pkg.reflector().moduleMembers(value()));
        } catch (ReflectionException ex) {
            LOG.warn("Could not list members of module {}: {}", name, Names.abbreviate(ex.getMessage(), 200));
            return;
        }
        // listing members may have loaded more modules
        pkg.discoverModules();

        for (var e : values.entrySet()) {
            final ValueNode node = pkg.register(e.getValue());
            if (node.addReference(this, e.getKey())) {
                LOG.debug("Found {} in {}", e.getKey(), name);
                members.add(e.getKey(), node, node);
            }
            if (node instanceof ModuleNode m && m != this) {
                imports.add(m);
            }
        }
    }

    @Override
    public String toString() {
        return "<ModuleNode: " + name + ">";
    }
}
