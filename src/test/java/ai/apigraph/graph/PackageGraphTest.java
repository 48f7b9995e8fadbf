package ai.apigraph.graph;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import ai.apigraph.model.Binding;
import ai.apigraph.model.MemberKind;
import ai.apigraph.runtime.ClassMethod;
import ai.apigraph.runtime.ClassObject;
import ai.apigraph.runtime.FunctionObject;
import ai.apigraph.runtime.InstanceObject;
import ai.apigraph.runtime.ModuleObject;
import ai.apigraph.runtime.ObjectSpace;
import ai.apigraph.runtime.Property;
import ai.apigraph.runtime.StaticMethod;
import ai.apigraph.scan.SourceAnalyzer;
import ai.apigraph.scan.SourceAnalyzerFactory;

import static ai.apigraph.runtime.FunctionObject.Parameter.positional;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Integration tests for PackageGraph over small in-memory object spaces.
 */
class PackageGraphTest {

    private ObjectSpace space;
    private ClassObject circle;
    private ModuleObject root;
    private ModuleObject shapes;
    private InstanceObject defaultCircle;

    /*
     * pkg          : shapes, Circle, VERSION, __version__, _hidden
     * pkg.shapes   : Circle, DEFAULT, area
     */
    @BeforeEach
    void setUp() {
        space = new ObjectSpace();
        circle = new ClassObject("pkg.shapes", "Circle");
        circle.set("__init__", fn("pkg.shapes", "Circle.__init__", positional("self"), positional("r"))
                        .withSource("def __init__(self, r):\n    self.radius = r\n    self.SIDES = 0\n"))
                .set("area", fn("pkg.shapes", "Circle.area", positional("self")))
                .set("unit", new ClassMethod(fn("pkg.shapes", "Circle.unit", positional("cls"))))
                .set("helper", new StaticMethod(fn("pkg.shapes", "Circle.helper", positional("x"))))
                .set("nothing", fn("pkg.shapes", "Circle.nothing"))
                .set("size", new Property(fn("pkg.shapes", "Circle.size", positional("self"))))
                .set("SIDES", 0);
        defaultCircle = new InstanceObject(circle);

        shapes = new ModuleObject("pkg.shapes")
                .set("Circle", circle)
                .set("DEFAULT", defaultCircle)
                .set("area", fn("pkg.shapes", "area", positional("shape")));
        root = new ModuleObject("pkg")
                .set("shapes", shapes)
                .set("Circle", circle)
                .set("VERSION", "1.0")
                .set("__version__", "1.0")
                .set("_hidden", new ArrayList<>());
        space.install(root).install(shapes);
    }

    private static FunctionObject fn(String module, String qualifiedName, FunctionObject.Parameter... params) {
        return new FunctionObject(module, qualifiedName, params);
    }

    private static IntrospectOptions options() {
        return IntrospectOptions.defaults().withSourceAnalyzers(SourceAnalyzerFactory.none());
    }

    private PackageGraph analyze() {
        return PackageGraph.analyze(space, root, options());
    }

    private static ClassNode classNode(PackageGraph graph, String fqn) {
        return assertInstanceOf(ClassNode.class, graph.lookup(fqn).orElseThrow());
    }

    // -- resolution ---

    @Test
    void whenAnalyze_givenClassReexportedAtRoot_shouldResolveToDeclaringModule() {
        final PackageGraph graph = analyze();

        final ClassNode node = classNode(graph, "pkg.shapes::Circle");

        assertSame(graph.packageModules().get("pkg.shapes"), node.canonicalRef().orElseThrow());
        assertEquals("pkg.shapes::Circle", node.fullyQualifiedName());
        assertEquals("Circle", node.qualifiedName());
        assertEquals("pkg.shapes", node.moduleName());
        assertTrue(graph.lookup("pkg::Circle").isEmpty());
    }

    @Test
    void whenAnalyze_givenRootMembers_shouldKeepPublicAndVersionNames() {
        final PackageGraph graph = analyze();

        final Set<String> names = graph.root().members().keySet();

        assertEquals(Set.of("Circle", "VERSION", "__version__", "shapes"), names);
        assertEquals("1.0", graph.lookup("pkg::VERSION").orElseThrow().value());
        assertEquals("1.0", graph.lookup("pkg::__version__").orElseThrow().value());
        assertTrue(graph.root().imports().contains(graph.packageModules().get("pkg.shapes")));
    }

    @Test
    void whenAnalyze_givenInstanceInDeclaringModule_shouldIndexIt() {
        final PackageGraph graph = analyze();

        final ValueNode node = graph.node(defaultCircle).orElseThrow();

        assertEquals("pkg.shapes::DEFAULT", node.fullyQualifiedName());
        assertSame(node, graph.lookup("pkg.shapes::DEFAULT").orElseThrow());
    }

    @Test
    void whenAnalyze_givenClassBody_shouldClassifyEveryMember() {
        final PackageGraph graph = analyze();

        final ClassNode node = classNode(graph, "pkg.shapes::Circle");

        assertEquals(List.of("__init__", "area", "unit", "helper", "nothing", "size", "SIDES"),
                new ArrayList<>(node.members().keySet()));
        assertMember(node, "area", MemberKind.METHOD, Binding.INSTANCE, "unbound");
        assertMember(node, "unit", MemberKind.METHOD, Binding.CLASS, "classmethod");
        assertMember(node, "helper", MemberKind.METHOD, Binding.STATIC, "staticmethod");
        assertMember(node, "nothing", MemberKind.METHOD, Binding.STATIC, "signature");
        assertMember(node, "size", MemberKind.PROPERTY, Binding.INSTANCE, "property");
        assertMember(node, "SIDES", MemberKind.DATA, Binding.STATIC, "other");
        assertEquals("pkg.shapes::Circle.SIDES", node.member("SIDES").orElseThrow().value().fullyQualifiedName());
    }

    private static void assertMember(ClassNode node, String name, MemberKind kind, Binding binding, String reason) {
        final ClassMember member = node.member(name).orElseThrow();
        assertEquals(kind, member.kind(), name);
        assertEquals(binding, member.binding(), name);
        assertEquals(reason, member.reason(), name);
    }

    @Test
    void whenAnalyze_givenClassMethod_shouldUnwrapToBaseRoutine() {
        final PackageGraph graph = analyze();
        final ClassNode cls = classNode(graph, "pkg.shapes::Circle");

        final RoutineNode wrapper = assertInstanceOf(RoutineNode.class, cls.member("unit").orElseThrow().value());
        final RoutineNode base = assertInstanceOf(RoutineNode.class, wrapper.baseRoutine());

        assertTrue(wrapper.isBound());
        assertFalse(base.isBound());
        assertEquals(List.of(cls), wrapper.boundReceivers());
        assertTrue(base.hasReference(wrapper, "__func__"));
        assertFalse(cls.hasReference(wrapper, "__self__"));
        assertSame(cls, base.canonicalRef().orElseThrow());
        assertEquals("pkg.shapes::Circle.unit", base.fullyQualifiedName());
        assertEquals("pkg.shapes::Circle.unit", wrapper.fullyQualifiedName());
        assertSame(base, graph.lookup("pkg.shapes::Circle.unit").orElseThrow());
    }

    @Test
    void whenAnalyze_givenProperty_shouldResolveGetterUnderClass() {
        final PackageGraph graph = analyze();

        final ValueNode getter = graph.lookup("pkg.shapes::Circle.size").orElseThrow();

        assertInstanceOf(RoutineNode.class, getter);
        assertFalse(((RoutineNode) getter).isBound());
        assertEquals("size", getter.name());
    }

    @Test
    void whenLookup_givenEveryIndexedName_shouldRoundTrip() {
        final PackageGraph graph = analyze();

        for (String fqn : graph.index().names()) {
            final ValueNode node = graph.lookup(fqn).orElseThrow();
            if (!(node instanceof ModuleNode)) {
                assertEquals(fqn, node.fullyQualifiedName());
            }
        }
        assertTrue(graph.index().contains("pkg.shapes::area"));
    }

    @Test
    void whenAnalyze_givenSameSpaceTwice_shouldIndexSameNames() {
        final PackageGraph first = analyze();
        final PackageGraph second = analyze();

        assertEquals(first.index().names(), second.index().names());
    }

    // -- identity table ---

    @Test
    void whenRegister_givenSameObject_shouldReturnSameNode() {
        final PackageGraph graph = analyze();

        final ValueNode node = graph.register(circle);

        assertSame(graph.node(circle).orElseThrow(), node);
        assertSame(node, graph.register(circle));
    }

    @Test
    void whenRegister_givenImmutableValueTwice_shouldCreateDistinctNodes() {
        final PackageGraph graph = analyze();

        final ValueNode first = graph.register("x");
        final ValueNode second = graph.register("x");

        assertNotSame(first, second);
        assertTrue(first.isImmutable());
        assertTrue(graph.node("x").isEmpty());
    }

    @Test
    void whenIsImmutable_givenScalarsAndContainers_shouldOnlyAcceptScalars() {
        assertTrue(IdentityTable.isImmutable(null));
        assertTrue(IdentityTable.isImmutable(3));
        assertTrue(IdentityTable.isImmutable("x"));
        assertTrue(IdentityTable.isImmutable(Boolean.TRUE));
        assertFalse(IdentityTable.isImmutable(new ArrayList<>()));
        assertFalse(IdentityTable.isImmutable(circle));
    }

    // -- references and names ---

    @Test
    void whenAddReference_givenDuplicatePair_shouldThrow() {
        final PackageGraph graph = analyze();
        final ValueNode version = graph.lookup("pkg::VERSION").orElseThrow();

        assertThrows(InvariantViolationException.class, () -> version.addReference(graph.root(), "VERSION"));
    }

    @Test
    void whenAliases_givenReferrerAndStranger_shouldListNamesOrThrow() {
        final PackageGraph graph = analyze();
        final ClassNode node = classNode(graph, "pkg.shapes::Circle");
        final ValueNode version = graph.lookup("pkg::VERSION").orElseThrow();

        assertEquals(List.of("Circle"), node.aliases(graph.root()));
        assertThrows(IllegalArgumentException.class, () -> node.aliases(version));
    }

    @Test
    void whenNaming_givenUnresolvedValue_shouldOnlyDisplay() {
        final PackageGraph graph = analyze();

        final ValueNode orphan = graph.register(new ArrayList<>(List.of(1)));

        assertTrue(orphan.displayName().startsWith("?<"));
        assertThrows(IllegalStateException.class, orphan::name);
        assertThrows(IllegalStateException.class, orphan::fullyQualifiedName);
        assertTrue(orphan.tryFullyQualifiedName().isEmpty());
    }

    @Test
    void whenSetCanonicalRef_givenSecondDifferentReference_shouldThrow() {
        final PackageGraph graph = analyze();
        final ClassNode node = classNode(graph, "pkg.shapes::Circle");

        node.setCanonicalRef(graph.packageModules().get("pkg.shapes"));

        assertThrows(InvariantViolationException.class, () -> node.setCanonicalRef(graph.root()));
    }

    // -- discovery ---

    @Test
    void whenAnalyze_givenExternalPrivateAndNonModuleEntries_shouldClassifyEach() {
        final ClassObject helper = new ClassObject("extlib", "Helper");
        final List<String> shared = new ArrayList<>();
        final FunctionObject run = fn("pkg._impl", "run");
        space.install(new ModuleObject("extlib").set("Helper", helper).set("shared", shared))
                .install(new ModuleObject("pkg._impl").set("run", run))
                .install("pkg.tool", new InstanceObject(circle))
                .install(new ModuleObject("pkg.api").set("run", run).set("Helper", helper).set("shared", shared));

        final PackageGraph graph = analyze();

        assertEquals(Set.of("pkg", "pkg.shapes", "pkg.api"), graph.packageModules().keySet());
        assertTrue(graph.internalModules().containsKey("pkg._impl"));
        assertFalse(graph.internalModules().containsKey("extlib"));
        assertFalse(graph.internalModules().containsKey("pkg.tool"));
        assertEquals(Set.of("run"), graph.packageModules().get("pkg.api").members().keySet());
        assertEquals(List.of("extlib"), graph.externalModulesOf(shared));
        assertTrue(graph.node(helper).orElseThrow().isForeign());
        assertTrue(graph.node(shared).orElseThrow().isExternal());
        assertEquals("pkg.api::run", graph.node(run).orElseThrow().fullyQualifiedName());
    }

    @Test
    void whenAnalyze_givenModuleLoadedOnAccess_shouldDiscoverItBeforeRegisteringMembers() {
        final ClassObject widget = new ClassObject("pkg.lazy", "Widget");
        root.loadsOnAccess("pkg.lazy").set("Widget", widget);
        space.defer("pkg.lazy", () -> new ModuleObject("pkg.lazy").set("Widget", widget));

        final PackageGraph graph = analyze();

        assertTrue(space.isLoaded("pkg.lazy"));
        assertTrue(graph.packageModules().containsKey("pkg.lazy"));
        assertInstanceOf(ClassNode.class, graph.node(widget).orElseThrow());
        assertEquals("pkg.lazy::Widget", graph.node(widget).orElseThrow().fullyQualifiedName());
    }

    @Test
    void whenAnalyze_givenRootThatIsNotAModule_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> PackageGraph.analyze(space, circle, options()));
    }

    // -- cycles and import analysis ---

    @Test
    void whenAnalyze_givenMutuallyReferencingModulesAndClasses_shouldTerminate() {
        final ClassObject a = new ClassObject("pkg.a", "A");
        final ClassObject b = new ClassObject("pkg.b", "B");
        a.set("partner", b);
        b.set("partner", a);
        final List<String> shared = new ArrayList<>();
        final ModuleObject modA = new ModuleObject("pkg.a").set("A", a).set("SHARED", shared);
        final ModuleObject modB = new ModuleObject("pkg.b").set("B", b).set("SHARED", shared);
        modA.set("b", modB);
        modB.set("a", modA);
        space.install(modA).install(modB);

        final PackageGraph graph = analyze();

        assertEquals("pkg.a::A", graph.node(a).orElseThrow().fullyQualifiedName());
        assertEquals("pkg.b::B", graph.node(b).orElseThrow().fullyQualifiedName());
        assertEquals("pkg.a::SHARED", graph.node(shared).orElseThrow().fullyQualifiedName());
        assertEquals(MemberKind.DATA, classNode(graph, "pkg.a::A").member("partner").orElseThrow().kind());
    }

    @Test
    void whenAnalyze_givenPrivateClassesOnlyNamedByEachOther_shouldNotFormCanonicalCycle() {
        final ClassObject a = new ClassObject("pkg.m", "_A");
        final ClassObject b = new ClassObject("pkg.m", "_B");
        a.set("b", b);
        b.set("a", a);
        space.install(new ModuleObject("pkg.m").set("_A", a).set("_B", b));

        final PackageGraph graph = analyze();

        final ValueNode first = graph.node(a).orElseThrow();
        final ValueNode second = graph.node(b).orElseThrow();
        assertFalse(first.canonicalRef().orElse(null) == second
                && second.canonicalRef().orElse(null) == first);
        assertTrue(first.tryFullyQualifiedName().isEmpty());
        assertTrue(second.tryFullyQualifiedName().isEmpty());
        assertTrue(graph.lookup("pkg.m::_A").isEmpty());
        assertTrue(graph.lookup("pkg.m::_B").isEmpty());
    }

    @Test
    void whenAnalyze_givenClassNamedOnlyByResolvedClass_shouldResolveUnderThatClass() {
        final ClassObject engine = new ClassObject("pkg.m", "_Engine");
        final ClassObject car = new ClassObject("pkg.m", "Car").set("engine", engine);
        space.install(new ModuleObject("pkg.m").set("Car", car).set("_Engine", engine));

        final PackageGraph graph = analyze();

        assertEquals("pkg.m::Car.engine", graph.node(engine).orElseThrow().fullyQualifiedName());
    }

    @Test
    void whenAnalyze_givenValueSharedAlongImport_shouldResolveToImportedModule() {
        final List<Integer> limits = new ArrayList<>(List.of(1, 2));
        final ModuleObject q = new ModuleObject("pkg.q").set("LIMITS", limits);
        final ModuleObject p = new ModuleObject("pkg.p").set("q", q).set("LIMITS", limits);
        space.install(p).install(q);

        final PackageGraph graph = analyze();

        assertEquals("pkg.q::LIMITS", graph.node(limits).orElseThrow().fullyQualifiedName());
    }

    @Test
    void whenAnalyze_givenImportCycleAndInstanceOfOwnerClass_shouldPreferTypeModule() {
        final ClassObject config = new ClassObject("pkg.q", "Config");
        final InstanceObject settings = new InstanceObject(config);
        final ModuleObject p = new ModuleObject("pkg.p").set("SETTINGS", settings);
        final ModuleObject q = new ModuleObject("pkg.q").set("SETTINGS", settings);
        p.set("q", q);
        q.set("p", p);
        space.install(p).install(q);

        final PackageGraph graph = analyze();

        assertEquals("pkg.q::SETTINGS", graph.node(settings).orElseThrow().fullyQualifiedName());
    }

    @Test
    void whenAnalyze_givenRoutineReexported_shouldUseDeclaredPathAndRecordMaybeImport() {
        final FunctionObject run = fn("pkg.core", "run");
        space.install(new ModuleObject("pkg.core").set("run", run))
                .install(new ModuleObject("pkg.api").set("run", run));

        final PackageGraph graph = analyze();

        assertEquals("pkg.core::run", graph.node(run).orElseThrow().fullyQualifiedName());
        assertTrue(graph.packageModules().get("pkg.api").maybeImports()
                .contains(graph.packageModules().get("pkg.core")));
        assertTrue(graph.packageModules().get("pkg.api").dependencies()
                .contains(graph.packageModules().get("pkg.core")));
    }

    @Test
    void whenAnalyze_givenDeclaredReferenceExcluded_shouldFallBackToImportAnalysis() {
        final ClassObject thing = new ClassObject("pkg.core", "Thing");
        space.install(new ModuleObject("pkg.core").set("Thing", thing))
                .install(new ModuleObject("pkg.api").set("Thing", thing));
        final VariableFilter filter = (pkg, parent, value, name) ->
                (parent instanceof ModuleNode m && m.name().equals("pkg.core") && name.equals("Thing"))
                        || VariableFilter.defaults().exclude(pkg, parent, value, name);

        final PackageGraph graph = PackageGraph.analyze(space, root, options().withVariableFilter(filter));

        assertEquals("pkg.api::Thing", graph.node(thing).orElseThrow().fullyQualifiedName());
        assertTrue(graph.packageModules().get("pkg.core").members().isEmpty());
    }

    @Test
    void whenAnalyze_givenRoutineFromPrivateModule_shouldResolveToPublicReexport() {
        final FunctionObject run = fn("pkg._impl", "run");
        space.install(new ModuleObject("pkg._impl").set("run", run))
                .install(new ModuleObject("pkg.api").set("run", run));

        final PackageGraph graph = analyze();

        assertEquals("pkg.api::run", graph.node(run).orElseThrow().fullyQualifiedName());
        assertFalse(graph.packageModules().containsKey("pkg._impl"));
    }

    @Test
    void whenAnalyze_givenLocalFunction_shouldResolveThroughImports() {
        final FunctionObject inner = fn("pkg.shapes", "factory.<locals>.inner");
        shapes.set("inner", inner);

        final PackageGraph graph = analyze();

        assertEquals("pkg.shapes::inner", graph.node(inner).orElseThrow().fullyQualifiedName());
    }

    @Test
    void whenAnalyze_givenDeclaredParentNeverSeen_shouldThrowInvariantViolation() {
        shapes.set("run", fn("pkg.shapes", "Ghost.run"));

        assertThrows(InvariantViolationException.class, this::analyze);
    }

    @Test
    void whenAnalyze_givenNestedClass_shouldMarkInnerClassAndResolveUnderOuter() {
        final ClassObject inner = new ClassObject("pkg.shapes", "Circle.Style");
        circle.set("Style", inner);

        final PackageGraph graph = analyze();

        final ClassNode outer = classNode(graph, "pkg.shapes::Circle");
        assertEquals(MemberKind.INNER_CLASS, outer.member("Style").orElseThrow().kind());
        assertEquals("pkg.shapes::Circle.Style", graph.node(inner).orElseThrow().fullyQualifiedName());
        assertSame(graph.node(inner).orElseThrow(), graph.lookup("pkg.shapes::Circle.Style").orElseThrow());
    }

    // -- filters ---

    @Test
    void whenAnalyze_givenFilterExcludingName_shouldSkipReference() {
        final List<String> secret = new ArrayList<>();
        shapes.set("secret", secret);
        final VariableFilter filter = (pkg, parent, value, name) ->
                name.equals("secret") || VariableFilter.defaults().exclude(pkg, parent, value, name);

        final PackageGraph graph = PackageGraph.analyze(space, root, options().withVariableFilter(filter));

        final ValueNode node = graph.node(secret).orElseThrow();
        assertTrue(node.references().isEmpty());
        assertFalse(node.isResolved());
        assertFalse(graph.packageModules().get("pkg.shapes").members().containsKey("secret"));
    }

    @Test
    void whenAnalyze_givenNoFilter_shouldKeepPrivateNames() {
        final PackageGraph graph = PackageGraph.analyze(space, root, options().withVariableFilter(VariableFilter.none()));

        assertTrue(graph.root().members().containsKey("_hidden"));
    }

    // -- source analysis ---

    @Test
    void whenAnalyze_givenDocumentedAttributes_shouldMergeThemIntoClassMembers() {
        final SourceAnalyzer analyzer = new StubAnalyzer();
        final IntrospectOptions opts = options().withSourceAnalyzers(
                (module, file) -> module.equals("pkg.shapes") ? analyzer : SourceAnalyzer.NONE);

        final PackageGraph graph = PackageGraph.analyze(space, root, opts);
        final ClassNode node = classNode(graph, "pkg.shapes::Circle");

        assertMember(node, "radius", MemberKind.DATA, Binding.INSTANCE, "moduleanalyzer");
        assertMember(node, "color", MemberKind.DATA, Binding.STATIC, "moduleanalyzer");
        assertMember(node, "SIDES", MemberKind.DATA, Binding.INSTANCE, "moduleanalyzer");
        assertMember(node, "area", MemberKind.METHOD, Binding.INSTANCE, "unbound");
        assertInstanceOf(InstancePlaceholder.class, node.member("radius").orElseThrow().value().value());
        assertEquals("pkg.shapes::Circle.radius", node.member("radius").orElseThrow().value().fullyQualifiedName());
        assertEquals(List.of("Radius in metres."), node.instanceAttributeDocs("radius"));
    }

    @Test
    void whenAnalyze_givenAssignmentTextInCommentOrString_shouldNotTreatItAsInstanceAttribute() {
        circle.set("__init__", fn("pkg.shapes", "Circle.__init__", positional("self"), positional("r"))
                .withSource("def __init__(self, r):\n    self.radius = r\n"
                        + "    # self.color = 'red'\n    log(\"self.color = unset\")\n"));
        final IntrospectOptions opts = options().withSourceAnalyzers(
                (module, file) -> module.equals("pkg.shapes") ? new StubAnalyzer() : SourceAnalyzer.NONE);

        final ClassNode node = classNode(PackageGraph.analyze(space, root, opts), "pkg.shapes::Circle");

        assertMember(node, "radius", MemberKind.DATA, Binding.INSTANCE, "moduleanalyzer");
        assertMember(node, "color", MemberKind.DATA, Binding.STATIC, "moduleanalyzer");
    }

    @Test
    void whenOrder_givenSourceRanks_shouldSortByDeclaration() {
        final IntrospectOptions opts = options().withSourceAnalyzers(
                (module, file) -> module.equals("pkg.shapes") ? new StubAnalyzer() : SourceAnalyzer.NONE);

        final PackageGraph graph = PackageGraph.analyze(space, root, opts);
        final ClassNode cls = classNode(graph, "pkg.shapes::Circle");
        final ValueNode area = cls.member("area").orElseThrow().value();

        assertEquals(new SortKey(0, "Circle"), cls.order());
        assertEquals(new SortKey(1, "DEFAULT"), graph.node(defaultCircle).orElseThrow().order());
        assertEquals(new SortKey(2, "area"), area.order());
        assertEquals(SourceAnalyzer.UNKNOWN_ORDER, graph.lookup("pkg::VERSION").orElseThrow().order().rank());
        assertTrue(cls.order().compareTo(area.order()) < 0);
    }

    private static final class StubAnalyzer implements SourceAnalyzer {

        @Override
        public int memberOrder(String qualifiedLocalName) {
            return switch (qualifiedLocalName) {
                case "Circle" -> 0;
                case "DEFAULT" -> 1;
                case "Circle.area" -> 2;
                default -> UNKNOWN_ORDER;
            };
        }

        @Override
        public Set<String> instanceAttributeNames(String classQualifiedName) {
            if (!classQualifiedName.equals("Circle")) {
                return Set.of();
            }
            return new LinkedHashSet<>(List.of("radius", "color", "SIDES"));
        }

        @Override
        public List<String> instanceAttributeDocs(String classQualifiedName, String attribute) {
            return attribute.equals("radius") ? List.of("Radius in metres.") : List.of();
        }
    }
}
