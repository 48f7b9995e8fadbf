package ai.apigraph.io;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.apigraph.graph.ClassMember;
import ai.apigraph.graph.ClassNode;
import ai.apigraph.graph.ModuleNode;
import ai.apigraph.graph.PackageGraph;
import ai.apigraph.graph.RoutineNode;
import ai.apigraph.graph.ValueNode;
import ai.apigraph.model.MemberLine;
import ai.apigraph.model.NodeLine;
import ai.apigraph.scan.SourceAnalyzer;

/**
 * Flattens a {@link PackageGraph} into per-module lines. A node is written
 * under the module of its canonical name; nodes without one are counted as
 * unresolved and left out.
 */
public final class GraphExporter {

    private static final Logger LOG = LoggerFactory.getLogger(GraphExporter.class);

    public GraphExport export(PackageGraph graph) {
        Objects.requireNonNull(graph, "graph");

        final Map<String, List<NodeLine>> nodesByModule = new HashMap<>();
        final Map<String, List<MemberLine>> membersByModule = new HashMap<>();
        final Map<String, String> nameIndex = new TreeMap<>();
        int unresolved = 0;

        for (ValueNode node : graph.nodes()) {
            if (node.isExternal() || (node.references().isEmpty() && !(node instanceof ModuleNode))) {
                continue;
            }
            // wrappers share the canonical name of their base routine
            if (node instanceof RoutineNode r && r.isBound()) {
                continue;
            }
            final Optional<String> fqn = node.tryFullyQualifiedName();
            if (fqn.isEmpty()) {
                unresolved++;
                LOG.debug("No canonical name for {}", node);
                continue;
            }
            final String module = node.moduleName();
            if (!graph.packageModules().containsKey(module)) {
                continue;
            }
            nameIndex.putIfAbsent(fqn.get(), module);
            nodesByModule.computeIfAbsent(module, k -> new ArrayList<>()).add(nodeLine(node, fqn.get()));

            if (node instanceof ModuleNode m) {
                for (var e : m.members().entrySet()) {
                    final ValueNode value = e.getValue();
                    membersByModule.computeIfAbsent(module, k -> new ArrayList<>()).add(new MemberLine(
                            fqn.get(), e.getKey(), idOf(value), lower(value.kind().name()), null, null));
                }
            } else if (node instanceof ClassNode c) {
                for (var e : c.members().entrySet()) {
                    final ClassMember member = e.getValue();
                    membersByModule.computeIfAbsent(module, k -> new ArrayList<>()).add(new MemberLine(
                            fqn.get(), e.getKey(), idOf(member.value()), lower(member.kind().name()),
                            lower(member.binding().name()), member.reason()));
                }
            }
        }

        final Map<String, GraphExport.ModuleFiles> modules = new TreeMap<>();
        for (String module : graph.packageModules().keySet()) {
            final List<NodeLine> nodes = nodesByModule.getOrDefault(module, new ArrayList<>());
            nodes.sort(Comparator.comparing(NodeLine::id));
            modules.put(module, new GraphExport.ModuleFiles(nodes, membersByModule.getOrDefault(module, List.of())));
        }
        return new GraphExport(graph.name(), modules, nameIndex, unresolved);
    }

    private static NodeLine nodeLine(ValueNode node, String fqn) {
        final List<String> references = new ArrayList<>();
        for (var e : node.references().entrySet()) {
            for (String name : e.getValue()) {
                references.add(idOf(e.getKey()) + "#" + name);
            }
        }
        String canonical = null;
        if (!(node instanceof ModuleNode)) {
            canonical = node.canonicalRef().map(GraphExporter::idOf).orElse(null);
        }
        final int rank = node.order().rank();
        return new NodeLine(fqn, lower(node.kind().name()), node.displayName(), canonical, references,
                new ArrayList<>(node.externalMarks()), rank == SourceAnalyzer.UNKNOWN_ORDER ? -1 : rank);
    }

    private static String idOf(ValueNode node) {
        return node.tryFullyQualifiedName().orElse(node.displayName());
    }

    private static String lower(String enumName) {
        return enumName.toLowerCase(Locale.ROOT);
    }
}
