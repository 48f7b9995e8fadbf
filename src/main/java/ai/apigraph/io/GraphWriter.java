package ai.apigraph.io;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Writes a {@link GraphExport}:
 * - {@code nodes.<module>.jsonl} and {@code members.<module>.jsonl} per module
 * - {@code names.index.json}: canonical id to module
 * - {@code index.json}: schema, file names and counts
 */
public final class GraphWriter {

    public static final String SCHEMA_VERSION = "api-graph/v1";

    private final Path outDir;
    private final ObjectMapper jsonMapper;
    private final ObjectMapper jsonlMapper;

    public GraphWriter(Path outDir) {
        this.outDir = Objects.requireNonNull(outDir, "outDir");
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        this.jsonlMapper = new ObjectMapper();
    }

    public MasterIndex writeAll(GraphExport export, String generatedAt) throws IOException {
        Objects.requireNonNull(export, "export");
        Objects.requireNonNull(generatedAt, "generatedAt");

        Files.createDirectories(outDir);

        final List<ModuleIndexEntry> entries = new ArrayList<>(export.modules().size());
        final List<ModuleSummary> summaries = new ArrayList<>(export.modules().size());
        int totalNodes = 0;
        int totalMembers = 0;

        // modules is a sorted map, so file order is stable
        for (var e : export.modules().entrySet()) {
            final String module = e.getKey();
            final GraphExport.ModuleFiles files = e.getValue();

            final String nodesName = "nodes." + module + ".jsonl";
            final String membersName = "members." + module + ".jsonl";
            writeJsonl(outDir.resolve(nodesName), files.nodes());
            writeJsonl(outDir.resolve(membersName), files.members());

            totalNodes += files.nodes().size();
            totalMembers += files.members().size();
            summaries.add(new ModuleSummary(module, files.nodes().size(), files.members().size()));
            entries.add(new ModuleIndexEntry(module, nodesName, membersName));
        }

        writeJson(outDir.resolve("names.index.json"), export.nameIndex());

        final MasterIndex index = new MasterIndex(
                SCHEMA_VERSION,
                generatedAt,
                export.packageName(),
                entries,
                "names.index.json",
                new Summary(totalNodes, totalMembers, export.unresolved(), summaries)
        );
        writeJson(outDir.resolve("index.json"), index);
        return index;
    }

    private void writeJson(Path file, Object data) throws IOException {
        jsonMapper.writeValue(file.toFile(), data);
    }

    private <T> void writeJsonl(Path file, List<T> lines) throws IOException {
        try (BufferedWriter bw = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            for (T line : lines) {
                bw.write(jsonlMapper.writeValueAsString(line));
                bw.newLine();
            }
        }
    }

    // --- index records (written as JSON, not JSONL) ---

    public record MasterIndex(
            String schema,
            String generatedAt,
            String packageName,
            List<ModuleIndexEntry> modules,
            String nameIndex,
            Summary summary
    ) {
    }

    public record ModuleIndexEntry(
            String id,
            String nodes,
            String members
    ) {
    }

    public record Summary(
            int totalNodes,
            int totalMembers,
            int unresolved,
            List<ModuleSummary> modules
    ) {
    }

    public record ModuleSummary(
            String id,
            int nodes,
            int members
    ) {
    }
}
