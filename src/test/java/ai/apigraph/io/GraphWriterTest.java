package ai.apigraph.io;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ai.apigraph.model.MemberLine;
import ai.apigraph.model.NodeLine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for GraphWriter.
 */
class GraphWriterTest {

    private static GraphExport sampleExport() {
        final NodeLine circle = new NodeLine("pkg.shapes::Circle", "class", "Circle", "pkg.shapes",
                List.of("pkg#Circle", "pkg.shapes#Circle"), List.of(), 3);
        final NodeLine area = new NodeLine("pkg.shapes::Circle.area", "routine", "area", "pkg.shapes::Circle",
                List.of("pkg.shapes::Circle#area"), List.of(), -1);
        final MemberLine member = new MemberLine("pkg.shapes::Circle", "area", "pkg.shapes::Circle.area",
                "method", "instance", "unbound");
        return new GraphExport("pkg",
                Map.of("pkg.shapes", new GraphExport.ModuleFiles(List.of(circle, area), List.of(member))),
                Map.of("pkg.shapes::Circle", "pkg.shapes", "pkg.shapes::Circle.area", "pkg.shapes"),
                2);
    }

    @Test
    void whenWriteAll_givenExport_shouldWriteJsonlPerModule(@TempDir Path dir) throws Exception {
        new GraphWriter(dir).writeAll(sampleExport(), "2024-01-01T00:00:00Z");

        final List<String> nodes = Files.readAllLines(dir.resolve("nodes.pkg.shapes.jsonl"), StandardCharsets.UTF_8);
        final List<String> members = Files.readAllLines(dir.resolve("members.pkg.shapes.jsonl"), StandardCharsets.UTF_8);

        assertEquals(2, nodes.size());
        assertEquals(1, members.size());
        final JsonNode first = new ObjectMapper().readTree(nodes.get(0));
        assertEquals("pkg.shapes::Circle", first.get("id").asText());
        assertEquals(3, first.get("order").asInt());
        assertEquals("unbound", new ObjectMapper().readTree(members.get(0)).get("reason").asText());
    }

    @Test
    void whenWriteAll_givenExport_shouldWriteIndexes(@TempDir Path dir) throws Exception {
        final GraphWriter.MasterIndex index = new GraphWriter(dir.resolve("out")).writeAll(sampleExport(), "now");

        final JsonNode json = new ObjectMapper().readTree(dir.resolve("out/index.json").toFile());
        final JsonNode names = new ObjectMapper().readTree(dir.resolve("out/names.index.json").toFile());

        assertEquals(GraphWriter.SCHEMA_VERSION, json.get("schema").asText());
        assertEquals("pkg", json.get("packageName").asText());
        assertEquals("nodes.pkg.shapes.jsonl", json.get("modules").get(0).get("nodes").asText());
        assertEquals(2, json.get("summary").get("totalNodes").asInt());
        assertEquals(2, json.get("summary").get("unresolved").asInt());
        assertEquals("pkg.shapes", names.get("pkg.shapes::Circle.area").asText());
        assertEquals(1, index.summary().totalMembers());
        assertTrue(Files.isRegularFile(dir.resolve("out/members.pkg.shapes.jsonl")));
    }
}
