package ai.apigraph.io;

import java.util.List;
import java.util.Map;

import ai.apigraph.model.MemberLine;
import ai.apigraph.model.NodeLine;

/**
 * Resolved graph flattened for writing.
 * - Per-module JSONL lines
 * - Global index: canonical id -> module
 */
public record GraphExport(
        String packageName,
        Map<String, ModuleFiles> modules,
        Map<String, String> nameIndex,
        int unresolved
) {
    public record ModuleFiles(
            List<NodeLine> nodes,
            List<MemberLine> members
    ) {
    }
}
