package ai.apigraph.model;

import java.util.List;

/**
 * JSONL line for nodes.&lt;module&gt;.jsonl
 */
public record NodeLine(
        String id,              // module::Qual.name, or the module name
        String kind,            // "module" | "class" | "routine" | "data"
        String name,
        String canonicalRef,    // id of the canonical referrer; null for modules
        List<String> references, // <referrer id>#<name>, in recording order
        List<String> externalMarks,
        int order               // declaration rank, -1 when unknown
) {
}
