package ai.apigraph.model;

/**
 * JSONL line for members.&lt;module&gt;.jsonl
 */
public record MemberLine(
        String owner,    // module or class id
        String name,
        String value,    // id of the member value, or its display name when unresolved
        String kind,     // class members: "method" | "property" | "inner_class" | "data"; module members: value kind
        String binding,  // class members only: "static" | "class" | "singleton" | "instance"
        String reason    // class members only
) {
}
