package ai.apigraph.graph;

/**
 * One name by which a referrer reaches a value.
 */
public record Reference(ValueNode referrer, String name) {
}
