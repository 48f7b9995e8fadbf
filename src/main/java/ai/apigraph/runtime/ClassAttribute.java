package ai.apigraph.runtime;

/**
 * A class-body attribute.
 *
 * @param name  attribute name
 * @param raw   the value stored in the class body (descriptor included)
 * @param bound the value as seen through the class, after descriptor binding
 */
public record ClassAttribute(String name, Object raw, Object bound) {
}
