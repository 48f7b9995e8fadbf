package ai.apigraph.graph;

import ai.apigraph.model.Binding;
import ai.apigraph.model.MemberKind;

/**
 * Classification of one class attribute.
 *
 * @param reason how the binding was detected, e.g. {@code "classmethod"},
 *               {@code "unbound"}, {@code "slots"}, {@code "moduleanalyzer"}
 */
public record ClassMember(MemberKind kind, Binding binding, String reason, ValueNode value) {
}
