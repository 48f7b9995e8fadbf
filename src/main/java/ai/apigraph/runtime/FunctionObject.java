package ai.apigraph.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import ai.apigraph.model.Names;

/**
 * A root callable. A null parameter list means the signature cannot be
 * introspected (native routines, broken declarations).
 */
public final class FunctionObject {

    private final String module;
    private final String qualifiedName;
    private final List<Parameter> parameters;
    private String source;

    public FunctionObject(String module, String qualifiedName, Parameter... parameters) {
        this(module, qualifiedName, List.of(parameters));
    }

    private FunctionObject(String module, String qualifiedName, List<Parameter> parameters) {
        this.module = Objects.requireNonNull(module, "module");
        this.qualifiedName = Objects.requireNonNull(qualifiedName, "qualifiedName");
        this.parameters = parameters;
    }

    public static FunctionObject withParameters(String module, String qualifiedName, List<Parameter> parameters) {
        return new FunctionObject(module, qualifiedName, List.copyOf(parameters));
    }

    public static FunctionObject uninspectable(String module, String qualifiedName) {
        return new FunctionObject(module, qualifiedName, (List<Parameter>) null);
    }

    public String module() {
        return module;
    }

    public String qualifiedName() {
        return qualifiedName;
    }

    public Optional<List<Parameter>> parameters() {
        return Optional.ofNullable(parameters);
    }

    public List<ParameterKind> parameterKinds() throws SignatureException {
        if (parameters == null) {
            throw new SignatureException("no signature found for " + this);
        }
        final List<ParameterKind> kinds = new ArrayList<>(parameters.size());
        for (Parameter p : parameters) {
            kinds.add(p.kind());
        }
        return kinds;
    }

    public FunctionObject withSource(String text) {
        this.source = text;
        return this;
    }

    public Optional<String> source() {
        return Optional.ofNullable(source);
    }

    @Override
    public String toString() {
        return "<function " + Names.fullyQualified(module, qualifiedName) + ">";
    }

    public record Parameter(String name, ParameterKind kind) {

        public static Parameter positional(String name) {
            return new Parameter(name, ParameterKind.POSITIONAL_OR_KEYWORD);
        }

        public static Parameter keywordOnly(String name) {
            return new Parameter(name, ParameterKind.KEYWORD_ONLY);
        }

        public static Parameter varPositional(String name) {
            return new Parameter(name, ParameterKind.VAR_POSITIONAL);
        }

        public static Parameter varKeyword(String name) {
            return new Parameter(name, ParameterKind.VAR_KEYWORD);
        }
    }
}
