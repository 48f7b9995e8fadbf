package ai.apigraph.graph;

import java.util.Objects;

import ai.apigraph.modules.PackageModuleFilter;
import ai.apigraph.scan.SourceAnalyzerFactory;

/**
 * Collaborators one analysis run is configured with.
 */
public record IntrospectOptions(PackageModuleFilter moduleFilter,
                                VariableFilter variableFilter,
                                SourceAnalyzerFactory sourceAnalyzers) {

    public IntrospectOptions {
        Objects.requireNonNull(moduleFilter, "moduleFilter");
        Objects.requireNonNull(variableFilter, "variableFilter");
        Objects.requireNonNull(sourceAnalyzers, "sourceAnalyzers");
    }

    public static IntrospectOptions defaults() {
        return new IntrospectOptions(PackageModuleFilter.defaults(), VariableFilter.defaults(),
                SourceAnalyzerFactory.javaSources());
    }

    public IntrospectOptions withModuleFilter(PackageModuleFilter filter) {
        return new IntrospectOptions(filter, variableFilter, sourceAnalyzers);
    }

    public IntrospectOptions withVariableFilter(VariableFilter filter) {
        return new IntrospectOptions(moduleFilter, filter, sourceAnalyzers);
    }

    public IntrospectOptions withSourceAnalyzers(SourceAnalyzerFactory factory) {
        return new IntrospectOptions(moduleFilter, variableFilter, factory);
    }
}
