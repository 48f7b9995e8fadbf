package ai.apigraph.scan;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Creates the source analyzer for one module.
 */
@FunctionalInterface
public interface SourceAnalyzerFactory {

    SourceAnalyzer forModule(String moduleName, Optional<Path> sourceFile);

    static SourceAnalyzerFactory none() {
        return (moduleName, sourceFile) -> SourceAnalyzer.NONE;
    }

    /** Parses each module's source file as Java. */
    static SourceAnalyzerFactory javaSources() {
        return JavaSourceAnalyzer::forModule;
    }
}
