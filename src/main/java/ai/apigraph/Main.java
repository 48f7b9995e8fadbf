package ai.apigraph;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;

import ai.apigraph.graph.IntrospectOptions;
import ai.apigraph.graph.PackageGraph;
import ai.apigraph.io.GraphExport;
import ai.apigraph.io.GraphExporter;
import ai.apigraph.io.GraphWriter;
import ai.apigraph.io.ImageLoader;
import ai.apigraph.io.ProgramImage;
import ai.apigraph.scan.SourceAnalyzerFactory;

public final class Main {

    public static void main(String[] args) {
        final int code = run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        Path imageFile = null;
        Path outDir = null;
        String packageName = null;
        boolean analyzeSources = true;

        try {
            for (String arg : args) {
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage();
                    return 0;
                }
                if (arg.startsWith("--outDir=")) {
                    outDir = Paths.get(arg.substring("--outDir=".length()));
                    continue;
                }
                if (arg.startsWith("--package=")) {
                    packageName = arg.substring("--package=".length()).trim();
                    continue;
                }
                if ("--noSource".equals(arg)) {
                    analyzeSources = false;
                    continue;
                }
                if (arg.startsWith("--")) {
                    System.err.println("ERROR: unknown argument: " + arg);
                    printUsage();
                    return 2;
                }
                if (imageFile == null) {
                    imageFile = Paths.get(arg);
                    continue;
                }
                System.err.println("ERROR: unexpected argument: " + arg);
                printUsage();
                return 2;
            }

            if (imageFile == null) {
                System.err.println("ERROR: missing image file");
                printUsage();
                return 2;
            }
            imageFile = imageFile.toAbsolutePath().normalize();

            final ProgramImage image = new ImageLoader().load(imageFile);
            if (packageName == null || packageName.isEmpty()) {
                packageName = image.rootPackage().orElse(null);
            }
            if (packageName == null) {
                System.err.println("ERROR: no package given and the image names none");
                return 2;
            }
            final Object root = image.space().module(packageName).orElse(null);
            if (root == null) {
                System.err.println("ERROR: package not found in image: " + packageName);
                return 2;
            }

            if (outDir == null) {
                outDir = imageFile.getParent().resolve(".api-graph");
            } else if (!outDir.isAbsolute()) {
                outDir = outDir.toAbsolutePath().normalize();
            }

            IntrospectOptions options = IntrospectOptions.defaults();
            if (!analyzeSources) {
                options = options.withSourceAnalyzers(SourceAnalyzerFactory.none());
            }
            final PackageGraph graph = PackageGraph.analyze(image.space(), root, options);
            final GraphExport export = new GraphExporter().export(graph);
            final var index = new GraphWriter(outDir).writeAll(export, Instant.now().toString());

            System.out.println("API graph written to: " + outDir);
            System.out.println("Schema: " + GraphWriter.SCHEMA_VERSION);
            System.out.println("Modules: " + export.modules().size()
                    + ", nodes: " + index.summary().totalNodes()
                    + ", members: " + index.summary().totalMembers());
            if (export.unresolved() > 0) {
                System.err.println("WARN: values without canonical name: " + export.unresolved());
            }
            return 0;
        } catch (IOException ex) {
            System.err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (Exception ex) {
            System.err.println("ERROR: failed to build graph: "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return 1;
        }
    }

    private static void printUsage() {
        System.out.println("Usage: api-graph <image.json> [options]");
        System.out.println("Options:");
        System.out.println("  --package=<name>   Root package to analyze (default: the image's \"package\")");
        System.out.println("  --outDir=<path>    Output directory (default: <image dir>/.api-graph)");
        System.out.println("  --noSource         Skip source analysis of module files");
        System.out.println("  --help, -h         Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
