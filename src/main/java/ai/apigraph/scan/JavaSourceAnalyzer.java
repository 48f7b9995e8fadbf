package ai.apigraph.scan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.Statement;

import ai.apigraph.model.Names;

/**
 * Source analyzer for modules whose source is a Java-syntax file.
 * <p>
 * Declaration order: every type, field, method, constructor and enum constant
 * gets a rank in file order, keyed by its qualified local name
 * ({@code Outer.Inner.member}). Members of the module holder type (the
 * top-level type named after the module's last segment) are also keyed
 * without the holder prefix.
 * <p>
 * Documented attributes: commented fields of a type, plus commented
 * {@code this.x = ...} assignments in its constructors.
 */
public final class JavaSourceAnalyzer implements SourceAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(JavaSourceAnalyzer.class);

    private final Map<String, Integer> tagOrder = new HashMap<>();
    // class qualified name -> attribute -> doc lines, declaration order
    private final Map<String, Map<String, List<String>>> attributeDocs = new HashMap<>();
    private int nextRank;

    private JavaSourceAnalyzer() {
    }

    /**
     * Factory used by {@link SourceAnalyzerFactory#javaSources()}; degrades to
     * {@link SourceAnalyzer#NONE} when the file is missing or unparsable.
     */
    public static SourceAnalyzer forModule(String moduleName, Optional<Path> sourceFile) {
        Objects.requireNonNull(moduleName, "moduleName");
        if (sourceFile.isEmpty()) {
            LOG.debug("No source file for module {}", moduleName);
            return SourceAnalyzer.NONE;
        }
        final Path file = sourceFile.get();
        if (!Files.isRegularFile(file)) {
            LOG.warn("Could not analyze module {}: source not found at {}", moduleName, file);
            return SourceAnalyzer.NONE;
        }
        try {
            return parse(file, moduleName);
        } catch (IOException | RuntimeException ex) {
            LOG.warn("Could not analyze module {}: {}: {}", moduleName,
                    ex.getClass().getSimpleName(), Names.abbreviate(ex.getMessage(), 200));
            return SourceAnalyzer.NONE;
        }
    }

    public static JavaSourceAnalyzer parse(Path file, String moduleName) throws IOException {
        return analyze(newParser().parse(file), file.toString(), moduleName);
    }

    public static JavaSourceAnalyzer parse(String source, String moduleName) throws IOException {
        return analyze(newParser().parse(source), "<string>", moduleName);
    }

    private static JavaParser newParser() {
        return new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    }

    private static JavaSourceAnalyzer analyze(ParseResult<CompilationUnit> res, String origin, String moduleName)
            throws IOException {
        final Optional<CompilationUnit> cu = res.getResult();
        if (!res.isSuccessful() || cu.isEmpty()) {
            final String msg = res.getProblems().isEmpty()
                    ? "no compilation unit"
                    : res.getProblems().get(0).getMessage();
            throw new IOException("parse problems in " + origin + " -> " + Names.abbreviate(msg, 200));
        }

        final JavaSourceAnalyzer analyzer = new JavaSourceAnalyzer();
        final String holder = Names.simpleNameOf(moduleName).toLowerCase(Locale.ROOT);
        for (TypeDeclaration<?> td : cu.get().getTypes()) {
            final boolean isHolder = td.getNameAsString().toLowerCase(Locale.ROOT).equals(holder);
            analyzer.indexType(td, "", isHolder);
        }
        return analyzer;
    }

    private void indexType(TypeDeclaration<?> td, String prefix, boolean moduleHolder) {
        final String qn = prefix.isEmpty() ? td.getNameAsString() : prefix + "." + td.getNameAsString();
        rank(qn, null);

        if (td instanceof EnumDeclaration ed) {
            for (var entry : ed.getEntries()) {
                rank(qn + "." + entry.getNameAsString(), moduleHolder ? entry.getNameAsString() : null);
            }
        }

        for (BodyDeclaration<?> member : td.getMembers()) {
            if (member.isFieldDeclaration()) {
                final FieldDeclaration fd = member.asFieldDeclaration();
                final Optional<List<String>> doc = fd.getComment().map(JavaSourceAnalyzer::docLines);
                for (VariableDeclarator v : fd.getVariables()) {
                    final String name = v.getNameAsString();
                    rank(qn + "." + name, moduleHolder ? name : null);
                    doc.ifPresent(lines -> documented(qn, name, lines));
                }
            } else if (member.isMethodDeclaration()) {
                final String name = member.asMethodDeclaration().getNameAsString();
                rank(qn + "." + name, moduleHolder ? name : null);
            } else if (member.isConstructorDeclaration()) {
                rank(qn + ".__init__", null);
                indexConstructorAssignments(qn, member.asConstructorDeclaration());
            } else if (member.isTypeDeclaration()) {
                // the holder stands for the module itself, so its nested types are top level
                indexType(member.asTypeDeclaration(), moduleHolder ? "" : qn, false);
            }
        }
    }

    private void indexConstructorAssignments(String classQn, ConstructorDeclaration cd) {
        for (Statement st : cd.getBody().getStatements()) {
            if (!st.isExpressionStmt()) {
                continue;
            }
            final Expression expr = st.asExpressionStmt().getExpression();
            if (!expr.isAssignExpr()) {
                continue;
            }
            final AssignExpr assign = expr.asAssignExpr();
            if (assign.getOperator() != AssignExpr.Operator.ASSIGN || !assign.getTarget().isFieldAccessExpr()) {
                continue;
            }
            final var target = assign.getTarget().asFieldAccessExpr();
            if (!target.getScope().isThisExpr()) {
                continue;
            }
            final Optional<Comment> comment = st.getComment().or(assign::getComment);
            if (comment.isPresent()) {
                final String name = target.getNameAsString();
                final Map<String, List<String>> docs = attributeDocs.get(classQn);
                if (docs == null || !docs.containsKey(name)) {
                    documented(classQn, name, docLines(comment.get()));
                }
            }
        }
    }

    private void rank(String key, String holderAlias) {
        final int r = nextRank++;
        tagOrder.putIfAbsent(key, r);
        if (holderAlias != null) {
            tagOrder.putIfAbsent(holderAlias, r);
        }
    }

    private void documented(String classQn, String attribute, List<String> lines) {
        attributeDocs.computeIfAbsent(classQn, k -> new LinkedHashMap<>()).put(attribute, lines);
    }

    private static List<String> docLines(Comment comment) {
        final List<String> lines = new ArrayList<>();
        for (String raw : comment.getContent().split("\\R")) {
            String line = raw.strip();
            if (line.startsWith("*")) {
                line = line.substring(1).strip();
            }
            lines.add(line);
        }
        while (!lines.isEmpty() && lines.get(0).isEmpty()) {
            lines.remove(0);
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return Collections.unmodifiableList(lines);
    }

    @Override
    public int memberOrder(String qualifiedLocalName) {
        return tagOrder.getOrDefault(qualifiedLocalName, UNKNOWN_ORDER);
    }

    @Override
    public Set<String> instanceAttributeNames(String classQualifiedName) {
        final Map<String, List<String>> docs = attributeDocs.get(classQualifiedName);
        return docs == null ? Set.of() : Collections.unmodifiableSet(docs.keySet());
    }

    @Override
    public List<String> instanceAttributeDocs(String classQualifiedName, String attribute) {
        final Map<String, List<String>> docs = attributeDocs.get(classQualifiedName);
        if (docs == null) {
            return List.of();
        }
        return docs.getOrDefault(attribute, List.of());
    }
}
