package com.alphaguard.lint;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scans alpha-computation sources for any use of governance packages.
 *
 * <p>Every {@code .java} file under the alpha paths is parsed and its syntax
 * tree walked for:
 * <ul>
 *   <li>imports of a forbidden package, single-type, wildcard or static</li>
 *   <li>fully qualified references in types, expressions and annotations</li>
 * </ul>
 * A file that does not parse is itself a violation: the gate cannot vouch
 * for code it cannot read.
 *
 * <p>The check is a pure function of the source tree. Files are scanned in
 * parallel, each with its own parser; results are sorted by file and line.
 */
public class AlphaPathLint {

    private static final Logger log = LoggerFactory.getLogger(AlphaPathLint.class);

    private final List<String> alphaPaths;
    private final List<String> forbiddenPackages;
    private final Clock clock;

    public AlphaPathLint(List<String> alphaPaths, List<String> forbiddenPackages, Clock clock) {
        this.alphaPaths = List.copyOf(alphaPaths);
        this.forbiddenPackages = List.copyOf(forbiddenPackages);
        this.clock = clock;
    }

    /** Scans every alpha path under {@code root}. A missing alpha path contributes no files. */
    public LintResult check(Path root) {
        List<Path> files = new ArrayList<>();
        for (String alphaPath : alphaPaths) {
            Path directory = root.resolve(alphaPath);
            if (!Files.isDirectory(directory)) {
                log.warn("Alpha path {} does not exist under {}; nothing to scan", alphaPath, root);
                continue;
            }
            files.addAll(javaFiles(directory));
        }

        List<LintViolation> violations = files.parallelStream()
                .flatMap(file -> checkFile(root, file).stream())
                .toList();
        log.info("Alpha path lint: {} files, {} violations", files.size(), violations.size());
        return LintResult.of(violations, files.size(), clock.instant());
    }

    List<LintViolation> checkFile(Path root, Path file) {
        String path = root.relativize(file).toString().replace('\\', '/');
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }
        return checkSource(path, source);
    }

    /** Checks one compilation unit given as text; {@code path} only labels the findings. */
    public List<LintViolation> checkSource(String path, String source) {
        JavaParser parser = new JavaParser(
                new ParserConfiguration().setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
        ParseResult<CompilationUnit> result = parser.parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            Problem problem = result.getProblems().isEmpty() ? null : result.getProblems().get(0);
            int line = problem == null ? 0 : problem.getLocation()
                    .flatMap(TokenRange::toRange)
                    .map(range -> range.begin.line)
                    .orElse(0);
            String message = problem == null ? "unparseable source" : problem.getVerboseMessage();
            return List.of(new LintViolation(
                    LintViolation.Kind.PARSE_ERROR, path, line, null, "cannot parse: " + message));
        }

        CompilationUnit unit = result.getResult().get();
        List<LintViolation> violations = new ArrayList<>();

        for (ImportDeclaration declaration : unit.getImports()) {
            String name = declaration.getNameAsString();
            String imported = declaration.isAsterisk() ? name + ".*" : name;
            forbiddenPackageOf(name).ifPresent(pkg -> violations.add(new LintViolation(
                    LintViolation.Kind.IMPORT, path, line(declaration), imported,
                    (declaration.isStatic() ? "forbidden static import '" : "forbidden import '")
                            + imported + "' from " + pkg)));
        }

        for (ClassOrInterfaceType type : unit.findAll(ClassOrInterfaceType.class)) {
            if (isScopeOfParent(type)) {
                continue;
            }
            reference(path, type, type.getNameWithScope(), violations);
        }
        for (FieldAccessExpr access : unit.findAll(FieldAccessExpr.class)) {
            if (isScopeOfParent(access)) {
                continue;
            }
            reference(path, access, access.toString(), violations);
        }
        for (AnnotationExpr annotation : unit.findAll(AnnotationExpr.class)) {
            reference(path, annotation, annotation.getNameAsString(), violations);
        }
        return violations;
    }

    private void reference(String path, Node node, String qualifiedName, List<LintViolation> violations) {
        forbiddenPackageOf(qualifiedName).ifPresent(pkg -> violations.add(new LintViolation(
                LintViolation.Kind.REFERENCE, path, line(node), qualifiedName,
                "forbidden reference '" + qualifiedName + "' into " + pkg)));
    }

    private Optional<String> forbiddenPackageOf(String qualifiedName) {
        return forbiddenPackages.stream()
                .filter(pkg -> qualifiedName.equals(pkg) || qualifiedName.startsWith(pkg + "."))
                .findFirst();
    }

    // a.b.C is one reference, not three
    private static boolean isScopeOfParent(ClassOrInterfaceType type) {
        return type.getParentNode()
                .filter(ClassOrInterfaceType.class::isInstance)
                .flatMap(parent -> ((ClassOrInterfaceType) parent).getScope())
                .filter(scope -> scope == type)
                .isPresent();
    }

    private static boolean isScopeOfParent(FieldAccessExpr access) {
        return access.getParentNode()
                .filter(FieldAccessExpr.class::isInstance)
                .map(parent -> ((FieldAccessExpr) parent).getScope())
                .filter(scope -> scope == access)
                .isPresent();
    }

    private static int line(Node node) {
        return node.getBegin().map(position -> position.line).orElse(0);
    }

    private static List<Path> javaFiles(Path directory) {
        try (Stream<Path> walk = Files.walk(directory)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".java"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + directory, e);
        }
    }
}
