package com.alphaguard.unit.lint;

import static com.alphaguard.unit.GovernanceFixtures.fixedClock;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.alphaguard.lint.AlphaPathLint;
import com.alphaguard.lint.LintResult;
import com.alphaguard.lint.LintViolation;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for {@link AlphaPathLint}.
 */
class AlphaPathLintTest {

    private static final String ALPHA_PATH = "src/main/java/com/acme/alpha";

    @TempDir
    Path root;

    private AlphaPathLint lint;

    @BeforeEach
    void setUp() {
        lint = new AlphaPathLint(
                List.of(ALPHA_PATH),
                List.of("com.alphaguard.hypothesis", "com.alphaguard.constraint"),
                fixedClock());
    }

    private void write(String relative, String source) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, source);
    }

    @Nested
    @DisplayName("check")
    class Check {

        @Test
        @DisplayName("one forbidden import gives exactly one violation at its file and line")
        void singleImportViolation() throws IOException {
            write(ALPHA_PATH + "/MomentumSignal.java", """
                    package com.acme.alpha;

                    import java.util.List;
                    import com.alphaguard.hypothesis.Hypothesis;

                    public class MomentumSignal {
                        double score(List<Double> returns, Hypothesis hint) {
                            return returns.stream().mapToDouble(Double::doubleValue).sum();
                        }
                    }
                    """);
            write(ALPHA_PATH + "/MeanReversion.java", """
                    package com.acme.alpha;

                    public class MeanReversion {
                        double score(double z) {
                            return -z;
                        }
                    }
                    """);

            LintResult result = lint.check(root);

            assertThat(result.passed()).isFalse();
            assertThat(result.getCheckedFiles()).isEqualTo(2);
            assertThat(result.getViolations()).singleElement().satisfies(v -> {
                assertThat(v.getKind()).isEqualTo(LintViolation.Kind.IMPORT);
                assertThat(v.getPath()).isEqualTo(ALPHA_PATH + "/MomentumSignal.java");
                assertThat(v.getLine()).isEqualTo(4);
                assertThat(v.getSymbol()).isEqualTo("com.alphaguard.hypothesis.Hypothesis");
                assertThat(v.location()).isEqualTo(ALPHA_PATH + "/MomentumSignal.java:4");
            });
        }

        @Test
        @DisplayName("a clean alpha tree passes")
        void cleanTreePasses() throws IOException {
            write(ALPHA_PATH + "/MeanReversion.java", """
                    package com.acme.alpha;

                    import com.alphaguard.hypothesisx.NotGovernance;

                    public class MeanReversion {
                    }
                    """);

            LintResult result = lint.check(root);

            assertThat(result.passed()).isTrue();
            assertThat(result.getCheckedFiles()).isEqualTo(1);
        }

        @Test
        @DisplayName("governance imports outside the alpha paths are not checked")
        void outsideAlphaPathIgnored() throws IOException {
            write("src/main/java/com/acme/execution/Router.java", """
                    package com.acme.execution;

                    import com.alphaguard.constraint.ConstraintResolver;

                    public class Router {
                    }
                    """);

            assertThat(lint.check(root).passed()).isTrue();
        }

        @Test
        @DisplayName("a missing alpha path scans nothing")
        void missingAlphaPath() {
            LintResult result = lint.check(root);

            assertThat(result.passed()).isTrue();
            assertThat(result.getCheckedFiles()).isZero();
        }
    }

    @Nested
    @DisplayName("checkSource")
    class CheckSource {

        @Test
        @DisplayName("wildcard and static imports are reported")
        void wildcardAndStatic() {
            List<LintViolation> violations = lint.checkSource("Signal.java", """
                    package com.acme.alpha;

                    import com.alphaguard.constraint.*;
                    import static com.alphaguard.hypothesis.HypothesisStatus.ACTIVE;

                    class Signal {
                    }
                    """);

            assertThat(violations).extracting(LintViolation::getSymbol)
                    .containsExactly("com.alphaguard.constraint.*", "com.alphaguard.hypothesis.HypothesisStatus.ACTIVE");
            assertThat(violations.get(1).getMessage()).startsWith("forbidden static import");
        }

        @Test
        @DisplayName("fully qualified references are reported once each")
        void qualifiedReferences() {
            List<LintViolation> violations = lint.checkSource("Signal.java", """
                    package com.acme.alpha;

                    class Signal {
                        com.alphaguard.constraint.ResolvedConstraints resolved;

                        Object status() {
                            return com.alphaguard.hypothesis.HypothesisStatus.ACTIVE;
                        }
                    }
                    """);

            assertThat(violations).extracting(LintViolation::getKind, LintViolation::getLine, LintViolation::getSymbol)
                    .containsExactly(
                            tuple(LintViolation.Kind.REFERENCE, 4,
                                    "com.alphaguard.constraint.ResolvedConstraints"),
                            tuple(LintViolation.Kind.REFERENCE, 7,
                                    "com.alphaguard.hypothesis.HypothesisStatus.ACTIVE"));
        }

        @Test
        @DisplayName("a file that does not parse is a violation")
        void parseError() {
            List<LintViolation> violations = lint.checkSource("Broken.java", """
                    package com.acme.alpha;

                    class Broken {
                        void run( {
                    }
                    """);

            assertThat(violations).singleElement().satisfies(v -> {
                assertThat(v.getKind()).isEqualTo(LintViolation.Kind.PARSE_ERROR);
                assertThat(v.getMessage()).startsWith("cannot parse");
            });
        }
    }
}
