package com.alphaguard.lint;

import com.alphaguard.constraint.ConstraintActions;
import com.alphaguard.loader.GovernanceYamlMapper;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Standalone check of the raw governance documents, independent of the loader.
 *
 * <p>Reads {@code constraints/} and {@code factors/} under a config directory:
 * <ul>
 *   <li>every key under a constraint's {@code actions} must be in the allowlist</li>
 *   <li>every factor must declare a non-empty {@code failure_rules} list</li>
 * </ul>
 * Files whose names start with {@code _} are templates and skipped, as the
 * loader does. Documents are read as raw YAML, so a key the typed model would
 * never admit is still reported with its line.
 */
public class ActionAllowlistLint {

    private static final Logger log = LoggerFactory.getLogger(ActionAllowlistLint.class);

    static final String ACTIONS_KEY = "actions";
    static final String FAILURE_RULES_KEY = "failure_rules";

    private final ObjectMapper yamlMapper = GovernanceYamlMapper.create();
    private final Set<String> allowedActionFields;
    private final Clock clock;

    public ActionAllowlistLint(Clock clock) {
        this(ConstraintActions.ALLOWED_FIELDS, clock);
    }

    public ActionAllowlistLint(Set<String> allowedActionFields, Clock clock) {
        this.allowedActionFields = Set.copyOf(allowedActionFields);
        this.clock = clock;
    }

    public LintResult check(Path configDir) {
        List<Path> constraints = yamlFiles(configDir.resolve("constraints"));
        List<Path> factors = yamlFiles(configDir.resolve("factors"));

        List<LintViolation> violations = new ArrayList<>();
        violations.addAll(constraints.parallelStream()
                .flatMap(file -> checkConstraint(label(configDir, file), read(file)).stream())
                .toList());
        violations.addAll(factors.parallelStream()
                .flatMap(file -> checkFactor(label(configDir, file), read(file)).stream())
                .toList());

        int checked = constraints.size() + factors.size();
        log.info("Action allowlist lint: {} constraint files, {} factor files, {} violations",
                constraints.size(), factors.size(), violations.size());
        return LintResult.of(violations, checked, clock.instant());
    }

    /** Reports every {@code actions} key outside the allowlist, with its line. */
    public List<LintViolation> checkConstraint(String path, String content) {
        List<LintViolation> violations = new ArrayList<>();
        try (JsonParser parser = yamlMapper.getFactory().createParser(content)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                return violations;
            }
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String name = parser.currentName();
                JsonToken value = parser.nextToken();
                if (ACTIONS_KEY.equals(name) && value == JsonToken.START_OBJECT) {
                    checkActions(path, parser, violations);
                } else {
                    parser.skipChildren();
                }
            }
        } catch (JsonProcessingException e) {
            violations.add(parseError(path, e));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot parse " + path, e);
        }
        return violations;
    }

    private void checkActions(String path, JsonParser parser, List<LintViolation> violations) throws IOException {
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String field = parser.currentName();
            int line = parser.currentTokenLocation().getLineNr();
            if (!allowedActionFields.contains(field)) {
                violations.add(new LintViolation(LintViolation.Kind.ACTION_FIELD, path, line, field,
                        "action field '" + field + "' is not allowed (allowed: "
                                + new TreeSet<>(allowedActionFields) + ")"));
            }
            parser.nextToken();
            parser.skipChildren();
        }
    }

    /** Reports a factor without at least one failure rule. */
    public List<LintViolation> checkFactor(String path, String content) {
        JsonNode root;
        try {
            root = yamlMapper.readTree(content);
        } catch (JsonProcessingException e) {
            return List.of(parseError(path, e));
        }
        if (root == null || !root.isObject()) {
            return List.of();
        }
        JsonNode rules = root.get(FAILURE_RULES_KEY);
        if (rules == null || !rules.isArray() || rules.isEmpty()) {
            return List.of(new LintViolation(LintViolation.Kind.FAILURE_RULE, path, 0, FAILURE_RULES_KEY,
                    "factor '" + root.path("id").asText("?") + "' has no failure rule"));
        }
        return List.of();
    }

    private static LintViolation parseError(String path, JsonProcessingException e) {
        JsonLocation location = e.getLocation();
        int line = location == null ? 0 : Math.max(location.getLineNr(), 0);
        return new LintViolation(LintViolation.Kind.PARSE_ERROR, path, line, null,
                "malformed YAML: " + e.getOriginalMessage());
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }
    }

    private static String label(Path configDir, Path file) {
        return configDir.relativize(file).toString().replace('\\', '/');
    }

    private static List<Path> yamlFiles(Path directory) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> list = Files.list(directory)) {
            return list.filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return !name.startsWith("_") && (name.endsWith(".yml") || name.endsWith(".yaml"));
                    })
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + directory, e);
        }
    }
}
