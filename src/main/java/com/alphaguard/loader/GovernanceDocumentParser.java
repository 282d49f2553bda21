package com.alphaguard.loader;

import com.alphaguard.constraint.Constraint;
import com.alphaguard.constraint.ConstraintActions;
import com.alphaguard.exception.ValidationException;
import com.alphaguard.factor.Factor;
import com.alphaguard.hypothesis.Hypothesis;
import com.alphaguard.pool.PoolGatingConfig;
import com.alphaguard.pool.StructuralFilters;
import com.alphaguard.pool.UniverseEntry;
import com.alphaguard.regime.RegimeConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/**
 * Parses one governance YAML document into its typed model and validates it.
 *
 * <p>Every failure is a {@link ValidationException} naming the source file and
 * the offending field in document spelling (snake_case, with list indexes),
 * e.g. {@code falsifiers[0].operator}. Nothing is coerced or dropped: unknown
 * keys, wrong types and out-of-range values all fail.
 *
 * <p>Two gates run on top of field validation:
 * <ul>
 *   <li>a hypothesis must declare at least one falsifier</li>
 *   <li>constraint actions may only use the closed field set</li>
 * </ul>
 */
@Component
public class GovernanceDocumentParser {

    static final String DOCUMENT_FIELD = "<document>";

    private static final TypeReference<List<UniverseEntry>> UNIVERSE_TYPE = new TypeReference<>() {};

    private final ObjectMapper yamlMapper = GovernanceYamlMapper.create();
    private final Validator validator;

    public GovernanceDocumentParser(Validator validator) {
        this.validator = validator;
    }

    public Hypothesis parseHypothesis(String source, String content) {
        Hypothesis hypothesis = parse(source, content, Hypothesis.class);
        if (hypothesis.getFalsifiers().isEmpty()) {
            throw new ValidationException(source, "falsifiers", "a hypothesis needs at least one falsifier");
        }
        return hypothesis;
    }

    public Constraint parseConstraint(String source, String content) {
        return parse(source, content, Constraint.class);
    }

    public Factor parseFactor(String source, String content) {
        return parse(source, content, Factor.class);
    }

    public StructuralFilters parseFilters(String source, String content) {
        return parse(source, content, StructuralFilters.class);
    }

    public PoolGatingConfig parseGating(String source, String content) {
        return parse(source, content, PoolGatingConfig.class);
    }

    public RegimeConfig parseRegime(String source, String content) {
        return parse(source, content, RegimeConfig.class);
    }

    /** A universe document is a YAML list of entries. */
    public List<UniverseEntry> parseUniverse(String source, String content) {
        List<UniverseEntry> universe = read(source, content, yamlMapper.getTypeFactory().constructType(UNIVERSE_TYPE));
        for (int i = 0; i < universe.size(); i++) {
            if (universe.get(i) == null) {
                throw new ValidationException(source, "[" + i + "]", "must not be null");
            }
            validate(source, universe.get(i), "[" + i + "].");
        }
        return universe;
    }

    private <T> T parse(String source, String content, Class<T> type) {
        T value = read(source, content, yamlMapper.constructType(type));
        validate(source, value, "");
        return value;
    }

    private <T> T read(String source, String content, JavaType type) {
        if (content == null || content.isBlank()) {
            throw new ValidationException(source, DOCUMENT_FIELD, "document is empty");
        }
        T value;
        try {
            value = yamlMapper.readValue(content, type);
        } catch (UnrecognizedPropertyException e) {
            String field = path(e);
            String reason = field.startsWith("actions.")
                    ? "not an allowed action field (allowed: " + new TreeSet<>(ConstraintActions.ALLOWED_FIELDS) + ")"
                    : "unknown field";
            throw new ValidationException(source, field, reason, e);
        } catch (JsonMappingException e) {
            throw new ValidationException(source, path(e), e.getOriginalMessage(), e);
        } catch (JsonProcessingException e) {
            throw new ValidationException(source, DOCUMENT_FIELD, "malformed YAML: " + e.getOriginalMessage(), e);
        }
        if (value == null) {
            throw new ValidationException(source, DOCUMENT_FIELD, "document is empty");
        }
        return value;
    }

    private <T> void validate(String source, T value, String prefix) {
        Set<ConstraintViolation<T>> violations = validator.validate(value);
        if (violations.isEmpty()) {
            return;
        }
        List<ConstraintViolation<T>> sorted = violations.stream()
                .sorted(Comparator.comparing((ConstraintViolation<T> v) -> v.getPropertyPath().toString())
                        .thenComparing(ConstraintViolation::getMessage))
                .toList();
        ConstraintViolation<T> first = sorted.get(0);
        String reason = first.getMessage();
        if (sorted.size() > 1) {
            reason += " (and " + (sorted.size() - 1) + " more violation(s))";
        }
        throw new ValidationException(source, prefix + snakeCase(first.getPropertyPath().toString()), reason);
    }

    private static String path(JsonMappingException e) {
        StringBuilder path = new StringBuilder();
        for (JsonMappingException.Reference reference : e.getPath()) {
            if (reference.getIndex() >= 0) {
                path.append('[').append(reference.getIndex()).append(']');
            } else if (reference.getFieldName() != null) {
                if (path.length() > 0) {
                    path.append('.');
                }
                path.append(reference.getFieldName());
            }
        }
        return path.length() == 0 ? DOCUMENT_FIELD : path.toString();
    }

    static String snakeCase(String propertyPath) {
        return propertyPath.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase(Locale.ROOT);
    }
}
