package com.alphaguard.loader;

import com.alphaguard.config.GovernanceProperties;
import com.alphaguard.constraint.Constraint;
import com.alphaguard.exception.ValidationException;
import com.alphaguard.factor.Factor;
import com.alphaguard.factor.FactorRegistry;
import com.alphaguard.hypothesis.Hypothesis;
import com.alphaguard.pool.PoolInputs;
import com.alphaguard.pool.PoolService;
import com.alphaguard.regime.RegimeDetector;
import com.alphaguard.registry.GovernanceState;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.BiFunction;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Service;

/**
 * Reads every governance document under the config directory and publishes
 * the result to the registries, the pool service and the regime detector.
 *
 * <p>Layout under {@code alphaguard.governance.config-dir}:
 * <pre>
 *   hypotheses/*.yml   one hypothesis per file
 *   constraints/*.yml  one constraint per file
 *   factors/*.yml      one factor per file
 *   pool/universe.yml  list of universe entries
 *   pool/filters.yml   structural filters
 *   pool/gating.yml    hypothesis gating
 *   regime/thresholds.yml
 * </pre>
 * Files are read in name order; names starting with {@code _} are templates and
 * skipped. Loading is all-or-nothing: every document is parsed and validated
 * before any snapshot is published. Hypotheses and constraints are then
 * swapped together through {@link GovernanceState}.
 */
@Service
public class GovernanceConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(GovernanceConfigLoader.class);

    private static final Set<String> YAML_EXTENSIONS = Set.of(".yml", ".yaml");

    private final ResourcePatternResolver resourceResolver;
    private final GovernanceDocumentParser parser;
    private final GovernanceState governanceState;
    private final FactorRegistry factorRegistry;
    private final PoolService poolService;
    private final RegimeDetector regimeDetector;
    private final GovernanceProperties properties;

    public GovernanceConfigLoader(
            ResourcePatternResolver resourceResolver,
            GovernanceDocumentParser parser,
            GovernanceState governanceState,
            FactorRegistry factorRegistry,
            PoolService poolService,
            RegimeDetector regimeDetector,
            GovernanceProperties properties) {
        this.resourceResolver = resourceResolver;
        this.parser = parser;
        this.governanceState = governanceState;
        this.factorRegistry = factorRegistry;
        this.poolService = poolService;
        this.regimeDetector = regimeDetector;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadOnStartup() {
        if (properties.isLoadOnStartup()) {
            loadAll();
        }
    }

    /** Reads and publishes the whole config directory. */
    public GovernanceDocuments loadAll() {
        return publish(read(), "load");
    }

    /** Re-reads the config directory and swaps every snapshot. A failure leaves the current state untouched. */
    public GovernanceDocuments reload() {
        return publish(read(), "reload");
    }

    /** Reads and validates everything without publishing. */
    public GovernanceDocuments read() {
        String root = properties.getConfigDir();
        List<Hypothesis> hypotheses = readDirectory(root, "hypotheses", parser::parseHypothesis, Hypothesis::getId);
        List<Constraint> constraints = readDirectory(root, "constraints", parser::parseConstraint, Constraint::getId);
        List<Factor> factors = readDirectory(root, "factors", parser::parseFactor, Factor::getId);

        GovernanceDocuments.GovernanceDocumentsBuilder documents = GovernanceDocuments.builder()
                .hypotheses(hypotheses)
                .constraints(constraints)
                .factors(factors);

        readFile(root, "pool/universe.yml")
                .ifPresent(doc -> documents.universe(parser.parseUniverse(doc.name(), doc.content())));
        readFile(root, "pool/filters.yml")
                .ifPresent(doc -> documents.filters(parser.parseFilters(doc.name(), doc.content())));
        readFile(root, "pool/gating.yml")
                .ifPresent(doc -> documents.gating(parser.parseGating(doc.name(), doc.content())));
        readFile(root, "regime/thresholds.yml")
                .ifPresent(doc -> documents.regime(parser.parseRegime(doc.name(), doc.content())));

        warnOnDanglingReferences(hypotheses, constraints);
        return documents.build();
    }

    private GovernanceDocuments publish(GovernanceDocuments documents, String cause) {
        governanceState.replaceAll(documents.getHypotheses(), documents.getConstraints(), cause);
        factorRegistry.replaceAll(documents.getFactors(), cause);
        if (documents.getUniverse() != null) {
            poolService.configure(new PoolInputs(documents.getUniverse(), documents.getFilters(), documents.getGating()));
        } else {
            log.warn("No pool/universe.yml under {}; pool cannot be built", properties.getConfigDir());
        }
        if (documents.getRegime() != null) {
            regimeDetector.configure(documents.getRegime());
        } else {
            log.warn("No regime/thresholds.yml under {}; regime detection disabled", properties.getConfigDir());
        }
        log.info("Governance config {}: {} hypotheses, {} constraints, {} factors from {}",
                cause, documents.getHypotheses().size(), documents.getConstraints().size(),
                documents.getFactors().size(), properties.getConfigDir());
        return documents;
    }

    // ========================
    // READING
    // ========================

    private <T> List<T> readDirectory(
            String root, String directory, BiFunction<String, String, T> parse, Function<T, String> idOf) {
        Map<String, Resource> files = new TreeMap<>();
        for (String extension : YAML_EXTENSIONS) {
            for (Resource resource : resources(root + "/" + directory + "/*" + extension)) {
                String filename = resource.getFilename();
                if (filename != null && !filename.startsWith("_")) {
                    files.put(filename, resource);
                }
            }
        }

        List<T> loaded = new ArrayList<>(files.size());
        Map<String, String> seen = new HashMap<>();
        for (Map.Entry<String, Resource> file : files.entrySet()) {
            String source = directory + "/" + file.getKey();
            T entity = parse.apply(source, content(source, file.getValue()));
            String previous = seen.putIfAbsent(idOf.apply(entity), source);
            if (previous != null) {
                throw new ValidationException(source, "id",
                        "duplicate id '" + idOf.apply(entity) + "', already defined in " + previous);
            }
            loaded.add(entity);
            log.debug("Loaded {} {}", source, idOf.apply(entity));
        }
        loaded.sort(Comparator.comparing(idOf));
        return loaded;
    }

    private Optional<Document> readFile(String root, String relativePath) {
        Resource resource = resourceResolver.getResource(root + "/" + relativePath);
        if (!resource.exists()) {
            return Optional.empty();
        }
        return Optional.of(new Document(relativePath, content(relativePath, resource)));
    }

    private Resource[] resources(String pattern) {
        try {
            return resourceResolver.getResources(pattern);
        } catch (IOException e) {
            // a missing directory means no documents of that kind
            log.debug("No resources for {}: {}", pattern, e.getMessage());
            return new Resource[0];
        }
    }

    private static String content(String source, Resource resource) {
        try {
            return resource.getContentAsString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ValidationException(source, GovernanceDocumentParser.DOCUMENT_FIELD,
                    "unreadable: " + e.getMessage(), e);
        }
    }

    private void warnOnDanglingReferences(List<Hypothesis> hypotheses, List<Constraint> constraints) {
        Set<String> hypothesisIds = new HashSet<>();
        hypotheses.forEach(h -> hypothesisIds.add(h.getId()));
        for (Constraint constraint : constraints) {
            for (String required : constraint.getActivation().getRequiresHypothesesActive()) {
                if (!hypothesisIds.contains(required)) {
                    log.warn("Constraint {} requires unknown hypothesis {}; it will never activate",
                            constraint.getId(), required);
                }
            }
        }
    }

    private record Document(String name, String content) {}
}
