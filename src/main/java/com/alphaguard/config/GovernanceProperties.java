package com.alphaguard.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the governance engine, read from the
 * {@code alphaguard.governance} prefix.
 *
 * <p>The declarative documents themselves (hypotheses, constraints, factors,
 * pool and regime settings) live under {@link #configDir}; these properties
 * only control how the engine loads, caches, monitors and audits them.
 */
@ConfigurationProperties(prefix = "alphaguard.governance")
@Getter
@Setter
public class GovernanceProperties {

    /** Root of the governance documents. Any Spring resource location. */
    private String configDir = "classpath:governance";

    /** Load and publish all documents when the application starts. */
    private boolean loadOnStartup = true;

    private Resolver resolver = new Resolver();

    private Monitor monitor = new Monitor();

    private Pool pool = new Pool();

    private Regime regime = new Regime();

    private Audit audit = new Audit();

    private Alerts alerts = new Alerts();

    private Lint lint = new Lint();

    @Getter
    @Setter
    public static class Resolver {

        /** Time-to-live of a resolved-constraints cache entry. */
        private Duration cacheTtl = Duration.ofSeconds(60);

        private long cacheMaxSize = 10_000;
    }

    @Getter
    @Setter
    public static class Monitor {

        private boolean enabled = true;

        /** When the falsifier cycle runs. Daily before the session by default. */
        private String cron = "0 30 6 * * *";

        /** Minimum spacing between checks of one falsifier, per window class. */
        private Map<String, Duration> windowCadence = new LinkedHashMap<>(Map.of(
                "market", Duration.ofDays(1),
                "fundamental", Duration.ofDays(7)));

        /** Window units treated as fundamental (checked on the slower cadence). */
        private List<String> fundamentalWindowUnits = new ArrayList<>(List.of("q", "y"));
    }

    @Getter
    @Setter
    public static class Pool {

        /** Scheduled rebuild, once per session on weekdays by default. */
        private String rebuildCron = "0 0 6 * * MON-FRI";
    }

    @Getter
    @Setter
    public static class Regime {

        private long detectIntervalMs = 60_000;
    }

    @Getter
    @Setter
    public static class Audit {

        /** {@code jpa} for the durable table, {@code memory} for a process-local store. */
        private String store = "jpa";
    }

    @Getter
    @Setter
    public static class Alerts {

        /** Channels stamped on generated alerts. Delivery itself is external. */
        private List<String> channels = new ArrayList<>(List.of("log"));
    }

    @Getter
    @Setter
    public static class Lint {

        /** Source directories, relative to the scanned root, that hold alpha computation. */
        private List<String> alphaPaths = new ArrayList<>(List.of("src/main/java/com/alphaguard/alpha"));

        /** Packages alpha code must never import or reference. */
        private List<String> forbiddenPackages =
                new ArrayList<>(List.of("com.alphaguard.hypothesis", "com.alphaguard.constraint"));
    }
}
