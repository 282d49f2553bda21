package com.alphaguard.pool;

import com.alphaguard.audit.GovernanceAuditLogger;
import com.alphaguard.domain.enums.RegistryKind;
import com.alphaguard.event.GovernanceRegistryChangedEvent;
import com.alphaguard.exception.EmptyPoolException;
import com.alphaguard.exception.ResourceNotFoundException;
import com.alphaguard.notification.AlertDispatcher;
import com.alphaguard.notification.AlertGenerator;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Holds the current trading pool.
 *
 * <p>The pool is rebuilt on demand, once per session on a schedule, and lazily
 * after any hypothesis or constraint change marks it stale. Every successful
 * build is audited as POOL_BUILT. An empty result raises a CRITICAL alert and
 * leaves no pool in place, so callers keep getting {@link EmptyPoolException}
 * until the inputs change: there is no fallback pool. The failed build is
 * remembered, so those callers get the same exception without another build or
 * another alert.
 */
@Service
public class PoolService {

    private static final Logger log = LoggerFactory.getLogger(PoolService.class);

    private final PoolBuilder poolBuilder;
    private final GovernanceAuditLogger auditLogger;
    private final AlertGenerator alertGenerator;
    private final AlertDispatcher alertDispatcher;

    private PoolInputs inputs;
    private Pool current;
    private EmptyPoolException lastEmpty;
    private volatile boolean stale = true;

    public PoolService(
            PoolBuilder poolBuilder,
            GovernanceAuditLogger auditLogger,
            AlertGenerator alertGenerator,
            AlertDispatcher alertDispatcher) {
        this.poolBuilder = poolBuilder;
        this.auditLogger = auditLogger;
        this.alertGenerator = alertGenerator;
        this.alertDispatcher = alertDispatcher;
    }

    public synchronized void configure(PoolInputs poolInputs) {
        this.inputs = poolInputs;
        this.lastEmpty = null;
        this.stale = true;
        log.info("Pool inputs configured: {} universe entries", poolInputs.getUniverse().size());
    }

    public synchronized boolean isConfigured() {
        return inputs != null;
    }

    /**
     * Builds a new pool from the configured inputs and makes it current.
     *
     * @throws EmptyPoolException if nothing survives filtering; an alert is sent first
     * @throws ResourceNotFoundException if no inputs have been configured
     */
    public synchronized Pool rebuild() {
        if (inputs == null) {
            throw new ResourceNotFoundException("Pool inputs", "pool/universe.yml");
        }
        try {
            Pool pool = poolBuilder.build(inputs.getUniverse(), inputs.getFilters(), inputs.getGating());
            auditLogger.poolBuilt(pool);
            current = pool;
            lastEmpty = null;
            stale = false;
            return pool;
        } catch (EmptyPoolException e) {
            current = null;
            lastEmpty = e;
            stale = false;
            alertDispatcher.dispatch(alertGenerator.emptyPool(e));
            throw e;
        }
    }

    /**
     * The current pool, rebuilding first when stale.
     *
     * @throws EmptyPoolException if the last build was empty and nothing changed since
     */
    public synchronized Pool current() {
        if (!stale && lastEmpty != null) {
            throw lastEmpty;
        }
        if (stale || current == null) {
            return rebuild();
        }
        return current;
    }

    /** Last successfully built pool without triggering a build. */
    public synchronized Optional<Pool> peek() {
        return Optional.ofNullable(current);
    }

    @EventListener
    public void onRegistryChanged(GovernanceRegistryChangedEvent event) {
        if (event.getRegistryKind() != RegistryKind.FACTOR) {
            stale = true;
            log.debug("Pool marked stale by {} registry {}", event.getRegistryKind(), event.getCause());
        }
    }

    @Scheduled(cron = "${alphaguard.governance.pool.rebuild-cron:0 0 6 * * MON-FRI}")
    public void scheduledRebuild() {
        if (!isConfigured()) {
            return;
        }
        try {
            rebuild();
        } catch (EmptyPoolException e) {
            log.error("Scheduled pool rebuild produced an empty pool; strategy execution is blocked");
        }
    }
}
