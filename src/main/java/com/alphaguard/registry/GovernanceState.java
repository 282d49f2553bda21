package com.alphaguard.registry;

import com.alphaguard.constraint.Constraint;
import com.alphaguard.constraint.ConstraintRegistry;
import com.alphaguard.hypothesis.Hypothesis;
import com.alphaguard.hypothesis.HypothesisRegistry;
import java.util.Collection;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Pairs the hypothesis and constraint registries for readers that need both.
 *
 * <p>A constraint's effect depends on hypothesis status, so resolution and pool
 * builds must read the two sets from the same point in time. {@link #capture()}
 * takes both snapshots under the read lock; {@link #replaceAll} swaps both sets
 * under the write lock and publishes the change events only after the second
 * swap, so neither a concurrent reader nor an event listener can observe the
 * new hypotheses next to the old constraints.
 *
 * <p>Single-entity writes (register, activate, sunset) touch one registry and
 * stay outside the lock.
 */
@Component
public class GovernanceState {

    private static final Logger log = LoggerFactory.getLogger(GovernanceState.class);

    private final HypothesisRegistry hypothesisRegistry;
    private final ConstraintRegistry constraintRegistry;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public GovernanceState(HypothesisRegistry hypothesisRegistry, ConstraintRegistry constraintRegistry) {
        this.hypothesisRegistry = hypothesisRegistry;
        this.constraintRegistry = constraintRegistry;
    }

    public GovernanceView capture() {
        lock.readLock().lock();
        try {
            return new GovernanceView(hypothesisRegistry.snapshot(), constraintRegistry.snapshot());
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Swaps both sets as one update, then announces each registry change. */
    public GovernanceView replaceAll(
            Collection<Hypothesis> hypotheses, Collection<Constraint> constraints, String cause) {
        GovernanceView replaced;
        lock.writeLock().lock();
        try {
            replaced = new GovernanceView(
                    hypothesisRegistry.swapAll(hypotheses), constraintRegistry.swapAll(constraints));
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Governance state swapped ({}): hypotheses v{}, constraints v{}",
                cause, replaced.hypothesisVersion(), replaced.constraintVersion());
        hypothesisRegistry.announceReplaced(replaced.getHypotheses(), cause);
        constraintRegistry.announceReplaced(replaced.getConstraints(), cause);
        return replaced;
    }
}
