package com.alphaguard.hypothesis;

import com.alphaguard.domain.enums.HypothesisStatus;
import com.alphaguard.domain.enums.RegistryKind;
import com.alphaguard.domain.model.RegistryFilter;
import com.alphaguard.event.GovernanceRegistryChangedEvent;
import com.alphaguard.exception.IllegalTransitionException;
import com.alphaguard.exception.RegistryConflictException;
import com.alphaguard.exception.ResourceNotFoundException;
import com.alphaguard.registry.RegistrySnapshot;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Sole owner and writer of the hypothesis set.
 *
 * <p>State lives in an immutable {@link RegistrySnapshot} behind an
 * {@link AtomicReference}. Reads are lock-free; writes are serialized on a
 * private monitor, build the next snapshot and swap it in. Every successful
 * write publishes a {@link GovernanceRegistryChangedEvent}.
 *
 * <p>Lifecycle rules enforced here:
 * <ul>
 *   <li>{@link #activate} is the only way into ACTIVE and requires a named approver</li>
 *   <li>a hypothesis without falsifiers can never become ACTIVE</li>
 *   <li>SUNSET and REJECTED are terminal, including across config reloads</li>
 * </ul>
 */
@Component
public class HypothesisRegistry implements HypothesisLookup {

    private static final Logger log = LoggerFactory.getLogger(HypothesisRegistry.class);

    private final AtomicReference<RegistrySnapshot<Hypothesis>> current =
            new AtomicReference<>(RegistrySnapshot.empty());
    private final Object writeLock = new Object();
    private final ApplicationEventPublisher applicationEventPublisher;

    public HypothesisRegistry(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ========================
    // WRITES
    // ========================

    /**
     * Registers a hypothesis. Re-registering identical content is a no-op;
     * reusing an identifier with different content is a conflict.
     *
     * @return true if the registry changed
     */
    public boolean register(Hypothesis hypothesis) {
        if (hypothesis.isActive() && hypothesis.getFalsifiers().isEmpty()) {
            throw new IllegalTransitionException(hypothesis.getId(), "an ACTIVE hypothesis needs at least one falsifier");
        }
        RegistrySnapshot<Hypothesis> next;
        synchronized (writeLock) {
            RegistrySnapshot<Hypothesis> snapshot = current.get();
            Optional<Hypothesis> existing = snapshot.find(hypothesis.getId());
            if (existing.isPresent()) {
                if (existing.get().equals(hypothesis)) {
                    return false;
                }
                throw new RegistryConflictException("Hypothesis", hypothesis.getId());
            }
            next = snapshot.with(hypothesis.getId(), hypothesis);
            current.set(next);
        }
        log.info("Registered hypothesis {} ({})", hypothesis.getId(), hypothesis.getStatus());
        publish(List.of(hypothesis.getId()), "register", next.getVersion());
        return true;
    }

    /**
     * Replaces the whole set in one swap, as done by a config reload.
     *
     * <p>A status changed at runtime survives the reload when the document still
     * says DRAFT: an approved hypothesis stays ACTIVE, and a sunset or rejected
     * one is never resurrected.
     */
    public void replaceAll(Collection<Hypothesis> hypotheses, String cause) {
        announceReplaced(swapAll(hypotheses), cause);
    }

    /**
     * Swaps in the whole set without publishing a change event. Callers that swap
     * several registries together announce each one once all swaps are done.
     */
    public RegistrySnapshot<Hypothesis> swapAll(Collection<Hypothesis> hypotheses) {
        synchronized (writeLock) {
            RegistrySnapshot<Hypothesis> previous = current.get();
            List<Hypothesis> merged = new ArrayList<>(hypotheses.size());
            for (Hypothesis loaded : hypotheses) {
                merged.add(carryRuntimeStatus(previous.find(loaded.getId()).orElse(null), loaded));
            }
            RegistrySnapshot<Hypothesis> next = RegistrySnapshot.of(merged, Hypothesis::getId, previous.getVersion() + 1);
            current.set(next);
            return next;
        }
    }

    public void announceReplaced(RegistrySnapshot<Hypothesis> replaced, String cause) {
        log.info("Hypothesis registry replaced: {} entries, version {}", replaced.size(), replaced.getVersion());
        publish(List.copyOf(replaced.asMap().keySet()), cause, replaced.getVersion());
    }

    /** Human approval: DRAFT -> ACTIVE. */
    public Hypothesis activate(String hypothesisId, String approver) {
        if (approver == null || approver.isBlank()) {
            throw new IllegalTransitionException(hypothesisId, "activation requires a named approver");
        }
        Hypothesis activated = transition(hypothesisId, HypothesisStatus.ACTIVE, "activated by " + approver);
        log.info("Hypothesis {} activated by {}", hypothesisId, approver);
        return activated;
    }

    /** ACTIVE -> SUNSET, from a falsifier trigger or a human decision. */
    public Hypothesis sunset(String hypothesisId, String reason) {
        Hypothesis sunset = transition(hypothesisId, HypothesisStatus.SUNSET, reason);
        log.info("Hypothesis {} sunset: {}", hypothesisId, reason);
        return sunset;
    }

    /** Human rejection from DRAFT or ACTIVE. */
    public Hypothesis reject(String hypothesisId, String reason) {
        Hypothesis rejected = transition(hypothesisId, HypothesisStatus.REJECTED, reason);
        log.info("Hypothesis {} rejected: {}", hypothesisId, reason);
        return rejected;
    }

    private Hypothesis transition(String hypothesisId, HypothesisStatus target, String cause) {
        Hypothesis updated;
        RegistrySnapshot<Hypothesis> next;
        synchronized (writeLock) {
            RegistrySnapshot<Hypothesis> snapshot = current.get();
            Hypothesis existing = snapshot.find(hypothesisId)
                    .orElseThrow(() -> new ResourceNotFoundException("Hypothesis", hypothesisId));
            if (!existing.getStatus().canTransitionTo(target)) {
                throw new IllegalTransitionException(hypothesisId, existing.getStatus(), target);
            }
            if (target == HypothesisStatus.ACTIVE && existing.getFalsifiers().isEmpty()) {
                throw new IllegalTransitionException(hypothesisId, "cannot activate a hypothesis without falsifiers");
            }
            updated = existing.withStatus(target);
            next = snapshot.with(hypothesisId, updated);
            current.set(next);
        }
        publish(List.of(hypothesisId), cause, next.getVersion());
        return updated;
    }

    private Hypothesis carryRuntimeStatus(Hypothesis previous, Hypothesis loaded) {
        if (previous == null || previous.getStatus() == loaded.getStatus()) {
            return loaded;
        }
        if (previous.getStatus().isTerminal() || loaded.getStatus() == HypothesisStatus.DRAFT) {
            return loaded.withStatus(previous.getStatus());
        }
        return loaded;
    }

    private void publish(List<String> ids, String cause, long version) {
        applicationEventPublisher.publishEvent(
                new GovernanceRegistryChangedEvent(this, RegistryKind.HYPOTHESIS, ids, cause, version));
    }

    // ========================
    // READS
    // ========================

    @Override
    public Optional<Hypothesis> find(String hypothesisId) {
        return current.get().find(hypothesisId);
    }

    public Hypothesis get(String hypothesisId) {
        return find(hypothesisId).orElseThrow(() -> new ResourceNotFoundException("Hypothesis", hypothesisId));
    }

    /**
     * Lists hypotheses in identifier order. A symbol filter matches hypotheses
     * whose scope names the symbol or is unrestricted.
     */
    public List<Hypothesis> list(RegistryFilter filter) {
        return current.get().values().stream()
                .filter(h -> filter.getStatus() == null || h.getStatus() == filter.getStatus())
                .filter(h -> filter.getSymbol() == null
                        || h.getScope().isUnrestricted()
                        || h.getScope().getSymbols().contains(filter.getSymbol()))
                .toList();
    }

    public List<Hypothesis> listActive() {
        return list(RegistryFilter.byStatus(HypothesisStatus.ACTIVE));
    }

    /** One consistent view for the duration of a resolution or pool build. */
    public RegistrySnapshot<Hypothesis> snapshot() {
        return current.get();
    }

    public long version() {
        return current.get().getVersion();
    }
}
