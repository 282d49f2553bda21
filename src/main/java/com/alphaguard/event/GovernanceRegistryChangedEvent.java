package com.alphaguard.event;

import com.alphaguard.domain.enums.RegistryKind;
import java.util.List;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a registry publishes a new snapshot.
 *
 * <p>Consumers must treat this as a broadcast: the constraint resolver drops its
 * whole cache, the pool service marks its pool stale. No consumer attempts a
 * per-entity repair.
 */
@Getter
public class GovernanceRegistryChangedEvent extends ApplicationEvent {

    private final RegistryKind registryKind;
    private final List<String> entityIds;
    private final String cause;
    private final long registryVersion;

    public GovernanceRegistryChangedEvent(
            Object source, RegistryKind registryKind, List<String> entityIds, String cause, long registryVersion) {
        super(source);
        this.registryKind = registryKind;
        this.entityIds = List.copyOf(entityIds);
        this.cause = cause;
        this.registryVersion = registryVersion;
    }
}
