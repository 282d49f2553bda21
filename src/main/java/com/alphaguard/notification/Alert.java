package com.alphaguard.notification;

import com.alphaguard.domain.enums.AlertSeverity;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * A structured governance alert handed to delivery handlers.
 *
 * <p>Generation is decoupled from delivery: {@link AlertGenerator} builds
 * alerts, {@link AlertDispatcher} passes them to every {@link AlertHandler}.
 * {@code channels} records where delivery was requested; the transport
 * behind a channel is outside the engine.
 */
@Data
@Builder
public class Alert {

    private String id;
    private AlertSeverity severity;

    /** Component that raised the alert, e.g. {@code falsifier_monitor}. */
    private String source;

    private String title;
    private String message;
    private String hypothesisId;

    @Builder.Default
    private List<String> constraintIds = List.of();

    private String recommendedAction;

    @Builder.Default
    private Map<String, Object> details = Map.of();

    @Builder.Default
    private List<String> channels = List.of();

    private Instant createdAt;

    private boolean delivered;
}
