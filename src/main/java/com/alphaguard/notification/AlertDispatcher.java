package com.alphaguard.notification;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Hands each alert to every registered {@link AlertHandler}.
 *
 * <p>Handlers run one after another. A failing handler is logged and skipped;
 * the remaining handlers still receive the alert. The alert counts as delivered
 * when at least one handler succeeded.
 */
@Service
public class AlertDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AlertDispatcher.class);

    private final List<AlertHandler> handlers;

    public AlertDispatcher(List<AlertHandler> handlers) {
        this.handlers = List.copyOf(handlers);
    }

    public Alert dispatch(Alert alert) {
        int succeeded = 0;
        for (AlertHandler handler : handlers) {
            try {
                handler.handle(alert);
                succeeded++;
            } catch (Exception e) {
                log.error("Alert handler {} failed for alert {}: {}",
                        handler.getClass().getSimpleName(), alert.getId(), e.getMessage(), e);
            }
        }
        alert.setDelivered(succeeded > 0);
        return alert;
    }
}
