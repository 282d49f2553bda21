package com.alphaguard.notification;

import com.alphaguard.domain.enums.AlertSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Built-in handler: writes every alert to the application log. */
@Component
public class LoggingAlertHandler implements AlertHandler {

    private static final Logger log = LoggerFactory.getLogger(LoggingAlertHandler.class);

    @Override
    public void handle(Alert alert) {
        if (alert.getSeverity() == AlertSeverity.CRITICAL) {
            log.error("[ALERT {}] {}: {} (action: {})",
                    alert.getSeverity(), alert.getTitle(), alert.getMessage(), alert.getRecommendedAction());
        } else {
            log.warn("[ALERT {}] {}: {} (action: {})",
                    alert.getSeverity(), alert.getTitle(), alert.getMessage(), alert.getRecommendedAction());
        }
    }
}
