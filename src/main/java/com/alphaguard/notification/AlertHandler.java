package com.alphaguard.notification;

/**
 * Delivery hook for governance alerts. Implementations are Spring beans; all of
 * them receive every alert. A handler may throw; the dispatcher isolates it.
 */
public interface AlertHandler {

    void handle(Alert alert);
}
