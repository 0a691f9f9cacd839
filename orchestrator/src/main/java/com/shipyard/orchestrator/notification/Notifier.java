package com.shipyard.orchestrator.notification;

/**
 * Fire-and-forget notification sink. Delivery guarantees are the
 * collaborator's business; implementations must not throw.
 */
public interface Notifier {

    void notify(NotificationEvent event);
}
