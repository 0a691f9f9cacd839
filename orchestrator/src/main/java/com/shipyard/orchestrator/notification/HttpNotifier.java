package com.shipyard.orchestrator.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shipyard.orchestrator.http.CollaboratorHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Posts events to the notification service without waiting for the answer.
 * A failed delivery is logged and dropped.
 */
@Component
public class HttpNotifier extends CollaboratorHttpClient implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(HttpNotifier.class);

    public HttpNotifier(@Value("${shipyard.notifications.base-url}") String baseUrl,
                        ObjectMapper objectMapper) {
        super(baseUrl, objectMapper);
    }

    @Override
    public void notify(NotificationEvent event) {
        try {
            postAsync("/events", event).whenComplete((status, error) -> {
                if (error != null) {
                    log.warn("Notification {} for workflow {} not delivered: {}",
                            event.type(), event.workflowId(), error.getMessage());
                } else if (status >= 300) {
                    log.warn("Notification {} for workflow {} rejected with HTTP {}",
                            event.type(), event.workflowId(), status);
                }
            });
        } catch (RuntimeException e) {
            log.warn("Notification {} for workflow {} not sent: {}",
                    event.type(), event.workflowId(), e.getMessage());
        }
    }
}
