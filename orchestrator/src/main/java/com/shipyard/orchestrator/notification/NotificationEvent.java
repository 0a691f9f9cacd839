package com.shipyard.orchestrator.notification;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Payload handed to the notification collaborator.
 */
public record NotificationEvent(
        Type                type,
        UUID                workflowId,
        String              projectId,
        String              workspaceId,
        Map<String, Object> details,
        Instant             occurredAt
) {
    public enum Type {
        RECOVERY_ESCALATION,
        QA_ESCALATION,
        PIPELINE_COMPLETE,
        PIPELINE_FAILED
    }

    public NotificationEvent {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
