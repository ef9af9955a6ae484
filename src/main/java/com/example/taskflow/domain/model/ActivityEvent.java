package com.example.taskflow.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One recorded user activity. Append-only; never mutated after recording.
 */
@Value
@Builder
public class ActivityEvent {

    String eventId;
    String userId;
    String eventType;
    Map<String, Object> eventData;
    Instant timestamp;

    /**
     * Value of {@code eventData.project_id}, or null when absent
     */
    public Object projectId() {
        return eventData == null ? null : eventData.get("project_id");
    }
}
