package com.example.taskflow.domain.model;

import com.example.taskflow.domain.enums.TaskType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A user-facing scheduled action backed by exactly one registry job.
 * <p>
 * Supports:
 * - Type-specific parameters (time of day, weekday, timezone, push target)
 * - Pause/resume through the {@code enabled} flag
 * - Last run bookkeeping for the API
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduledTask {

    private String taskId;

    /**
     * Type of task - determines which handler runs when the job fires
     */
    private TaskType taskType;

    /**
     * Raw schedule string as submitted (cron expression for custom tasks)
     */
    private String schedule;

    /**
     * Task-specific parameters, stored as submitted
     */
    @Builder.Default
    private Map<String, Object> parameters = new LinkedHashMap<>();

    private String description;

    @Builder.Default
    private boolean enabled = true;

    private Instant createdAt;

    /**
     * Id of the backing job in the registry (lookup only, the registry owns the job)
     */
    private String jobId;

    /**
     * Readable form of the trigger the task was registered with
     */
    private String trigger;

    // === Execution Bookkeeping ===

    private volatile Instant lastRunAt;

    private volatile String lastError;

    private volatile long runCount;

    // === Helper Methods ===

    /**
     * Get a parameter value of the expected type, or null
     */
    @SuppressWarnings("unchecked")
    public <T> T getParameterValue(String key, Class<T> type) {
        if (this.parameters == null) {
            return null;
        }
        var value = this.parameters.get(key);
        return type.isInstance(value) ? (T) value : null;
    }

    /**
     * Get a parameter as a string, falling back when absent or blank
     */
    public String getStringParameter(String key, String defaultValue) {
        if (this.parameters == null || this.parameters.get(key) == null) {
            return defaultValue;
        }
        var value = String.valueOf(this.parameters.get(key));
        return value.isBlank() ? defaultValue : value;
    }

    /**
     * Get a parameter as an int. Accepts JSON numbers and numeric strings.
     *
     * @throws IllegalArgumentException if the value is present but not an integer
     */
    public int getIntParameter(String key, int defaultValue) {
        if (this.parameters == null || this.parameters.get(key) == null) {
            return defaultValue;
        }
        var value = this.parameters.get(key);
        if (value instanceof Number number) {
            if (number.doubleValue() != Math.rint(number.doubleValue())) {
                throw new IllegalArgumentException(String.format("Parameter '%s' must be an integer, got %s", key, value));
            }
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Parameter '%s' must be an integer, got '%s'", key, value));
        }
    }

    public synchronized void recordRun(Instant at, String error) {
        this.lastRunAt = at;
        this.lastError = error;
        this.runCount++;
    }
}
