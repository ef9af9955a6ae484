package com.example.taskflow.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Defines the kinds of scheduled tasks a user can create.
 * Each task type maps to a specific handler implementation.
 */
@Getter
@RequiredArgsConstructor
public enum TaskType {

    /**
     * Push a daily activity summary at a fixed time of day
     */
    DAILY_SUMMARY("daily_summary", "Daily Summary"),

    /**
     * Push a weekly report on a fixed weekday and time
     */
    WEEKLY_REPORT("weekly_report", "Weekly Report"),

    /**
     * Push a reminder on an arbitrary cron schedule
     */
    CUSTOM("custom", "Custom Task");

    @JsonValue
    private final String code;
    private final String displayName;

    /**
     * Find TaskType by its code value
     */
    public static TaskType fromCode(String code) {
        for (var type : values()) {
            if (type.getCode().equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported task type: " + code);
    }
}
