package com.example.taskflow.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Duration;

/**
 * Sliding windows for activity summaries, measured back from "now".
 */
@Getter
@RequiredArgsConstructor
public enum SummaryPeriod {

    DAILY("daily", Duration.ofDays(1)),
    WEEKLY("weekly", Duration.ofDays(7)),
    MONTHLY("monthly", Duration.ofDays(30));

    @JsonValue
    private final String code;
    private final Duration window;

    /**
     * Find SummaryPeriod by code, falling back to WEEKLY for anything unrecognized
     */
    public static SummaryPeriod fromCode(String code) {
        if (code != null) {
            for (var period : values()) {
                if (period.getCode().equalsIgnoreCase(code.trim())) {
                    return period;
                }
            }
        }
        return WEEKLY;
    }
}
