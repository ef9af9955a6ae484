package com.example.taskflow.dto;

import com.example.taskflow.domain.enums.SummaryPeriod;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Activity rollup for one user over a sliding window
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserSummary {

    @JsonProperty("user_id")
    private String userId;

    private SummaryPeriod period;

    private Totals summary;

    private Trends trends;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Totals {
        private int tasksCompleted;
        private int projectsActive;
        private double hoursWorked;
        private double productivityScore;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Trends {
        private double completionRate;
        private double improvement;
    }
}
