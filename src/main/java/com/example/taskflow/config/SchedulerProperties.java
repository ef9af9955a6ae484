package com.example.taskflow.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the job scheduler.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    /**
     * Number of threads firing job callbacks
     */
    @Min(1)
    private int poolSize = 2;

    /**
     * Seconds to wait for running callbacks on shutdown
     */
    @Min(0)
    private int awaitTerminationSeconds = 10;

    @Valid
    private OverdueReminder overdueReminder = new OverdueReminder();

    @Data
    public static class OverdueReminder {

        private boolean enabled = true;

        /**
         * Minutes between overdue task reminder pushes
         */
        @Min(1)
        private int intervalMinutes = 30;

        @NotBlank
        private String topic = "task-reminders";
    }
}
