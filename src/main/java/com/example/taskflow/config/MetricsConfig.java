package com.example.taskflow.config;

import com.example.taskflow.domain.enums.TaskType;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;

import java.util.function.ToDoubleFunction;

/**
 * Metrics configuration for monitoring job, delivery and request health.
 * <p>
 * Exposes Prometheus metrics for:
 * - Job firings by outcome
 * - Task execution times and failures
 * - Push deliveries by channel and outcome
 * - Rate limit rejections
 * - Registered job and task counts
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;

    /**
     * Register a gauge backed by a live object
     */
    public <T> void registerGauge(String name, String description, T stateObject, ToDoubleFunction<T> valueFunction) {
        Gauge.builder(name, stateObject, valueFunction)
                .description(description)
                .register(meterRegistry);
    }

    /**
     * Record one job firing ("success", "failure" or "skipped")
     */
    public void recordJobExecution(String outcome) {
        meterRegistry.counter("taskflow_job_executions", "outcome", outcome).increment();
    }

    /**
     * Create a timer for task execution
     */
    public Timer.Sample startTaskExecutionTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record task execution time
     */
    public void recordTaskExecution(Timer.Sample sample, TaskType taskType, boolean success) {
        sample.stop(Timer.builder("taskflow_task_execution_time")
                .tag("type", taskType.getCode())
                .tag("success", String.valueOf(success))
                .description("Scheduled task execution time")
                .register(meterRegistry));
    }

    /**
     * Record task failure
     */
    public void recordTaskFailure(TaskType taskType, String errorType) {
        meterRegistry.counter("taskflow_task_failures",
                "type", taskType.getCode(),
                "error_type", errorType != null ? errorType : "unknown"
        ).increment();
    }

    /**
     * Record push deliveries for a channel ("user", "topic" or "bulk")
     */
    public void recordNotifications(String channel, boolean success, int count) {
        if (count <= 0) {
            return;
        }
        meterRegistry.counter("taskflow_notifications",
                "channel", channel,
                "outcome", success ? "success" : "failure"
        ).increment(count);
    }

    public void recordNotificationSuppressed(String category) {
        meterRegistry.counter("taskflow_notifications_suppressed", "category", category).increment();
    }

    public void recordRateLimitRejection() {
        meterRegistry.counter("taskflow_rate_limit_rejections").increment();
    }
}
