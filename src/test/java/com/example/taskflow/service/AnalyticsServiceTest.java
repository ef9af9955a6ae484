package com.example.taskflow.service;

import com.example.taskflow.config.MetricsConfig;
import com.example.taskflow.domain.enums.SummaryPeriod;
import com.example.taskflow.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AnalyticsService Tests")
class AnalyticsServiceTest {

    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private AnalyticsService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
        meterRegistry = new SimpleMeterRegistry();
        service = new AnalyticsService(clock, new MetricsConfig(meterRegistry));
        service.registerMetrics();
    }

    @Nested
    @DisplayName("Recording Events")
    class RecordTests {

        @Test
        @DisplayName("Should hand out increasing event ids")
        void shouldHandOutIncreasingIds() {
            assertThat(service.recordEvent("u1", "login", null)).isEqualTo("event_1");
            assertThat(service.recordEvent("u2", "login", Map.of())).isEqualTo("event_2");
            assertThat(service.eventCount()).isEqualTo(2);
            assertThat(meterRegistry.get("taskflow_activity_events").gauge().value()).isEqualTo(2.0);
        }
    }

    @Nested
    @DisplayName("Summaries")
    class SummaryTests {

        @Test
        @DisplayName("Should roll up events in the window")
        void shouldRollUpEvents() {
            service.recordEvent("u1", "task_completed", Map.of("project_id", "p1"));
            service.recordEvent("u1", "task_completed", Map.of("project_id", "p2"));
            service.recordEvent("u1", "task_completed", Map.of("project_id", "p1"));
            service.recordEvent("u1", "task_created", Map.of());
            service.recordEvent("u1", "comment_added", Map.of());
            service.recordEvent("u2", "task_completed", Map.of("project_id", "p9"));

            var summary = service.getUserSummary("u1", "weekly");

            assertThat(summary.getUserId()).isEqualTo("u1");
            assertThat(summary.getPeriod()).isEqualTo(SummaryPeriod.WEEKLY);
            assertThat(summary.getSummary().getTasksCompleted()).isEqualTo(3);
            assertThat(summary.getSummary().getProjectsActive()).isEqualTo(2);
            assertThat(summary.getSummary().getHoursWorked()).isEqualTo(2.5);
            assertThat(summary.getSummary().getProductivityScore()).isEqualTo(6.5);
            assertThat(summary.getTrends().getCompletionRate()).isEqualTo(0.6);
            assertThat(summary.getTrends().getImprovement()).isEqualTo(0.06);
        }

        @Test
        @DisplayName("Should round the stored binary value of a ratio")
        void shouldRoundStoredBinaryValue() {
            for (int i = 0; i < 200; i++) {
                service.recordEvent("u1", i < 31 ? "task_completed" : "task_viewed", Map.of());
            }

            var trends = service.generateDailySummary("u1").getTrends();

            assertThat(trends.getCompletionRate()).isEqualTo(0.15);
            assertThat(trends.getImprovement()).isEqualTo(0.02);
        }

        @Test
        @DisplayName("Should cap productivity score at 10")
        void shouldCapProductivityScore() {
            for (int i = 0; i < 6; i++) {
                service.recordEvent("u1", "task_completed", Map.of());
            }

            assertThat(service.generateDailySummary("u1").getSummary().getProductivityScore()).isEqualTo(10.0);
        }

        @Test
        @DisplayName("Should return zeros for a user with no events")
        void shouldReturnZerosWithoutEvents() {
            var summary = service.getUserSummary("nobody", SummaryPeriod.MONTHLY);

            assertThat(summary.getSummary().getTasksCompleted()).isZero();
            assertThat(summary.getSummary().getHoursWorked()).isZero();
            assertThat(summary.getTrends().getCompletionRate()).isZero();
        }

        @Test
        @DisplayName("Should only count events inside the sliding window")
        void shouldRespectSlidingWindow() {
            service.recordEvent("u1", "task_completed", Map.of());
            clock.advance(Duration.ofHours(25));
            service.recordEvent("u1", "task_completed", Map.of());
            clock.advance(Duration.ofMinutes(1));

            assertThat(service.generateDailySummary("u1").getSummary().getTasksCompleted()).isEqualTo(1);
            assertThat(service.generateWeeklyReport("u1").getSummary().getTasksCompleted()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should treat unknown period as weekly")
        void shouldDefaultToWeekly() {
            assertThat(service.getUserSummary("u1", "fortnightly").getPeriod()).isEqualTo(SummaryPeriod.WEEKLY);
        }
    }
}
