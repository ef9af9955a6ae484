package com.example.taskflow.domain.model;

import com.example.taskflow.domain.enums.TaskType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ScheduledTask Tests")
class ScheduledTaskTest {

    private static ScheduledTask taskWith(Map<String, Object> parameters) {
        return ScheduledTask.builder()
                .taskId("scheduled_task_1")
                .taskType(TaskType.DAILY_SUMMARY)
                .parameters(new HashMap<>(parameters))
                .build();
    }

    @Nested
    @DisplayName("Parameter Access")
    class ParameterTests {

        @Test
        @DisplayName("Should read integers from numbers and numeric strings")
        void shouldReadIntegers() {
            var task = taskWith(Map.of("hour", 7, "minute", "45", "whole", 3.0));

            assertThat(task.getIntParameter("hour", 9)).isEqualTo(7);
            assertThat(task.getIntParameter("minute", 0)).isEqualTo(45);
            assertThat(task.getIntParameter("whole", 0)).isEqualTo(3);
            assertThat(task.getIntParameter("missing", 9)).isEqualTo(9);
        }

        @Test
        @DisplayName("Should reject non-integer values")
        void shouldRejectNonIntegers() {
            var task = taskWith(Map.of("hour", "nine", "minute", 1.5));

            assertThatThrownBy(() -> task.getIntParameter("hour", 9))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("hour");
            assertThatThrownBy(() -> task.getIntParameter("minute", 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should fall back for missing or blank strings")
        void shouldFallBackForBlankStrings() {
            var task = taskWith(Map.of("timezone", " ", "topic", "team-a"));

            assertThat(task.getStringParameter("timezone", "UTC")).isEqualTo("UTC");
            assertThat(task.getStringParameter("topic", "task-reminders")).isEqualTo("team-a");
            assertThat(task.getStringParameter("userId", null)).isNull();
        }

        @Test
        @DisplayName("Should return typed value only when it matches")
        void shouldReturnTypedValue() {
            var task = taskWith(Map.of("userId", "u1"));

            assertThat(task.getParameterValue("userId", String.class)).isEqualTo("u1");
            assertThat(task.getParameterValue("userId", Integer.class)).isNull();
        }
    }

    @Test
    @DisplayName("Should default to enabled with empty parameters")
    void shouldHaveDefaults() {
        var task = ScheduledTask.builder().taskId("scheduled_task_2").build();

        assertThat(task.isEnabled()).isTrue();
        assertThat(task.getParameters()).isEmpty();
    }

    @Test
    @DisplayName("Should record runs")
    void shouldRecordRuns() {
        var task = taskWith(Map.of());
        var first = Instant.parse("2024-05-01T09:00:00Z");
        var second = first.plusSeconds(86_400);

        task.recordRun(first, "UNREGISTERED");
        task.recordRun(second, null);

        assertThat(task.getRunCount()).isEqualTo(2);
        assertThat(task.getLastRunAt()).isEqualTo(second);
        assertThat(task.getLastError()).isNull();
    }
}
