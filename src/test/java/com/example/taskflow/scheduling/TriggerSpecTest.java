package com.example.taskflow.scheduling;

import com.example.taskflow.exception.InvalidTriggerException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.scheduling.support.PeriodicTrigger;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TriggerSpec Tests")
class TriggerSpecTest {

    @Nested
    @DisplayName("Interval")
    class IntervalTests {

        @Test
        @DisplayName("Should first fire after one interval")
        void shouldFirstFireAfterOneInterval() {
            var trigger = (PeriodicTrigger) new TriggerSpec.Interval(30).toTrigger();

            assertThat(trigger.getPeriodDuration()).isEqualTo(Duration.ofMinutes(30));
            assertThat(trigger.getInitialDelayDuration()).isEqualTo(Duration.ofMinutes(30));
            assertThat(trigger.isFixedRate()).isTrue();
        }

        @Test
        @DisplayName("Should reject intervals under one minute")
        void shouldRejectZeroInterval() {
            assertThatThrownBy(() -> new TriggerSpec.Interval(0))
                    .isInstanceOf(InvalidTriggerException.class);
        }
    }

    @Nested
    @DisplayName("DailyAt")
    class DailyAtTests {

        @Test
        @DisplayName("Should build cron for time of day")
        void shouldBuildCron() {
            var daily = TriggerSpec.DailyAt.of(9, 30, "Europe/Berlin");

            assertThat(daily.cronExpression()).isEqualTo("0 30 9 * * *");
            assertThat(daily.timezone()).isEqualTo(ZoneId.of("Europe/Berlin"));
            assertThat(daily.toTrigger()).isInstanceOf(CronTrigger.class);
        }

        @Test
        @DisplayName("Should default to UTC")
        void shouldDefaultToUtc() {
            assertThat(TriggerSpec.DailyAt.of(9, 0, null).timezone()).isEqualTo(ZoneOffset.UTC);
            assertThat(TriggerSpec.DailyAt.of(9, 0, " ").timezone()).isEqualTo(ZoneOffset.UTC);
        }

        @Test
        @DisplayName("Should reject out of range hour and minute")
        void shouldRejectOutOfRange() {
            assertThatThrownBy(() -> TriggerSpec.DailyAt.of(24, 0, "UTC"))
                    .isInstanceOf(InvalidTriggerException.class)
                    .hasMessageContaining("Hour");
            assertThatThrownBy(() -> TriggerSpec.DailyAt.of(9, 60, "UTC"))
                    .isInstanceOf(InvalidTriggerException.class)
                    .hasMessageContaining("Minute");
            assertThatThrownBy(() -> TriggerSpec.DailyAt.of(-1, 0, "UTC"))
                    .isInstanceOf(InvalidTriggerException.class);
        }

        @Test
        @DisplayName("Should reject unknown timezone")
        void shouldRejectUnknownTimezone() {
            assertThatThrownBy(() -> TriggerSpec.DailyAt.of(9, 0, "Mars/Olympus"))
                    .isInstanceOf(InvalidTriggerException.class)
                    .hasMessageContaining("Unknown timezone");
        }
    }

    @Nested
    @DisplayName("WeeklyAt")
    class WeeklyAtTests {

        @ParameterizedTest
        @ValueSource(strings = {"mon", "MON", "monday", "Monday", "0"})
        @DisplayName("Should parse Monday in every accepted form")
        void shouldParseMonday(String weekday) {
            assertThat(TriggerSpec.WeeklyAt.of(weekday, 9, 0, "UTC").weekday()).isEqualTo(DayOfWeek.MONDAY);
        }

        @Test
        @DisplayName("Should treat 6 as Sunday")
        void shouldTreatSixAsSunday() {
            var weekly = TriggerSpec.WeeklyAt.of("6", 18, 15, "UTC");

            assertThat(weekly.weekday()).isEqualTo(DayOfWeek.SUNDAY);
            assertThat(weekly.cronExpression()).isEqualTo("0 15 18 * * SUN");
        }

        @Test
        @DisplayName("Should default blank weekday to Monday")
        void shouldDefaultToMonday() {
            assertThat(TriggerSpec.WeeklyAt.of(null, 9, 0, null).weekday()).isEqualTo(DayOfWeek.MONDAY);
        }

        @ParameterizedTest
        @ValueSource(strings = {"7", "funday", "mo"})
        @DisplayName("Should reject unknown weekdays")
        void shouldRejectUnknownWeekday(String weekday) {
            assertThatThrownBy(() -> TriggerSpec.WeeklyAt.of(weekday, 9, 0, "UTC"))
                    .isInstanceOf(InvalidTriggerException.class);
        }
    }

    @Nested
    @DisplayName("Cron")
    class CronTests {

        @Test
        @DisplayName("Should accept five-field crontab and add seconds")
        void shouldNormalizeFiveFields() {
            var cron = TriggerSpec.Cron.of("*/15 9-17 * * MON-FRI", "America/New_York");

            assertThat(cron.expression()).isEqualTo("0 */15 9-17 * * MON-FRI");
            assertThat(cron.timezone()).isEqualTo(ZoneId.of("America/New_York"));
        }

        @Test
        @DisplayName("Should keep six-field expressions")
        void shouldKeepSixFields() {
            assertThat(TriggerSpec.Cron.of("30 0 12 * * *", null).expression()).isEqualTo("30 0 12 * * *");
        }

        @ParameterizedTest
        @ValueSource(strings = {"not a cron", "61 * * * *", "* * *"})
        @DisplayName("Should reject malformed expressions")
        void shouldRejectMalformed(String expression) {
            assertThatThrownBy(() -> TriggerSpec.Cron.of(expression, "UTC"))
                    .isInstanceOf(InvalidTriggerException.class);
        }

        @ParameterizedTest
        @ValueSource(strings = {"0 9 1 * MON", "0 9 1-7 * 1", "0 9 */2 * SAT,SUN"})
        @DisplayName("Should reject crontab restricting both day fields")
        void shouldRejectBothDayFields(String expression) {
            assertThatThrownBy(() -> TriggerSpec.Cron.of(expression, "UTC"))
                    .isInstanceOf(InvalidTriggerException.class)
                    .hasMessageContaining("day-of-month and day-of-week");
        }

        @Test
        @DisplayName("Should accept crontab restricting one day field")
        void shouldAcceptOneDayField() {
            assertThat(TriggerSpec.Cron.of("0 9 1 * *", "UTC").expression()).isEqualTo("0 0 9 1 * *");
            assertThat(TriggerSpec.Cron.of("0 9 ? * MON", "UTC").expression()).isEqualTo("0 0 9 ? * MON");
        }

        @Test
        @DisplayName("Should reject blank expression")
        void shouldRejectBlank() {
            assertThatThrownBy(() -> TriggerSpec.Cron.of(" ", "UTC"))
                    .isInstanceOf(InvalidTriggerException.class)
                    .hasMessageContaining("required");
        }
    }
}
