package com.example.taskflow.scheduling;

import com.example.taskflow.exception.InvalidTriggerException;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.scheduling.support.PeriodicTrigger;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Locale;

/**
 * Rule describing when a registered job fires.
 * <p>
 * Every variant validates its fields on construction and is immutable afterwards,
 * so a {@code TriggerSpec} that exists can always be turned into a Spring {@link Trigger}.
 */
public sealed interface TriggerSpec permits TriggerSpec.Interval, TriggerSpec.DailyAt, TriggerSpec.WeeklyAt, TriggerSpec.Cron {

    ZoneId DEFAULT_ZONE = ZoneOffset.UTC;

    /**
     * Build the Spring trigger that drives the scheduler
     */
    Trigger toTrigger();

    /**
     * Human-readable form used in logs and API responses
     */
    String describe();

    /**
     * Fires every {@code minutes}, first firing one full interval after registration.
     */
    record Interval(int minutes) implements TriggerSpec {

        public Interval {
            if (minutes < 1) {
                throw new InvalidTriggerException("Interval must be at least 1 minute, got " + minutes);
            }
        }

        @Override
        public Trigger toTrigger() {
            var trigger = new PeriodicTrigger(Duration.ofMinutes(minutes));
            trigger.setFixedRate(true);
            trigger.setInitialDelay(Duration.ofMinutes(minutes));
            return trigger;
        }

        @Override
        public String describe() {
            return "every " + minutes + " minutes";
        }
    }

    record DailyAt(int hour, int minute, ZoneId timezone) implements TriggerSpec {

        public DailyAt {
            checkTime(hour, minute);
            if (timezone == null) {
                timezone = DEFAULT_ZONE;
            }
        }

        public static DailyAt of(int hour, int minute, String timezone) {
            return new DailyAt(hour, minute, zone(timezone));
        }

        public String cronExpression() {
            return String.format("0 %d %d * * *", minute, hour);
        }

        @Override
        public Trigger toTrigger() {
            return new CronTrigger(cronExpression(), timezone);
        }

        @Override
        public String describe() {
            return String.format("daily at %02d:%02d %s", hour, minute, timezone.getId());
        }
    }

    record WeeklyAt(DayOfWeek weekday, int hour, int minute, ZoneId timezone) implements TriggerSpec {

        public WeeklyAt {
            if (weekday == null) {
                throw new InvalidTriggerException("Weekday is required");
            }
            checkTime(hour, minute);
            if (timezone == null) {
                timezone = DEFAULT_ZONE;
            }
        }

        public static WeeklyAt of(String weekday, int hour, int minute, String timezone) {
            return new WeeklyAt(parseWeekday(weekday), hour, minute, zone(timezone));
        }

        public String cronExpression() {
            return String.format("0 %d %d * * %s", minute, hour, weekday.name().substring(0, 3));
        }

        @Override
        public Trigger toTrigger() {
            return new CronTrigger(cronExpression(), timezone);
        }

        @Override
        public String describe() {
            return String.format("weekly on %s at %02d:%02d %s",
                    weekday.name().toLowerCase(Locale.ROOT), hour, minute, timezone.getId());
        }
    }

    /**
     * Arbitrary cron schedule. Accepts the classic five-field crontab form
     * (minute hour day-of-month month day-of-week) as well as Spring's six-field
     * form with a leading seconds field.
     * <p>
     * A five-field expression may restrict day-of-month or day-of-week but not both,
     * since Spring would require both to match where crontab fires on either.
     */
    record Cron(String expression, ZoneId timezone) implements TriggerSpec {

        public Cron {
            if (expression == null || expression.isBlank()) {
                throw new InvalidTriggerException("Cron expression is required");
            }
            expression = normalize(expression.trim());
            if (!CronExpression.isValidExpression(expression)) {
                throw new InvalidTriggerException("Malformed cron expression: " + expression);
            }
            if (timezone == null) {
                timezone = DEFAULT_ZONE;
            }
        }

        public static Cron of(String expression, String timezone) {
            return new Cron(expression, zone(timezone));
        }

        private static String normalize(String expression) {
            if (expression.startsWith("@")) {
                return expression;
            }
            var fields = expression.split("\\s+");
            if (fields.length != 5) {
                return String.join(" ", fields);
            }
            // crontab fires when either day field matches, Spring only when both do
            if (restricts(fields[2]) && restricts(fields[4])) {
                throw new InvalidTriggerException(
                        "Cron expression restricts both day-of-month and day-of-week, use one of them: " + expression);
            }
            return "0 " + String.join(" ", fields);
        }

        private static boolean restricts(String field) {
            return !"*".equals(field) && !"?".equals(field);
        }

        @Override
        public Trigger toTrigger() {
            return new CronTrigger(expression, timezone);
        }

        @Override
        public String describe() {
            return "cron '" + expression + "' " + timezone.getId();
        }
    }

    /**
     * Resolve a timezone name, defaulting to UTC when none is given
     */
    static ZoneId zone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return DEFAULT_ZONE;
        }
        try {
            return ZoneId.of(timezone.trim()).normalized();
        } catch (DateTimeException e) {
            throw new InvalidTriggerException("Unknown timezone: " + timezone, e);
        }
    }

    /**
     * Parse a weekday given as {@code mon}..{@code sun}, a full English day name,
     * or a number 0..6 where 0 is Monday.
     */
    static DayOfWeek parseWeekday(String weekday) {
        if (weekday == null || weekday.isBlank()) {
            return DayOfWeek.MONDAY;
        }
        var value = weekday.trim().toUpperCase(Locale.ROOT);
        if (value.chars().allMatch(Character::isDigit)) {
            var index = Integer.parseInt(value);
            if (index < 0 || index > 6) {
                throw new InvalidTriggerException("Weekday number must be 0-6, got " + weekday);
            }
            return DayOfWeek.of(index + 1);
        }
        for (var day : DayOfWeek.values()) {
            if (day.name().equals(value) || day.name().substring(0, 3).equals(value)) {
                return day;
            }
        }
        throw new InvalidTriggerException("Unknown weekday: " + weekday);
    }

    private static void checkTime(int hour, int minute) {
        if (hour < 0 || hour > 23) {
            throw new InvalidTriggerException("Hour must be 0-23, got " + hour);
        }
        if (minute < 0 || minute > 59) {
            throw new InvalidTriggerException("Minute must be 0-59, got " + minute);
        }
    }
}
