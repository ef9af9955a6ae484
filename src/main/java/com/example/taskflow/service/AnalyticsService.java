package com.example.taskflow.service;

import com.example.taskflow.config.MetricsConfig;
import com.example.taskflow.domain.enums.SummaryPeriod;
import com.example.taskflow.domain.model.ActivityEvent;
import com.example.taskflow.dto.UserSummary;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only log of user activity events with rollup summaries.
 * <p>
 * Summaries cover a sliding window ending now:
 * - tasksCompleted: events of type task_completed
 * - projectsActive: distinct eventData.project_id values
 * - hoursWorked: half an hour per event
 * - productivityScore: tasksCompleted * 2 + hoursWorked * 0.2, capped at 10
 * - completionRate: tasksCompleted / events, improvement: completionRate * 0.1
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalyticsService {

    static final String TASK_COMPLETED = "task_completed";
    private static final double HOURS_PER_EVENT = 0.5;
    private static final double MAX_PRODUCTIVITY_SCORE = 10.0;

    private final Clock clock;
    private final MetricsConfig metricsConfig;

    private final List<ActivityEvent> events = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();
    private long sequence;

    @PostConstruct
    public void registerMetrics() {
        metricsConfig.registerGauge("taskflow_activity_events", "Number of recorded activity events", this, AnalyticsService::eventCount);
    }

    /**
     * Append an event stamped with the current time
     *
     * @return the new event id
     */
    public String recordEvent(String userId, String eventType, Map<String, Object> eventData) {
        var data = eventData != null ? new LinkedHashMap<>(eventData) : new LinkedHashMap<String, Object>();
        ActivityEvent event;
        lock.lock();
        try {
            event = ActivityEvent.builder()
                    .eventId("event_" + (++sequence))
                    .userId(userId)
                    .eventType(eventType)
                    .eventData(data)
                    .timestamp(clock.instant())
                    .build();
            events.add(event);
        } finally {
            lock.unlock();
        }
        log.debug("Recorded event {} ({}) for user {}", event.getEventId(), eventType, userId);
        return event.getEventId();
    }

    public UserSummary getUserSummary(String userId, String period) {
        return getUserSummary(userId, SummaryPeriod.fromCode(period));
    }

    public UserSummary getUserSummary(String userId, SummaryPeriod period) {
        var windowStart = clock.instant().minus(period.getWindow());

        List<ActivityEvent> matching = new ArrayList<>();
        lock.lock();
        try {
            for (var event : events) {
                if (Objects.equals(event.getUserId(), userId) && !event.getTimestamp().isBefore(windowStart)) {
                    matching.add(event);
                }
            }
        } finally {
            lock.unlock();
        }

        var eventCount = matching.size();
        var tasksCompleted = (int) matching.stream()
                .filter(e -> TASK_COMPLETED.equals(e.getEventType()))
                .count();
        var projectsActive = (int) matching.stream()
                .map(ActivityEvent::projectId)
                .filter(Objects::nonNull)
                .distinct()
                .count();
        var hoursWorked = eventCount * HOURS_PER_EVENT;
        var productivityScore = Math.min(MAX_PRODUCTIVITY_SCORE, tasksCompleted * 2 + hoursWorked * 0.2);
        var completionRate = eventCount == 0 ? 0.0 : (double) tasksCompleted / Math.max(1, eventCount);
        var improvement = completionRate * 0.1;

        return UserSummary.builder()
                .userId(userId)
                .period(period)
                .summary(UserSummary.Totals.builder()
                        .tasksCompleted(tasksCompleted)
                        .projectsActive(projectsActive)
                        .hoursWorked(round(hoursWorked, 1))
                        .productivityScore(round(productivityScore, 1))
                        .build())
                .trends(UserSummary.Trends.builder()
                        .completionRate(round(completionRate, 2))
                        .improvement(round(improvement, 2))
                        .build())
                .build();
    }

    public UserSummary generateDailySummary(String userId) {
        return getUserSummary(userId, SummaryPeriod.DAILY);
    }

    public UserSummary generateWeeklyReport(String userId) {
        return getUserSummary(userId, SummaryPeriod.WEEKLY);
    }

    public int eventCount() {
        lock.lock();
        try {
            return events.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rounds the exact binary value of {@code value}, so 0.155 (stored just below) becomes 0.15
     */
    private static double round(double value, int scale) {
        return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
    }
}
