package com.example.taskflow.controller;

import com.example.taskflow.dto.AnalyticsEventRequest;
import com.example.taskflow.dto.EventRecordedResponse;
import com.example.taskflow.dto.UserSummary;
import com.example.taskflow.service.AnalyticsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/analytics")
@Tag(name = "Analytics", description = "APIs for recording activity and reading summaries")
public class AnalyticsController {

    private final AnalyticsService analyticsService;

    @PostMapping("/event")
    @Operation(summary = "Record event", description = "Append a user activity event")
    public EventRecordedResponse recordEvent(@Valid @RequestBody AnalyticsEventRequest request) {
        var eventId = analyticsService.recordEvent(request.getUserId(), request.getEventType(), request.getEventData());
        return EventRecordedResponse.builder().eventId(eventId).build();
    }

    @GetMapping("/user-summary")
    @Operation(summary = "User summary", description = "Activity rollup over the last day, week or 30 days")
    public UserSummary getUserSummary(
            @Parameter(description = "User ID") @RequestParam String userId,
            @Parameter(description = "daily, weekly or monthly; anything else means weekly")
            @RequestParam(defaultValue = "weekly") String period) {
        if (userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        log.debug("API: Summary for user {} period {}", userId, period);
        return analyticsService.getUserSummary(userId, period);
    }
}
