package com.example.taskflow.controller;

import com.example.taskflow.dto.HealthResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
@Tag(name = "Health", description = "Liveness probe")
public class HealthController {

    private final Clock clock;

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Public liveness check")
    public HealthResponse health() {
        return HealthResponse.builder()
                .status("healthy")
                .timestamp(clock.instant())
                .build();
    }
}
