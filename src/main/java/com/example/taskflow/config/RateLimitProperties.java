package com.example.taskflow.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Per-client request limits for the /api surface
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "rate-limit")
public class RateLimitProperties {

    private boolean enabled = true;

    /**
     * Requests allowed per client within one window
     */
    @Min(1)
    private int maxRequests = 100;

    @Min(1)
    private int windowSeconds = 60;
}
