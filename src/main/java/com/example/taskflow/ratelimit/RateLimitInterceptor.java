package com.example.taskflow.ratelimit;

import com.example.taskflow.config.MetricsConfig;
import com.example.taskflow.config.RateLimitProperties;
import com.example.taskflow.exception.RateLimitExceededException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Applies the per-client limit to API requests, keyed by client IP
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RateLimitInterceptor implements HandlerInterceptor {

    private final SlidingWindowRateLimiter rateLimiter;
    private final RateLimitProperties properties;
    private final MetricsConfig metricsConfig;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!properties.isEnabled()) {
            return true;
        }
        var clientKey = request.getRemoteAddr();
        var decision = rateLimiter.tryAcquire(clientKey);
        if (!decision.allowed()) {
            log.warn("Rate limit exceeded for {} on {} {}", clientKey, request.getMethod(), request.getRequestURI());
            metricsConfig.recordRateLimitRejection();
            throw new RateLimitExceededException(clientKey, decision.retryAfterSeconds());
        }
        return true;
    }
}
