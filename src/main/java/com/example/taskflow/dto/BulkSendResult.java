package com.example.taskflow.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a bulk push.
 * Counts always add up to the number of submitted tokens; failures keep the
 * token and the gateway's error code so callers can prune dead tokens.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkSendResult {

    private int successCount;
    private int failureCount;

    @Builder.Default
    private List<TokenFailure> failures = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TokenFailure {
        private String token;
        private String errorCode;
    }
}
