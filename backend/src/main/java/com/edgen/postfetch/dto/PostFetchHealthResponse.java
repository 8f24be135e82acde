package com.edgen.postfetch.dto;

import com.edgen.postfetch.model.CircuitState;
import com.edgen.postfetch.model.FailureKind;
import com.edgen.postfetch.model.PipelineStatus;

import java.time.Instant;
import java.util.Map;

/**
 * Operator view of the fetch pipeline. Sources are keyed by their wire name in priority order.
 */
public record PostFetchHealthResponse(
        String service,
        PipelineStatus status,
        Map<String, SourceStatus> sources,
        int activeScraperSessions,
        int maxScraperSessions,
        int cachedResults) {

    public record SourceStatus(
            boolean enabled,
            CircuitState state,
            int consecutiveFailures,
            FailureKind openedBy,
            Instant nextAttemptAt,
            Integer rateLimitRemaining,
            Instant rateLimitResetAt,
            int requestsInWindow) {
    }
}
