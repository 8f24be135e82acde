package com.edgen.postfetch.model;

import java.time.Instant;

/**
 * Point-in-time copy of one source's breaker state. Also the persisted form.
 */
public record SourceHealthSnapshot(
        PostSource source,
        CircuitState state,
        int consecutiveFailures,
        Instant lastFailureAt,
        Instant nextAttemptAt,
        FailureKind openedBy,
        int reopenCount) {

    public static SourceHealthSnapshot closed(PostSource source) {
        return new SourceHealthSnapshot(source, CircuitState.CLOSED, 0, null, null, null, 0);
    }
}
