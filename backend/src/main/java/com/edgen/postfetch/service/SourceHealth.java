package com.edgen.postfetch.service;

import com.edgen.postfetch.model.CircuitState;
import com.edgen.postfetch.model.FailureKind;
import com.edgen.postfetch.model.PostSource;
import com.edgen.postfetch.model.SourceHealthSnapshot;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;

import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One source's Resilience4j breaker plus the bookkeeping it does not track:
 * consecutive failures, the cause of the last opening and the scheduled next attempt.
 * Every field is read and written under {@link #lock}.
 */
final class SourceHealth {

    final ReentrantLock lock = new ReentrantLock();
    final PostSource source;
    final CircuitBreaker breaker;

    int consecutiveFailures;
    Instant lastFailureAt;
    Instant nextAttemptAt;
    FailureKind openedBy;
    int reopenCount;

    SourceHealth(PostSource source, CircuitBreaker breaker) {
        this.source = source;
        this.breaker = breaker;
    }

    CircuitState state() {
        return switch (breaker.getState()) {
            case OPEN, FORCED_OPEN -> CircuitState.OPEN;
            case HALF_OPEN -> CircuitState.HALF_OPEN;
            default -> CircuitState.CLOSED;
        };
    }

    SourceHealthSnapshot snapshot() {
        return new SourceHealthSnapshot(
                source,
                state(),
                consecutiveFailures,
                lastFailureAt,
                nextAttemptAt,
                openedBy,
                reopenCount
        );
    }

    void clearCounters() {
        consecutiveFailures = 0;
        nextAttemptAt = null;
        openedBy = null;
        reopenCount = 0;
    }
}
