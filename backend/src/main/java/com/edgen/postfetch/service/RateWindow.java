package com.edgen.postfetch.service;

import com.edgen.postfetch.model.PostSource;
import com.edgen.postfetch.model.RateLimitSnapshot;
import com.edgen.postfetch.model.RateWindowSnapshot;

import java.time.Duration;
import java.time.Instant;

/**
 * Local request count in a fixed window plus the last rate-limit data the upstream reported.
 */
final class RateWindow {

    private final PostSource source;

    private int requestsInWindow;
    private Instant windowStartedAt;
    private Integer limit;
    private Integer remaining;
    private Instant resetAt;

    RateWindow(PostSource source) {
        this.source = source;
    }

    /**
     * @return the instant the source becomes usable again, or null when it is usable now
     */
    synchronized Instant blockedUntil(Instant now, int windowBudget, Duration windowLength) {
        if (remaining != null && remaining <= 0) {
            if (resetAt != null && resetAt.isAfter(now)) {
                return resetAt;
            }
            // Reset has passed: the upstream budget is presumed refilled.
            remaining = null;
            resetAt = null;
        }
        if (windowBudget > 0) {
            roll(now, windowLength);
            if (requestsInWindow >= windowBudget) {
                return windowStartedAt.plus(windowLength);
            }
        }
        return null;
    }

    synchronized void recordAttempt(Instant now, Duration windowLength) {
        roll(now, windowLength);
        requestsInWindow++;
    }

    synchronized void recordResult(RateLimitSnapshot snapshot) {
        if (snapshot == null) {
            return;
        }
        limit = snapshot.limit();
        remaining = snapshot.remaining();
        resetAt = snapshot.resetAt();
    }

    synchronized RateWindowSnapshot snapshot() {
        return new RateWindowSnapshot(source, requestsInWindow, windowStartedAt, limit, remaining, resetAt);
    }

    synchronized void reset() {
        requestsInWindow = 0;
        windowStartedAt = null;
        limit = null;
        remaining = null;
        resetAt = null;
    }

    private void roll(Instant now, Duration windowLength) {
        if (windowStartedAt == null || !now.isBefore(windowStartedAt.plus(windowLength))) {
            windowStartedAt = now;
            requestsInWindow = 0;
        }
    }
}
