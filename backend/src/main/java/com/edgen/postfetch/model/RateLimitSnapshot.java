package com.edgen.postfetch.model;

import java.time.Instant;

/**
 * Rate-limit metadata as last reported by an upstream response.
 */
public record RateLimitSnapshot(
        Integer limit,
        int remaining,
        Instant resetAt) {

    public boolean isExhaustedAt(Instant now) {
        return remaining <= 0 && resetAt != null && resetAt.isAfter(now);
    }
}
