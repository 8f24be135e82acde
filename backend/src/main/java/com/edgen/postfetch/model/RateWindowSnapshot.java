package com.edgen.postfetch.model;

import java.time.Instant;

public record RateWindowSnapshot(
        PostSource source,
        int requestsInWindow,
        Instant windowStartedAt,
        Integer limit,
        Integer remaining,
        Instant resetAt) {
}
