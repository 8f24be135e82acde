package com.edgen.postfetch.source;

import com.edgen.postfetch.model.RateLimitSnapshot;
import org.springframework.http.HttpHeaders;

import java.time.DateTimeException;
import java.time.Instant;

/**
 * Reads the upstream's {@code x-rate-limit-*} response headers.
 */
final class RateLimitHeaders {

    static final String LIMIT = "x-rate-limit-limit";
    static final String REMAINING = "x-rate-limit-remaining";
    static final String RESET = "x-rate-limit-reset";

    private RateLimitHeaders() {
    }

    /**
     * @return snapshot, or null when the response carried no usable rate-limit data
     */
    static RateLimitSnapshot parse(HttpHeaders headers) {
        if (headers == null) {
            return null;
        }
        Integer remaining = parseInt(headers.getFirst(REMAINING));
        if (remaining == null) {
            return null;
        }
        Instant resetAt = parseResetAt(headers.getFirst(RESET));
        return new RateLimitSnapshot(parseInt(headers.getFirst(LIMIT)), remaining, resetAt);
    }

    private static Instant parseResetAt(String value) {
        Long epochSeconds = parseLong(value);
        if (epochSeconds == null) {
            return null;
        }
        try {
            return Instant.ofEpochSecond(epochSeconds);
        } catch (DateTimeException ex) {
            // Outside the Instant range; treat as no reset reported.
            return null;
        }
    }

    private static Integer parseInt(String value) {
        Long parsed = parseLong(value);
        if (parsed == null) {
            return null;
        }
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, parsed));
    }

    private static Long parseLong(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
