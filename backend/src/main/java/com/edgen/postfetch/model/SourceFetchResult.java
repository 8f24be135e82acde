package com.edgen.postfetch.model;

import java.util.Objects;

/**
 * Successful source response: the record plus whatever rate-limit metadata came with it.
 */
public record SourceFetchResult(
        NormalizedPostRecord record,
        RateLimitSnapshot rateLimit) {

    public SourceFetchResult {
        Objects.requireNonNull(record, "record is required");
    }

    public static SourceFetchResult of(NormalizedPostRecord record) {
        return new SourceFetchResult(record, null);
    }
}
