package com.edgen.postfetch.model;

import java.time.Instant;

/**
 * What happened to one source during one resolution.
 *
 * @param retryAt earliest instant the source is expected to accept traffic again, when known
 */
public record SourceAttempt(
        PostSource source,
        SourceAttemptStatus status,
        FailureKind failureKind,
        String detail,
        Instant retryAt) {

    public static SourceAttempt succeeded(PostSource source) {
        return new SourceAttempt(source, SourceAttemptStatus.SUCCEEDED, null, null, null);
    }

    public static SourceAttempt failed(SourceFailure failure) {
        return new SourceAttempt(failure.source(), SourceAttemptStatus.FAILED, failure.kind(), failure.detail(), null);
    }

    public static SourceAttempt skipped(PostSource source, SourceAttemptStatus status, String detail, Instant retryAt) {
        return new SourceAttempt(source, status, null, detail, retryAt);
    }

    public static SourceAttempt notReached(PostSource source) {
        return new SourceAttempt(source, SourceAttemptStatus.NOT_REACHED, null, null, null);
    }
}
