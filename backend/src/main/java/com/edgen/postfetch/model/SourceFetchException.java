package com.edgen.postfetch.model;

import lombok.Getter;

/**
 * Typed failure raised by a source client. Carries the classified failure and any
 * rate-limit metadata the failing response exposed.
 */
@Getter
public class SourceFetchException extends RuntimeException {

    private final SourceFailure failure;
    private final RateLimitSnapshot rateLimit;

    public SourceFetchException(SourceFailure failure, RateLimitSnapshot rateLimit, Throwable cause) {
        super(failure.source().wireValue() + " " + failure.kind().wireValue() + ": " + failure.detail(), cause);
        this.failure = failure;
        this.rateLimit = rateLimit;
    }

    public static SourceFetchException of(PostSource source, FailureKind kind, String detail) {
        return new SourceFetchException(SourceFailure.of(source, kind, detail), null, null);
    }

    public static SourceFetchException of(
            PostSource source,
            FailureKind kind,
            String detail,
            RateLimitSnapshot rateLimit
    ) {
        return new SourceFetchException(SourceFailure.of(source, kind, detail), rateLimit, null);
    }

    public static SourceFetchException notFound(PostSource source, String detail) {
        return of(source, FailureKind.NOT_FOUND, detail);
    }

    public static SourceFetchException contentRejected(PostSource source, String detail) {
        return of(source, FailureKind.CONTENT_REJECTED, detail);
    }

    public static SourceFetchException transientFailure(PostSource source, String detail, Throwable cause) {
        return new SourceFetchException(SourceFailure.of(source, FailureKind.TRANSIENT, detail), null, cause);
    }

    public FailureKind getKind() {
        return failure.kind();
    }
}
