package com.edgen.postfetch.model;

import lombok.Getter;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregate failure of one resolution. Lists every source in priority order with
 * what happened to it, so callers can tell "no such post" from "try again later".
 */
@Getter
public class PostResolutionException extends RuntimeException {

    private final FailureKind kind;
    private final String postId;
    private final List<SourceAttempt> attempts;

    public PostResolutionException(FailureKind kind, String postId, List<SourceAttempt> attempts, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind is required");
        this.postId = postId;
        this.attempts = List.copyOf(attempts);
    }

    public static PostResolutionException terminal(
            FailureKind kind,
            String postId,
            List<SourceAttempt> attempts,
            String detail
    ) {
        if (!kind.isTerminal()) {
            throw new IllegalArgumentException(kind + " is not a terminal failure kind");
        }
        return new PostResolutionException(kind, postId, attempts, "Post " + postId + " " + kind.wireValue() + ": " + detail);
    }

    public static PostResolutionException exhausted(String postId, List<SourceAttempt> attempts) {
        return new PostResolutionException(
                FailureKind.ALL_SOURCES_EXHAUSTED,
                postId,
                attempts,
                "All sources failed or were skipped for post " + postId
        );
    }

    public static PostResolutionException deadlineExceeded(String postId, List<SourceAttempt> attempts) {
        return new PostResolutionException(
                FailureKind.DEADLINE_EXCEEDED,
                postId,
                attempts,
                "Deadline exceeded while resolving post " + postId
        );
    }

    public boolean isRetryLater() {
        return kind.isRetryable();
    }

    public boolean involves(FailureKind failureKind) {
        return attempts.stream().anyMatch(attempt -> attempt.failureKind() == failureKind);
    }

    public Optional<Instant> earliestRetryAt() {
        return attempts.stream()
                .map(SourceAttempt::retryAt)
                .filter(Objects::nonNull)
                .min(Comparator.naturalOrder());
    }
}
