package com.edgen.postfetch.dto;

import com.edgen.postfetch.model.FailureKind;
import com.edgen.postfetch.model.PostSource;
import com.edgen.postfetch.model.SourceAttemptStatus;

import java.util.List;
import java.util.Map;

/**
 * Error body for every failed post-fetch request. Never carries upstream response bodies.
 * {@code code} is null for malformed requests, which report {@code fieldErrors} instead of attempts.
 */
public record PostResolutionErrorResponse(
        FailureKind code,
        String message,
        String postId,
        List<AttemptSummary> attempts,
        Map<String, String> fieldErrors) {

    public static PostResolutionErrorResponse resolutionFailed(
            FailureKind code,
            String message,
            String postId,
            List<AttemptSummary> attempts) {
        return new PostResolutionErrorResponse(code, message, postId, attempts, Map.of());
    }

    public static PostResolutionErrorResponse badRequest(String message, Map<String, String> fieldErrors) {
        return new PostResolutionErrorResponse(null, message, null, List.of(), fieldErrors);
    }

    public record AttemptSummary(
            PostSource source,
            SourceAttemptStatus status,
            FailureKind kind) {
    }
}
