package com.edgen.postfetch.web;

import com.edgen.postfetch.dto.PostResolutionErrorResponse;
import com.edgen.postfetch.dto.PostResolutionErrorResponse.AttemptSummary;
import com.edgen.postfetch.model.FailureKind;
import com.edgen.postfetch.model.InvalidPostReferenceException;
import com.edgen.postfetch.model.PostResolutionException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps resolution failures and malformed requests onto one error body.
 */
@RestControllerAdvice
public class PostResolutionExceptionHandler {

    static final long DEFAULT_RETRY_AFTER_SECONDS = 30;

    private final Clock clock;

    public PostResolutionExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(PostResolutionException.class)
    public ResponseEntity<PostResolutionErrorResponse> handle(PostResolutionException ex) {
        List<AttemptSummary> attempts = ex.getAttempts().stream()
                .map(attempt -> new AttemptSummary(attempt.source(), attempt.status(), attempt.failureKind()))
                .toList();

        if (ex.getKind() == FailureKind.NOT_FOUND) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(PostResolutionErrorResponse.resolutionFailed(ex.getKind(),
                            "Post not found or not publicly accessible", ex.getPostId(), attempts));
        }
        if (ex.getKind() == FailureKind.CONTENT_REJECTED) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                    .body(PostResolutionErrorResponse.resolutionFailed(ex.getKind(),
                            "Post does not meet the submission requirements", ex.getPostId(), attempts));
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds(ex)))
                .body(PostResolutionErrorResponse.resolutionFailed(ex.getKind(),
                        "Post data is temporarily unavailable, try again later", ex.getPostId(), attempts));
    }

    @ExceptionHandler(InvalidPostReferenceException.class)
    public ResponseEntity<PostResolutionErrorResponse> handle(InvalidPostReferenceException ex) {
        return ResponseEntity.badRequest()
                .body(PostResolutionErrorResponse.badRequest(ex.getMessage(), Map.of()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<PostResolutionErrorResponse> handle(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(fe ->
                fieldErrors.putIfAbsent(fe.getField(), fe.getDefaultMessage()));
        String message = fieldErrors.isEmpty()
                ? "Invalid post fetch request"
                : "Invalid post fetch request: " + String.join("; ", fieldErrors.values());
        return ResponseEntity.badRequest()
                .body(PostResolutionErrorResponse.badRequest(message, fieldErrors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<PostResolutionErrorResponse> handle(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest()
                .body(PostResolutionErrorResponse.badRequest("Request body is missing or malformed", Map.of()));
    }

    private long retryAfterSeconds(PostResolutionException ex) {
        Instant now = clock.instant();
        return ex.earliestRetryAt()
                .filter(retryAt -> retryAt.isAfter(now))
                .map(retryAt -> Math.max(1, Duration.between(now, retryAt).toSeconds()))
                .orElse(DEFAULT_RETRY_AFTER_SECONDS);
    }
}
