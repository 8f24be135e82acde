package com.edgen.postfetch.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Shared failure taxonomy. Every source classifies its errors into one of these so the
 * breaker and the orchestrator react the same way regardless of which source failed.
 */
public enum FailureKind {

    TRANSIENT("transient", true, true),
    RATE_LIMITED("rate_limited", true, true),
    QUOTA_EXCEEDED("quota_exceeded", false, true),
    AUTH_FAILURE("auth_failure", false, true),
    NOT_FOUND("not_found", false, false),
    CONTENT_REJECTED("content_rejected", false, false),
    ALL_SOURCES_EXHAUSTED("all_sources_exhausted", true, false),
    DEADLINE_EXCEEDED("deadline_exceeded", true, false);

    private final String wireValue;
    private final boolean retryable;
    private final boolean breakerFailure;

    FailureKind(String wireValue, boolean retryable, boolean breakerFailure) {
        this.wireValue = wireValue;
        this.retryable = retryable;
        this.breakerFailure = breakerFailure;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Whether this failure says something about the source's health.
     */
    public boolean isBreakerFailure() {
        return breakerFailure;
    }

    /**
     * Whether this failure is a fact about the post itself, ending the fallback loop.
     */
    public boolean isTerminal() {
        return this == NOT_FOUND || this == CONTENT_REJECTED;
    }

    /**
     * Failures that open a breaker on first occurrence, ignoring the threshold.
     */
    public boolean opensImmediately() {
        return this == AUTH_FAILURE || this == QUOTA_EXCEEDED;
    }
}
