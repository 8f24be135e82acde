package com.edgen.postfetch.model;

public enum SourceAttemptStatus {
    SUCCEEDED,
    FAILED,
    SKIPPED_CIRCUIT_OPEN,
    SKIPPED_RATE_LIMITED,
    SKIPPED_DISABLED,
    NOT_REACHED
}
