package com.edgen.postfetch.model;

import java.util.Objects;

public record SourceFailure(
        PostSource source,
        FailureKind kind,
        boolean retryable,
        String detail) {

    public SourceFailure {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(kind, "kind is required");
        detail = detail == null ? kind.wireValue() : detail;
    }

    public static SourceFailure of(PostSource source, FailureKind kind, String detail) {
        return new SourceFailure(source, kind, kind.isRetryable(), detail);
    }
}
