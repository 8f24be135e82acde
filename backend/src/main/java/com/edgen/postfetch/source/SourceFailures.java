package com.edgen.postfetch.source;

import com.edgen.postfetch.model.FailureKind;
import com.edgen.postfetch.model.PostSource;
import com.edgen.postfetch.model.SourceFailure;
import com.edgen.postfetch.model.SourceFetchException;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.TimeoutException;

/**
 * Classification rules shared by all source clients.
 */
final class SourceFailures {

    private SourceFailures() {
    }

    static SourceFailure classify(PostSource source, Throwable error) {
        if (error instanceof SourceFetchException) {
            return ((SourceFetchException) error).getFailure();
        }
        if (error instanceof RestClientResponseException) {
            RestClientResponseException response = (RestClientResponseException) error;
            return SourceFailure.of(source, kindForStatus(response.getStatusCode()), "HTTP " + response.getStatusCode().value());
        }
        if (error instanceof ResourceAccessException
                || error instanceof IOException
                || error instanceof UncheckedIOException
                || error instanceof TimeoutException) {
            return SourceFailure.of(source, FailureKind.TRANSIENT, "I/O failure: " + safeMessage(error));
        }
        return SourceFailure.of(source, FailureKind.TRANSIENT, "Unexpected " + error.getClass().getSimpleName()
                + ": " + safeMessage(error));
    }

    /**
     * Status mapping for sources without vendor-specific error bodies.
     */
    static FailureKind kindForStatus(HttpStatusCode status) {
        int code = status.value();
        if (code == 404 || code == 410) {
            return FailureKind.NOT_FOUND;
        }
        if (code == 401 || code == 403) {
            return FailureKind.AUTH_FAILURE;
        }
        if (code == 429) {
            return FailureKind.RATE_LIMITED;
        }
        return FailureKind.TRANSIENT;
    }

    static String safeMessage(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }
}
