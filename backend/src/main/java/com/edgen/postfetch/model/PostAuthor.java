package com.edgen.postfetch.model;

import java.util.Objects;

/**
 * Author as reported by a source. Sources that cannot see the numeric account id
 * report the handle as the id.
 */
public record PostAuthor(
        String id,
        String handle,
        String displayName) {

    public PostAuthor {
        Objects.requireNonNull(id, "author id is required");
        Objects.requireNonNull(handle, "author handle is required");
        if (handle.isBlank()) {
            throw new IllegalArgumentException("author handle must not be blank");
        }
        displayName = displayName == null || displayName.isBlank() ? handle : displayName;
    }
}
