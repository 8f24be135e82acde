package com.edgen.postfetch.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of retrieval strategies for a single post.
 */
public enum PostSource {

    API("api"),
    SCRAPER("scraper"),
    EMBED("embed");

    private final String wireValue;

    PostSource(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public static PostSource fromWireValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("source is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (PostSource source : values()) {
            if (source.wireValue.equals(normalized) || source.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown post source: " + value);
    }
}
