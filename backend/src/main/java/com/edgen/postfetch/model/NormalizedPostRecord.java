package com.edgen.postfetch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * The one shape every source's output is converted into. Always complete:
 * a source either produces every field or fails.
 */
public record NormalizedPostRecord(
        String postId,
        String url,
        String text,
        PostAuthor author,
        EngagementCounts engagement,
        EngagementAvailability engagementAvailability,
        Instant createdAt,
        PostSource source,
        boolean membershipMatched,
        Instant fetchedAt) {

    public NormalizedPostRecord {
        Objects.requireNonNull(postId, "postId is required");
        Objects.requireNonNull(url, "url is required");
        Objects.requireNonNull(text, "text is required");
        Objects.requireNonNull(author, "author is required");
        Objects.requireNonNull(engagement, "engagement is required");
        Objects.requireNonNull(engagementAvailability, "engagementAvailability is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(fetchedAt, "fetchedAt is required");
    }

    @JsonProperty("degraded")
    public boolean isDegraded() {
        return engagementAvailability != EngagementAvailability.AUTHORITATIVE;
    }

    public NormalizedPostRecord withEngagement(EngagementCounts counts, EngagementAvailability availability) {
        return new NormalizedPostRecord(
                postId,
                url,
                text,
                author,
                counts,
                availability,
                createdAt,
                source,
                membershipMatched,
                fetchedAt
        );
    }
}
