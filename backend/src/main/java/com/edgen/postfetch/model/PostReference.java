package com.edgen.postfetch.model;

import java.time.Instant;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validated pointer to one post on the upstream platform.
 * Built once from user input; every pipeline stage keys on {@link #postId()}.
 */
public record PostReference(
        String postId,
        String canonicalUrl,
        String authorHandle) {

    private static final Pattern POST_URL = Pattern.compile(
            "^https?://(?:www\\.|mobile\\.)?(?:twitter\\.com|x\\.com)/([A-Za-z0-9_]{1,15})/status(?:es)?/(\\d{1,20})(?:[/?#].*)?$",
            Pattern.CASE_INSENSITIVE
    );
    private static final Pattern POST_ID = Pattern.compile("\\d{1,20}");
    private static final Pattern HANDLE = Pattern.compile("[A-Za-z0-9_]{1,15}");

    // Snowflake ids carry their creation time in the upper bits.
    private static final long SNOWFLAKE_EPOCH_MS = 1288834974657L;
    private static final long FIRST_SNOWFLAKE_ID = 29_700_859_247L;

    public PostReference {
        if (postId == null || !POST_ID.matcher(postId).matches()) {
            throw new InvalidPostReferenceException("Post id must be numeric");
        }
        if (authorHandle == null || !HANDLE.matcher(authorHandle).matches()) {
            throw new InvalidPostReferenceException("Author handle is invalid");
        }
        if (canonicalUrl == null || canonicalUrl.isBlank()) {
            throw new InvalidPostReferenceException("Canonical URL is required");
        }
    }

    public static PostReference parse(String rawUrl) {
        if (rawUrl == null || rawUrl.isBlank()) {
            throw new InvalidPostReferenceException("Post URL is required");
        }
        Matcher matcher = POST_URL.matcher(rawUrl.trim());
        if (!matcher.matches()) {
            throw new InvalidPostReferenceException(
                    "Post URL must look like https://x.com/{handle}/status/{id}");
        }
        return of(matcher.group(2), matcher.group(1));
    }

    public static PostReference of(String postId, String authorHandle) {
        return new PostReference(postId, "https://x.com/" + authorHandle + "/status/" + postId, authorHandle);
    }

    public Optional<Instant> snowflakeTimestamp() {
        long id;
        try {
            id = Long.parseLong(postId);
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
        if (id < FIRST_SNOWFLAKE_ID) {
            return Optional.empty();
        }
        return Optional.of(Instant.ofEpochMilli((id >> 22) + SNOWFLAKE_EPOCH_MS));
    }
}
