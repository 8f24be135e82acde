package com.edgen.postfetch.model;

/**
 * How much a record's engagement counts can be trusted.
 */
public enum EngagementAvailability {

    /**
     * Counts read from the source in this fetch.
     */
    AUTHORITATIVE,

    /**
     * Source returned no counts; values are the last authoritative counts seen for the post.
     */
    LAST_KNOWN,

    /**
     * Source returned no counts and none were known; values are zero placeholders.
     */
    UNAVAILABLE
}
