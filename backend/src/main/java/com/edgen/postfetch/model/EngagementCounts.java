package com.edgen.postfetch.model;

public record EngagementCounts(
        long likes,
        long reshares,
        long replies) {

    public static final EngagementCounts ZERO = new EngagementCounts(0, 0, 0);

    public EngagementCounts {
        if (likes < 0 || reshares < 0 || replies < 0) {
            throw new IllegalArgumentException("engagement counts must not be negative");
        }
    }
}
