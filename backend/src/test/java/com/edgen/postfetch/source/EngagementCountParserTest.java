package com.edgen.postfetch.source;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class EngagementCountParserTest {

    @Test
    void parsesPlainAndGroupedCounts() {
        assertEquals(7, EngagementCountParser.parse("7"));
        assertEquals(1024, EngagementCountParser.parse("1,024 Likes. Like"));
    }

    @Test
    void expandsAbbreviatedCounts() {
        assertEquals(1_200, EngagementCountParser.parse("1.2K"));
        assertEquals(3_000_000, EngagementCountParser.parse("3M reposts"));
        assertEquals(2_500_000_000L, EngagementCountParser.parse("2.5b"));
    }

    @Test
    void treatsMissingCountsAsZero() {
        assertEquals(0, EngagementCountParser.parse(null));
        assertEquals(0, EngagementCountParser.parse(" "));
        assertEquals(0, EngagementCountParser.parse("Reply"));
    }
}
