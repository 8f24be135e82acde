package com.edgen.postfetch.source;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the abbreviated counters rendered on post pages ("1,024", "3.4K", "2M").
 */
final class EngagementCountParser {

    private static final Pattern LEADING_COUNT = Pattern.compile("^\\s*([0-9][0-9,]*(?:\\.[0-9]+)?)\\s*([KMB])?", Pattern.CASE_INSENSITIVE);

    private EngagementCountParser() {
    }

    static long parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        Matcher matcher = LEADING_COUNT.matcher(raw);
        if (!matcher.find()) {
            return 0;
        }
        BigDecimal value = new BigDecimal(matcher.group(1).replace(",", ""));
        String suffix = matcher.group(2);
        if (suffix != null) {
            switch (suffix.toUpperCase(Locale.ROOT)) {
                case "K" -> value = value.movePointRight(3);
                case "M" -> value = value.movePointRight(6);
                case "B" -> value = value.movePointRight(9);
                default -> {
                }
            }
        }
        return value.longValue();
    }
}
