package com.edgen.postfetch.service;

import com.edgen.postfetch.config.PostFetchProperties;
import com.edgen.postfetch.model.PostSource;
import com.edgen.postfetch.model.RateLimitSnapshot;
import com.edgen.postfetch.model.RateWindowSnapshot;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Skips sources that are known to be out of budget before any network call is made.
 * Rate data is advisory: a source that never reports any is always attemptable.
 */
@Service
public class SourceRateTracker {

    private final PostFetchProperties properties;
    private final Clock clock;
    private final Map<PostSource, RateWindow> windows = new EnumMap<>(PostSource.class);

    public SourceRateTracker(PostFetchProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        for (PostSource source : PostSource.values()) {
            windows.put(source, new RateWindow(source));
        }
    }

    public boolean canAttempt(PostSource source) {
        return blockedUntil(source).isEmpty();
    }

    /**
     * Instant at which a currently blocked source is expected to accept requests again.
     */
    public Optional<Instant> blockedUntil(PostSource source) {
        PostFetchProperties.SourceSettings settings = properties.settingsFor(source);
        return Optional.ofNullable(window(source).blockedUntil(
                clock.instant(),
                settings.getWindowBudget(),
                windowLength(settings)
        ));
    }

    public void recordAttempt(PostSource source) {
        window(source).recordAttempt(clock.instant(), windowLength(properties.settingsFor(source)));
    }

    public void recordResult(PostSource source, RateLimitSnapshot snapshot) {
        window(source).recordResult(snapshot);
    }

    public RateWindowSnapshot snapshot(PostSource source) {
        return window(source).snapshot();
    }

    public void reset(PostSource source) {
        window(source).reset();
    }

    private static Duration windowLength(PostFetchProperties.SourceSettings settings) {
        return Duration.ofSeconds(Math.max(1, settings.getWindowSeconds()));
    }

    private RateWindow window(PostSource source) {
        RateWindow window = windows.get(source);
        if (window == null) {
            throw new IllegalArgumentException("Unknown source " + source);
        }
        return window;
    }
}
