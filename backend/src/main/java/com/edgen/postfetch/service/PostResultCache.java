package com.edgen.postfetch.service;

import com.edgen.postfetch.config.PostFetchProperties;
import com.edgen.postfetch.model.EngagementAvailability;
import com.edgen.postfetch.model.EngagementCounts;
import com.edgen.postfetch.model.NormalizedPostRecord;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * Short-lived successful results keyed by post id. Failures are never cached.
 * Both tiers are size-bounded; expiry follows the injected clock.
 */
@Service
public class PostResultCache {

    private static final Logger log = LoggerFactory.getLogger(PostResultCache.class);

    private final PostFetchProperties properties;
    private final Cache<String, CachedPost> entries;
    private final Cache<String, EngagementCounts> lastKnown;

    public PostResultCache(PostFetchProperties properties, Clock clock) {
        this.properties = properties;
        PostFetchProperties.Cache settings = properties.getCache();
        Ticker ticker = () -> ChronoUnit.NANOS.between(Instant.EPOCH, clock.instant());

        this.entries = Caffeine.newBuilder()
                .maximumSize(settings.getMaxEntries())
                .expireAfter(new PerEntryLifetime())
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
        this.lastKnown = Caffeine.newBuilder()
                .maximumSize(settings.getMaxEntries())
                .expireAfterWrite(Duration.ofSeconds(settings.getLastKnownRetentionSeconds()))
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    public Optional<NormalizedPostRecord> get(String postId) {
        CachedPost cached = entries.getIfPresent(postId);
        return cached == null ? Optional.empty() : Optional.of(cached.record());
    }

    public void put(String postId, NormalizedPostRecord record, Duration ttl) {
        Objects.requireNonNull(record, "record is required");
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return;
        }
        entries.put(postId, new CachedPost(record, ttl));
        if (record.engagementAvailability() == EngagementAvailability.AUTHORITATIVE) {
            lastKnown.put(postId, record.engagement());
        }
    }

    /**
     * Stores {@code record} for the full lifetime, or the shorter degraded lifetime when
     * its engagement counts are not authoritative.
     */
    public void put(NormalizedPostRecord record) {
        PostFetchProperties.Cache cache = properties.getCache();
        long ttlSeconds = record.isDegraded() ? cache.getDegradedTtlSeconds() : cache.getTtlSeconds();
        put(record.postId(), record, Duration.ofSeconds(ttlSeconds));
    }

    public Optional<EngagementCounts> lastKnownEngagement(String postId) {
        return Optional.ofNullable(lastKnown.getIfPresent(postId));
    }

    public int size() {
        entries.cleanUp();
        return (int) entries.estimatedSize();
    }

    public int clear() {
        int cleared = size();
        entries.invalidateAll();
        log.info("Cleared {} cached post result(s)", cleared);
        return cleared;
    }

    private record CachedPost(NormalizedPostRecord record, Duration ttl) {
    }

    private static final class PerEntryLifetime implements Expiry<String, CachedPost> {

        @Override
        public long expireAfterCreate(String key, CachedPost value, long currentTime) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CachedPost value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, CachedPost value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
