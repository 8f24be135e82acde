package com.edgen.postfetch.config;

import com.edgen.postfetch.model.PostSource;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Post data-fetch pipeline settings: source order, per-source limits, breaker
 * cool-downs, cache lifetimes.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "post-fetch")
public class PostFetchProperties {

    /**
     * Sources tried for every resolution, highest priority first.
     */
    private List<PostSource> priority = new ArrayList<>(List.of(PostSource.API, PostSource.SCRAPER, PostSource.EMBED));

    /**
     * Overall budget for one resolution when the caller does not pass a deadline.
     */
    private long defaultDeadlineMs = 20_000;

    private int executorThreads = 8;

    private Cache cache = new Cache();
    private Breaker breaker = new Breaker();
    private Api api = new Api();
    private Scraper scraper = new Scraper();
    private Embed embed = new Embed();
    private Membership membership = new Membership();
    private HealthStore healthStore = new HealthStore();
    private Admin admin = new Admin();

    public SourceSettings settingsFor(PostSource source) {
        return switch (source) {
            case API -> api;
            case SCRAPER -> scraper;
            case EMBED -> embed;
        };
    }

    @Getter
    @Setter
    public static class SourceSettings {
        private boolean enabled = true;
        private long connectTimeoutMs = 2_000;

        /**
         * Upper bound for one attempt against this source.
         */
        private long timeoutMs = 5_000;

        /**
         * Local request budget per fixed window; 0 disables the local budget.
         */
        private int windowBudget = 0;
        private long windowSeconds = 900;
    }

    @Getter
    @Setter
    public static class Api extends SourceSettings {
        private String baseUrl = "https://api.x.com";
        private String bearerToken = "";
    }

    @Getter
    @Setter
    public static class Scraper extends SourceSettings {
        private String rendererUrl = "http://localhost:3000";
        private String rendererToken = "";
        private int maxSessions = 2;
        private long sessionAcquireTimeoutMs = 2_000;
        private long pageLoadTimeoutMs = 8_000;
        private String contentSelector = "article [data-testid=\"tweetText\"]";
        private String unavailableSelector = "[data-testid=\"error-detail\"], [data-testid=\"emptyState\"]";

        public Scraper() {
            setTimeoutMs(12_000);
        }
    }

    @Getter
    @Setter
    public static class Embed extends SourceSettings {
        private String endpoint = "https://publish.twitter.com/oembed";
    }

    @Getter
    @Setter
    public static class Cache {
        private long ttlSeconds = 120;

        /**
         * Lifetime for records whose engagement counts are not authoritative.
         */
        private long degradedTtlSeconds = 30;
        private long lastKnownRetentionSeconds = 86_400;

        /**
         * Upper bound on entries held by each cache tier.
         */
        private long maxEntries = 1_000;
    }

    @Getter
    @Setter
    public static class Breaker {
        private int failureThreshold = 3;
        private long transientCooldownSeconds = 600;
        private long rateLimitedCooldownSeconds = 900;
        private long authFailureCooldownSeconds = 1_800;

        /**
         * Usage cap exhaustion only clears when the upstream billing period rolls over.
         */
        private long quotaExceededCooldownSeconds = 21_600;
        private double backoffMultiplier = 2.0;
        private long maxCooldownSeconds = 86_400;
    }

    @Getter
    @Setter
    public static class Membership {
        private List<String> requiredTerms = new ArrayList<>(List.of("@layeredge", "$EDGEN"));
    }

    @Getter
    @Setter
    public static class HealthStore {
        private String mode = "in_memory";
        private String redisKeyPrefix = "post-fetch:source-health:";
        private long ttlSeconds = 86_400;
    }

    @Getter
    @Setter
    public static class Admin {

        /**
         * Bearer token for admin endpoints; blank disables them.
         */
        private String token = "";
    }
}
