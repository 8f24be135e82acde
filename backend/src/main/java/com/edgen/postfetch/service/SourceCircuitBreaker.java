package com.edgen.postfetch.service;

import com.edgen.postfetch.config.PostFetchProperties;
import com.edgen.postfetch.model.CircuitState;
import com.edgen.postfetch.model.FailureKind;
import com.edgen.postfetch.model.PostSource;
import com.edgen.postfetch.model.SourceFetchException;
import com.edgen.postfetch.model.SourceHealthSnapshot;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * One Resilience4j breaker per source, registered under the source's wire name.
 *
 * <p>The breaker trips once {@code failureThreshold} counting failures fill its window,
 * and a half-open breaker admits a single trial call. Quota and auth failures open it at once.
 * Cool-downs depend on the failure kind and grow with each failed trial call, so the
 * open-to-half-open move is driven by the scheduled next attempt on the injected clock
 * instead of the breaker's fixed wait.
 *
 * <p>Each source has its own lock; no call here blocks on another source. Snapshots
 * are persisted while the lock is held so the store never sees transitions out of order.
 */
@Service
public class SourceCircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(SourceCircuitBreaker.class);

    // Never reached: allow() moves open breakers to half-open on its own schedule.
    private static final Duration MANUAL_OPEN_WAIT = Duration.ofDays(365);

    private final PostFetchProperties properties;
    private final SourceHealthStore healthStore;
    private final Clock clock;
    private final Map<PostSource, SourceHealth> healthBySource = new EnumMap<>(PostSource.class);

    public SourceCircuitBreaker(PostFetchProperties properties, SourceHealthStore healthStore, Clock clock) {
        this.properties = properties;
        this.healthStore = healthStore;
        this.clock = clock;
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(breakerConfig(properties.getBreaker()));
        for (PostSource source : PostSource.values()) {
            CircuitBreaker breaker = registry.circuitBreaker(source.wireValue());
            breaker.getEventPublisher().onStateTransition(event ->
                    log.info("Breaker for source {} moved from {} to {}", source.wireValue(),
                            event.getStateTransition().getFromState(), event.getStateTransition().getToState()));
            healthBySource.put(source, new SourceHealth(source, breaker));
        }
    }

    static CircuitBreakerConfig breakerConfig(PostFetchProperties.Breaker settings) {
        int threshold = Math.max(1, settings.getFailureThreshold());
        return CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(100.0f)
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .waitDurationInOpenState(MANUAL_OPEN_WAIT)
                .recordException(SourceCircuitBreaker::countsAgainstSource)
                // Unrecorded errors would otherwise count as successes.
                .ignoreException(error -> !countsAgainstSource(error))
                .build();
    }

    private static boolean countsAgainstSource(Throwable error) {
        if (error instanceof SourceFetchException) {
            return ((SourceFetchException) error).getKind().isBreakerFailure();
        }
        return true;
    }

    @PostConstruct
    void restorePersistedState() {
        for (SourceHealth health : healthBySource.values()) {
            SourceHealthSnapshot persisted;
            try {
                persisted = healthStore.load(health.source).orElse(null);
            } catch (RuntimeException ex) {
                log.warn("Could not restore breaker state for source {}: {}", health.source.wireValue(), ex.getMessage());
                continue;
            }
            if (persisted == null) {
                continue;
            }
            health.lock.lock();
            try {
                restore(health, persisted);
            } finally {
                health.lock.unlock();
            }
            if (persisted.state() != CircuitState.CLOSED) {
                log.info("Restored {} breaker for source {} (next attempt at {})",
                        persisted.state(), health.source.wireValue(), health.nextAttemptAt);
            }
        }
    }

    /**
     * Whether an attempt against {@code source} may start now. A {@code true} answer in
     * the half-open state claims the single trial-call permit; the caller must then report
     * {@link #onSuccess}, {@link #onFailure} or {@link #release}.
     */
    public boolean allow(PostSource source) {
        SourceHealth health = health(source);
        health.lock.lock();
        try {
            if (health.state() == CircuitState.OPEN) {
                if (health.nextAttemptAt != null && clock.instant().isBefore(health.nextAttemptAt)) {
                    return false;
                }
                health.breaker.transitionToHalfOpenState();
                persist(health.snapshot());
            }
            return health.breaker.tryAcquirePermission();
        } finally {
            health.lock.unlock();
        }
    }

    public void onSuccess(PostSource source) {
        SourceHealth health = health(source);
        health.lock.lock();
        try {
            CircuitState previous = health.state();
            boolean hadFailures = health.consecutiveFailures > 0 || health.reopenCount > 0;
            health.breaker.onSuccess(0, TimeUnit.NANOSECONDS);
            if (health.state() != CircuitState.CLOSED) {
                health.breaker.transitionToClosedState();
            }
            health.clearCounters();
            if (previous != CircuitState.CLOSED || hadFailures) {
                persist(health.snapshot());
            }
        } finally {
            health.lock.unlock();
        }
    }

    public void onFailure(PostSource source, FailureKind kind) {
        SourceHealth health = health(source);
        SourceFetchException recorded = SourceFetchException.of(source, kind, "reported to breaker");
        health.lock.lock();
        try {
            if (!kind.isBreakerFailure()) {
                // Ignored by the breaker config; only hands back a half-open permit.
                health.breaker.onError(0, TimeUnit.NANOSECONDS, recorded);
                return;
            }

            Instant now = clock.instant();
            CircuitState previous = health.state();
            health.consecutiveFailures++;
            health.lastFailureAt = now;

            if (previous == CircuitState.HALF_OPEN) {
                health.breaker.onError(0, TimeUnit.NANOSECONDS, recorded);
                health.reopenCount++;
                scheduleOpen(health, kind, now);
            } else if (previous == CircuitState.CLOSED) {
                if (kind.opensImmediately()) {
                    health.breaker.transitionToOpenState();
                } else {
                    health.breaker.onError(0, TimeUnit.NANOSECONDS, recorded);
                }
                if (health.state() == CircuitState.OPEN) {
                    scheduleOpen(health, kind, now);
                }
            }

            SourceHealthSnapshot changed = health.snapshot();
            if (previous != CircuitState.OPEN && changed.state() == CircuitState.OPEN) {
                log.warn("Breaker for source {} opened by {} after {} consecutive failure(s); next attempt at {}",
                        source.wireValue(), kind.wireValue(), changed.consecutiveFailures(), changed.nextAttemptAt());
            } else {
                log.debug("Source {} failure {} counted ({} consecutive)",
                        source.wireValue(), kind.wireValue(), changed.consecutiveFailures());
            }
            persist(changed);
        } finally {
            health.lock.unlock();
        }
    }

    /**
     * Gives back a half-open trial-call permit without judging the source.
     */
    public void release(PostSource source) {
        SourceHealth health = health(source);
        health.lock.lock();
        try {
            if (health.state() == CircuitState.HALF_OPEN) {
                health.breaker.releasePermission();
            }
        } finally {
            health.lock.unlock();
        }
    }

    public SourceHealthSnapshot reset(PostSource source) {
        SourceHealth health = health(source);
        health.lock.lock();
        try {
            health.breaker.reset();
            health.clearCounters();
            health.lastFailureAt = null;
            SourceHealthSnapshot snapshot = health.snapshot();
            persist(snapshot);
            log.info("Breaker for source {} manually reset", source.wireValue());
            return snapshot;
        } finally {
            health.lock.unlock();
        }
    }

    public SourceHealthSnapshot snapshot(PostSource source) {
        SourceHealth health = health(source);
        health.lock.lock();
        try {
            return health.snapshot();
        } finally {
            health.lock.unlock();
        }
    }

    Duration cooldownFor(FailureKind kind, int reopenCount) {
        PostFetchProperties.Breaker breaker = properties.getBreaker();
        long baseSeconds = switch (kind) {
            case RATE_LIMITED -> breaker.getRateLimitedCooldownSeconds();
            case AUTH_FAILURE -> breaker.getAuthFailureCooldownSeconds();
            case QUOTA_EXCEEDED -> breaker.getQuotaExceededCooldownSeconds();
            default -> breaker.getTransientCooldownSeconds();
        };
        double scaled = baseSeconds * Math.pow(Math.max(1.0, breaker.getBackoffMultiplier()), reopenCount);
        return Duration.ofSeconds((long) Math.min(scaled, (double) breaker.getMaxCooldownSeconds()));
    }

    private void scheduleOpen(SourceHealth health, FailureKind kind, Instant now) {
        if (health.state() != CircuitState.OPEN) {
            health.breaker.transitionToOpenState();
        }
        health.openedBy = kind;
        health.nextAttemptAt = now.plus(cooldownFor(kind, health.reopenCount));
    }

    private void restore(SourceHealth health, SourceHealthSnapshot snapshot) {
        health.consecutiveFailures = Math.max(0, snapshot.consecutiveFailures());
        health.lastFailureAt = snapshot.lastFailureAt();
        health.nextAttemptAt = snapshot.nextAttemptAt();
        health.openedBy = snapshot.openedBy();
        health.reopenCount = Math.max(0, snapshot.reopenCount());

        if (snapshot.state() == CircuitState.CLOSED) {
            // Seed the window so a restored failure streak still trips at the threshold.
            int replay = Math.min(health.consecutiveFailures, Math.max(1, properties.getBreaker().getFailureThreshold()) - 1);
            for (int i = 0; i < replay; i++) {
                health.breaker.onError(0, TimeUnit.NANOSECONDS,
                        SourceFetchException.of(health.source, FailureKind.TRANSIENT, "restored failure"));
            }
            return;
        }
        // A trial call in flight does not survive a restart: half-open comes back as open-and-due.
        health.breaker.transitionToOpenState();
        if (health.nextAttemptAt == null) {
            health.nextAttemptAt = Instant.EPOCH;
        }
    }

    private void persist(SourceHealthSnapshot snapshot) {
        try {
            healthStore.save(snapshot);
        } catch (RuntimeException ex) {
            log.warn("Could not persist breaker state for source {}: {}", snapshot.source().wireValue(), ex.getMessage());
        }
    }

    private SourceHealth health(PostSource source) {
        SourceHealth health = healthBySource.get(source);
        if (health == null) {
            throw new IllegalArgumentException("Unknown source " + source);
        }
        return health;
    }
}
