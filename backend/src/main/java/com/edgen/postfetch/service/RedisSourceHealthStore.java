package com.edgen.postfetch.service;

import com.edgen.postfetch.config.PostFetchProperties;
import com.edgen.postfetch.model.PostSource;
import com.edgen.postfetch.model.SourceHealthSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Primary
@ConditionalOnProperty(
        prefix = "post-fetch.health-store",
        name = "mode",
        havingValue = "redis"
)
public class RedisSourceHealthStore implements SourceHealthStore {

    private static final Logger log = LoggerFactory.getLogger(RedisSourceHealthStore.class);
    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    private static final Duration REDIS_FAILURE_BACKOFF = Duration.ofSeconds(5);

    private final StringRedisTemplate stringRedisTemplate;
    private final PostFetchProperties postFetchProperties;
    private final InMemorySourceHealthStore fallbackStore;

    private volatile boolean fallbackMode;
    private volatile long redisRetryNotBeforeNanos;

    @Override
    public Optional<SourceHealthSnapshot> load(PostSource source) {
        if (!shouldAttemptRedis()) {
            return fallbackStore.load(source);
        }
        String payload;
        try {
            payload = stringRedisTemplate.opsForValue().get(resolveKey(source));
            markRedisHealthy();
        } catch (RuntimeException ex) {
            markRedisFailure(ex);
            return fallbackStore.load(source);
        }
        if (payload == null) {
            return fallbackStore.load(source);
        }
        return deserialize(source, payload);
    }

    @Override
    public void save(SourceHealthSnapshot snapshot) {
        SourceHealthSnapshot requiredSnapshot = Objects.requireNonNull(snapshot, "snapshot is required");
        fallbackStore.save(requiredSnapshot);
        if (!shouldAttemptRedis()) {
            return;
        }
        try {
            stringRedisTemplate.opsForValue().set(
                    resolveKey(requiredSnapshot.source()),
                    serialize(requiredSnapshot),
                    Duration.ofSeconds(resolveTtlSeconds())
            );
            markRedisHealthy();
        } catch (RuntimeException ex) {
            markRedisFailure(ex);
        }
    }

    private String resolveKey(PostSource source) {
        String prefix = postFetchProperties.getHealthStore().getRedisKeyPrefix();
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalStateException("post-fetch.health-store.redis-key-prefix must not be blank");
        }
        return prefix.trim() + source.wireValue();
    }

    private long resolveTtlSeconds() {
        long ttlSeconds = postFetchProperties.getHealthStore().getTtlSeconds();
        if (ttlSeconds <= 0) {
            throw new IllegalStateException("post-fetch.health-store.ttl-seconds must be greater than zero");
        }
        return ttlSeconds;
    }

    private String serialize(SourceHealthSnapshot snapshot) {
        try {
            return OBJECT_MAPPER.writeValueAsString(snapshot);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize source health snapshot", ex);
        }
    }

    private Optional<SourceHealthSnapshot> deserialize(PostSource source, String payload) {
        try {
            return Optional.of(OBJECT_MAPPER.readValue(payload, SourceHealthSnapshot.class));
        } catch (JsonProcessingException ex) {
            log.warn("Discarding unreadable health snapshot for source {}: {}", source.wireValue(), ex.getOriginalMessage());
            return Optional.empty();
        }
    }

    private boolean shouldAttemptRedis() {
        return System.nanoTime() >= redisRetryNotBeforeNanos;
    }

    private void markRedisFailure(RuntimeException ex) {
        redisRetryNotBeforeNanos = System.nanoTime() + REDIS_FAILURE_BACKOFF.toNanos();
        if (!fallbackMode) {
            fallbackMode = true;
            log.warn(
                    "Redis health store is unavailable ({}); switching to in-memory fallback mode",
                    resolveSafeMessage(ex)
            );
        }
    }

    private void markRedisHealthy() {
        if (fallbackMode) {
            log.info("Redis health store connection restored; leaving in-memory fallback mode");
        }
        fallbackMode = false;
        redisRetryNotBeforeNanos = 0L;
    }

    private String resolveSafeMessage(RuntimeException ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        return message;
    }
}
