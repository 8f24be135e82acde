package com.edgen.postfetch.service;

import com.edgen.postfetch.config.PostFetchProperties;
import com.edgen.postfetch.model.EngagementAvailability;
import com.edgen.postfetch.model.FailureKind;
import com.edgen.postfetch.model.NormalizedPostRecord;
import com.edgen.postfetch.model.PostReference;
import com.edgen.postfetch.model.PostResolutionException;
import com.edgen.postfetch.model.PostSource;
import com.edgen.postfetch.model.ResolutionPolicy;
import com.edgen.postfetch.model.SourceAttempt;
import com.edgen.postfetch.model.SourceAttemptStatus;
import com.edgen.postfetch.model.SourceFailure;
import com.edgen.postfetch.model.SourceFetchException;
import com.edgen.postfetch.model.SourceFetchResult;
import com.edgen.postfetch.source.PostSourceClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves one post by walking the sources in priority order until one produces a
 * complete record, a source proves the post is unavailable, or every source has been
 * tried or skipped.
 */
@Service
public class PostFetchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PostFetchOrchestrator.class);

    private final Map<PostSource, PostSourceClient> clients = new EnumMap<>(PostSource.class);
    private final SourceCircuitBreaker circuitBreaker;
    private final SourceRateTracker rateTracker;
    private final PostResultCache resultCache;
    private final PostFetchProperties properties;
    private final AsyncTaskExecutor executor;
    private final Clock clock;

    public PostFetchOrchestrator(
            List<PostSourceClient> sourceClients,
            SourceCircuitBreaker circuitBreaker,
            SourceRateTracker rateTracker,
            PostResultCache resultCache,
            PostFetchProperties properties,
            @Qualifier("postFetchExecutor") AsyncTaskExecutor executor,
            Clock clock) {
        for (PostSourceClient client : sourceClients) {
            PostSourceClient previous = clients.put(client.source(), client);
            if (previous != null) {
                throw new IllegalStateException("Duplicate client for source " + client.source().wireValue());
            }
        }
        this.circuitBreaker = circuitBreaker;
        this.rateTracker = rateTracker;
        this.resultCache = resultCache;
        this.properties = properties;
        this.executor = executor;
        this.clock = clock;
    }

    public NormalizedPostRecord resolve(PostReference reference) {
        return resolve(reference, clock.instant().plusMillis(properties.getDefaultDeadlineMs()));
    }

    public NormalizedPostRecord resolve(PostReference reference, Instant deadline) {
        return resolve(reference, deadline, ResolutionPolicy.ANY_CONTENT);
    }

    public NormalizedPostRecord resolve(PostReference reference, Instant deadline, ResolutionPolicy policy) {
        Objects.requireNonNull(reference, "reference is required");
        Objects.requireNonNull(deadline, "deadline is required");
        ResolutionPolicy requiredPolicy = policy == null ? ResolutionPolicy.ANY_CONTENT : policy;
        List<PostSource> order = new ArrayList<>(new LinkedHashSet<>(properties.getPriority()));

        Optional<NormalizedPostRecord> cached = resultCache.get(reference.postId());
        if (cached.isPresent()) {
            List<SourceAttempt> attempts = new ArrayList<>();
            for (PostSource source : order) {
                attempts.add(source == cached.get().source()
                        ? new SourceAttempt(source, SourceAttemptStatus.SUCCEEDED, null, "cached", null)
                        : SourceAttempt.notReached(source));
            }
            return applyPolicy(cached.get(), requiredPolicy, attempts);
        }

        List<SourceAttempt> attempts = new ArrayList<>();
        for (int index = 0; index < order.size(); index++) {
            PostSource source = order.get(index);
            if (!clock.instant().isBefore(deadline)) {
                markNotReached(attempts, order, index);
                log.warn("Deadline passed before source {} could be tried for post {}", source.wireValue(), reference.postId());
                throw PostResolutionException.deadlineExceeded(reference.postId(), attempts);
            }

            PostSourceClient client = clients.get(source);
            if (client == null || !client.isEnabled()) {
                attempts.add(SourceAttempt.skipped(source, SourceAttemptStatus.SKIPPED_DISABLED, "Source disabled", null));
                continue;
            }
            Optional<Instant> rateBlockedUntil = rateTracker.blockedUntil(source);
            if (rateBlockedUntil.isPresent()) {
                attempts.add(SourceAttempt.skipped(source, SourceAttemptStatus.SKIPPED_RATE_LIMITED,
                        "Rate budget exhausted", rateBlockedUntil.get()));
                log.debug("Skipping rate-limited source {} for post {}", source.wireValue(), reference.postId());
                continue;
            }
            if (!circuitBreaker.allow(source)) {
                attempts.add(SourceAttempt.skipped(source, SourceAttemptStatus.SKIPPED_CIRCUIT_OPEN,
                        "Circuit open", circuitBreaker.snapshot(source).nextAttemptAt()));
                log.debug("Skipping source {} with open circuit for post {}", source.wireValue(), reference.postId());
                continue;
            }

            rateTracker.recordAttempt(source);
            Optional<NormalizedPostRecord> record = attempt(client, reference, deadline, attempts, order, index);
            if (record.isPresent()) {
                markNotReached(attempts, order, index + 1);
                return applyPolicy(record.get(), requiredPolicy, attempts);
            }
        }

        log.warn("All sources failed or were skipped for post {}: {}", reference.postId(), summarize(attempts));
        throw PostResolutionException.exhausted(reference.postId(), attempts);
    }

    private Optional<NormalizedPostRecord> attempt(
            PostSourceClient client,
            PostReference reference,
            Instant deadline,
            List<SourceAttempt> attempts,
            List<PostSource> order,
            int index
    ) {
        PostSource source = client.source();
        Duration sourceTimeout = Duration.ofMillis(properties.settingsFor(source).getTimeoutMs());
        Duration untilDeadline = Duration.between(clock.instant(), deadline);
        boolean deadlineBinds = untilDeadline.compareTo(sourceTimeout) < 0;
        Duration wait = deadlineBinds ? untilDeadline : sourceTimeout;

        Future<SourceFetchResult> future;
        try {
            future = executor.submit(() -> client.fetch(reference));
        } catch (TaskRejectedException ex) {
            circuitBreaker.release(source);
            attempts.add(SourceAttempt.failed(SourceFailure.of(source, FailureKind.TRANSIENT, "Fetch executor saturated")));
            log.warn("Fetch executor rejected {} attempt for post {}", source.wireValue(), reference.postId());
            return Optional.empty();
        }

        try {
            SourceFetchResult result = future.get(Math.max(0, wait.toMillis()), TimeUnit.MILLISECONDS);
            circuitBreaker.onSuccess(source);
            rateTracker.recordResult(source, result.rateLimit());
            NormalizedPostRecord record = backfillEngagement(result.record());
            resultCache.put(record);
            attempts.add(SourceAttempt.succeeded(source));
            log.info("Resolved post {} from source {}{}", reference.postId(), source.wireValue(),
                    record.isDegraded() ? " (degraded engagement)" : "");
            return Optional.of(record);
        } catch (TimeoutException ex) {
            future.cancel(true);
            if (deadlineBinds) {
                circuitBreaker.release(source);
                attempts.add(SourceAttempt.failed(SourceFailure.of(source, FailureKind.DEADLINE_EXCEEDED,
                        "Abandoned at caller deadline")));
                markNotReached(attempts, order, index + 1);
                log.warn("Deadline exceeded while source {} was fetching post {}", source.wireValue(), reference.postId());
                throw PostResolutionException.deadlineExceeded(reference.postId(), attempts);
            }
            SourceFailure failure = SourceFailure.of(source, FailureKind.TRANSIENT,
                    "No response within " + sourceTimeout.toMillis() + "ms");
            recordFailure(failure, reference, attempts);
            return Optional.empty();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            circuitBreaker.release(source);
            attempts.add(SourceAttempt.failed(SourceFailure.of(source, FailureKind.DEADLINE_EXCEEDED, "Interrupted")));
            markNotReached(attempts, order, index + 1);
            throw PostResolutionException.deadlineExceeded(reference.postId(), attempts);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            if (cause instanceof SourceFetchException) {
                rateTracker.recordResult(source, ((SourceFetchException) cause).getRateLimit());
            }
            SourceFailure failure = client.classify(cause);
            recordFailure(failure, reference, attempts);
            if (failure.kind().isTerminal()) {
                markNotReached(attempts, order, index + 1);
                throw PostResolutionException.terminal(failure.kind(), reference.postId(), attempts, failure.detail());
            }
            return Optional.empty();
        }
    }

    private void recordFailure(SourceFailure failure, PostReference reference, List<SourceAttempt> attempts) {
        circuitBreaker.onFailure(failure.source(), failure.kind());
        attempts.add(SourceAttempt.failed(failure));
        if (failure.kind().isTerminal()) {
            log.info("Source {} reports post {} as {}", failure.source().wireValue(), reference.postId(), failure.kind().wireValue());
        } else {
            log.warn("Source {} failed for post {} with {}: {}", failure.source().wireValue(), reference.postId(),
                    failure.kind().wireValue(), failure.detail());
        }
    }

    private NormalizedPostRecord backfillEngagement(NormalizedPostRecord record) {
        if (record.engagementAvailability() != EngagementAvailability.UNAVAILABLE) {
            return record;
        }
        return resultCache.lastKnownEngagement(record.postId())
                .map(counts -> record.withEngagement(counts, EngagementAvailability.LAST_KNOWN))
                .orElse(record);
    }

    private static NormalizedPostRecord applyPolicy(
            NormalizedPostRecord record,
            ResolutionPolicy policy,
            List<SourceAttempt> attempts
    ) {
        if (policy == ResolutionPolicy.REQUIRE_MEMBERSHIP && !record.membershipMatched()) {
            throw PostResolutionException.terminal(FailureKind.CONTENT_REJECTED, record.postId(), attempts,
                    "Post does not mention a required term");
        }
        return record;
    }

    private static void markNotReached(List<SourceAttempt> attempts, List<PostSource> order, int fromIndex) {
        for (int i = fromIndex; i < order.size(); i++) {
            attempts.add(SourceAttempt.notReached(order.get(i)));
        }
    }

    private static String summarize(List<SourceAttempt> attempts) {
        StringBuilder summary = new StringBuilder();
        for (SourceAttempt attempt : attempts) {
            if (summary.length() > 0) {
                summary.append(", ");
            }
            summary.append(attempt.source().wireValue()).append('=').append(attempt.status());
            if (attempt.failureKind() != null) {
                summary.append('/').append(attempt.failureKind().wireValue());
            }
        }
        return summary.toString();
    }
}
