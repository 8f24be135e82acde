package com.edgen.postfetch.service;

import com.edgen.postfetch.config.PostFetchProperties;
import com.edgen.postfetch.dto.PostFetchHealthResponse;
import com.edgen.postfetch.dto.PostFetchHealthResponse.SourceStatus;
import com.edgen.postfetch.model.CircuitState;
import com.edgen.postfetch.model.PipelineStatus;
import com.edgen.postfetch.model.PostSource;
import com.edgen.postfetch.model.RateWindowSnapshot;
import com.edgen.postfetch.model.SourceHealthSnapshot;
import com.edgen.postfetch.source.PostSourceClient;
import com.edgen.postfetch.source.render.RenderingSessionPool;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Read-only status of every source plus the operator actions on it.
 */
@Service
public class PostFetchHealthService {

    static final String SERVICE_NAME = "post-fetch";

    private final Map<PostSource, PostSourceClient> clients = new EnumMap<>(PostSource.class);
    private final SourceCircuitBreaker circuitBreaker;
    private final SourceRateTracker rateTracker;
    private final PostResultCache resultCache;
    private final RenderingSessionPool sessionPool;
    private final PostFetchProperties properties;
    private final Clock clock;

    public PostFetchHealthService(
            List<PostSourceClient> sourceClients,
            SourceCircuitBreaker circuitBreaker,
            SourceRateTracker rateTracker,
            PostResultCache resultCache,
            RenderingSessionPool sessionPool,
            PostFetchProperties properties,
            Clock clock) {
        for (PostSourceClient client : sourceClients) {
            clients.put(client.source(), client);
        }
        this.circuitBreaker = circuitBreaker;
        this.rateTracker = rateTracker;
        this.resultCache = resultCache;
        this.sessionPool = sessionPool;
        this.properties = properties;
        this.clock = clock;
    }

    public PostFetchHealthResponse getHealthSnapshot() {
        Instant now = clock.instant();
        Map<String, SourceStatus> sources = new LinkedHashMap<>();
        int usable = 0;
        int impaired = 0;
        for (PostSource source : new LinkedHashSet<>(properties.getPriority())) {
            SourceStatus status = sourceStatus(source);
            sources.put(source.wireValue(), status);
            if (!status.enabled()) {
                continue;
            }
            boolean rateBlocked = rateTracker.blockedUntil(source).isPresent();
            boolean breakerBlocked = status.state() == CircuitState.OPEN
                    && status.nextAttemptAt() != null
                    && now.isBefore(status.nextAttemptAt());
            if (!rateBlocked && !breakerBlocked) {
                usable++;
            }
            if (rateBlocked || status.state() != CircuitState.CLOSED) {
                impaired++;
            }
        }

        PipelineStatus pipelineStatus;
        if (usable == 0) {
            pipelineStatus = PipelineStatus.UNAVAILABLE;
        } else if (impaired > 0) {
            pipelineStatus = PipelineStatus.DEGRADED;
        } else {
            pipelineStatus = PipelineStatus.OPERATIONAL;
        }

        return new PostFetchHealthResponse(
                SERVICE_NAME,
                pipelineStatus,
                sources,
                sessionPool.activeSessions(),
                sessionPool.maxSessions(),
                resultCache.size()
        );
    }

    public SourceStatus resetSource(PostSource source) {
        circuitBreaker.reset(source);
        return sourceStatus(source);
    }

    public int clearCache() {
        return resultCache.clear();
    }

    private SourceStatus sourceStatus(PostSource source) {
        PostSourceClient client = clients.get(source);
        SourceHealthSnapshot health = circuitBreaker.snapshot(source);
        RateWindowSnapshot rate = rateTracker.snapshot(source);
        return new SourceStatus(
                client != null && client.isEnabled(),
                health.state(),
                health.consecutiveFailures(),
                health.openedBy(),
                health.nextAttemptAt(),
                rate.remaining(),
                rate.resetAt(),
                rate.requestsInWindow()
        );
    }
}
