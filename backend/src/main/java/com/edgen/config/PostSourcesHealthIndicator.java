package com.edgen.config;

import com.edgen.postfetch.dto.PostFetchHealthResponse;
import com.edgen.postfetch.model.PipelineStatus;
import com.edgen.postfetch.service.PostFetchHealthService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component("postSources")
public class PostSourcesHealthIndicator implements HealthIndicator {

    private final PostFetchHealthService postFetchHealthService;

    public PostSourcesHealthIndicator(PostFetchHealthService postFetchHealthService) {
        this.postFetchHealthService = postFetchHealthService;
    }

    @Override
    public Health health() {
        try {
            PostFetchHealthResponse snapshot = postFetchHealthService.getHealthSnapshot();

            Health.Builder builder = snapshot.status() == PipelineStatus.UNAVAILABLE ? Health.down() : Health.up();
            return builder
                    .withDetail("pipeline", snapshot.status())
                    .withDetail("sources", snapshot.sources())
                    .withDetail("activeScraperSessions", snapshot.activeScraperSessions())
                    .withDetail("cachedResults", snapshot.cachedResults())
                    .build();
        } catch (Exception e) {
            return Health.down()
                    .withException(e)
                    .build();
        }
    }
}
