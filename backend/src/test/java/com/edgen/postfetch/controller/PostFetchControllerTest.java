package com.edgen.postfetch.controller;

import com.edgen.postfetch.config.PostFetchProperties;
import com.edgen.postfetch.dto.PostFetchHealthResponse;
import com.edgen.postfetch.model.CircuitState;
import com.edgen.postfetch.model.EngagementAvailability;
import com.edgen.postfetch.model.EngagementCounts;
import com.edgen.postfetch.model.FailureKind;
import com.edgen.postfetch.model.NormalizedPostRecord;
import com.edgen.postfetch.model.PipelineStatus;
import com.edgen.postfetch.model.PostAuthor;
import com.edgen.postfetch.model.PostReference;
import com.edgen.postfetch.model.PostResolutionException;
import com.edgen.postfetch.model.PostSource;
import com.edgen.postfetch.model.ResolutionPolicy;
import com.edgen.postfetch.model.SourceAttempt;
import com.edgen.postfetch.model.SourceAttemptStatus;
import com.edgen.postfetch.model.SourceFailure;
import com.edgen.postfetch.service.PostFetchHealthService;
import com.edgen.postfetch.service.PostFetchOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PostFetchController.class)
@Import(PostFetchProperties.class)
class PostFetchControllerTest {

    private static final Instant NOW = Instant.parse("2025-01-10T10:00:00Z");
    private static final String POST_URL = "https://twitter.com/LayerEdge/status/1861747243341529383";
    private static final PostReference REFERENCE = PostReference.parse(POST_URL);

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private PostFetchProperties postFetchProperties;

    @MockitoBean
    private PostFetchOrchestrator postFetchOrchestrator;

    @MockitoBean
    private PostFetchHealthService postFetchHealthService;

    @BeforeEach
    void setUp() {
        postFetchProperties.getAdmin().setToken("admin-secret");
    }

    @Test
    void resolveReturnsNormalizedRecord() throws Exception {
        when(postFetchOrchestrator.resolve(eq(REFERENCE), eq(NOW.plusMillis(5_000)), eq(ResolutionPolicy.REQUIRE_MEMBERSHIP)))
                .thenReturn(record());

        mockMvc.perform(post("/api/post-fetch/posts/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"" + POST_URL + "\",\"requireMembership\":true,\"timeoutMs\":5000}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.postId").value("1861747243341529383"))
                .andExpect(jsonPath("$.source").value("api"))
                .andExpect(jsonPath("$.engagement.likes").value(42))
                .andExpect(jsonPath("$.engagementAvailability").value("AUTHORITATIVE"))
                .andExpect(jsonPath("$.degraded").value(false))
                .andExpect(jsonPath("$.membershipMatched").value(true));
    }

    @Test
    void resolveUsesDefaultDeadlineAndPolicy() throws Exception {
        when(postFetchOrchestrator.resolve(REFERENCE, NOW.plusMillis(20_000), ResolutionPolicy.ANY_CONTENT))
                .thenReturn(record());

        mockMvc.perform(post("/api/post-fetch/posts/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"" + POST_URL + "\"}"))
                .andExpect(status().isOk());

        verify(postFetchOrchestrator).resolve(REFERENCE, NOW.plusMillis(20_000), ResolutionPolicy.ANY_CONTENT);
    }

    @Test
    void resolveRejectsInvalidUrl() throws Exception {
        mockMvc.perform(post("/api/post-fetch/posts/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"https://example.com/post/1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").exists());

        verify(postFetchOrchestrator, never()).resolve(any(), any(), any());
    }

    @Test
    void resolveRejectsBlankUrlAndNonPositiveTimeout() throws Exception {
        mockMvc.perform(post("/api/post-fetch/posts/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\" \",\"timeoutMs\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").doesNotExist())
                .andExpect(jsonPath("$.message").value(startsWith("Invalid post fetch request")))
                .andExpect(jsonPath("$.attempts").isEmpty())
                .andExpect(jsonPath("$.fieldErrors.url").exists())
                .andExpect(jsonPath("$.fieldErrors.timeoutMs").exists());
    }

    @Test
    void resolveRejectsMalformedBodyWithSameErrorShape() throws Exception {
        mockMvc.perform(post("/api/post-fetch/posts/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Request body is missing or malformed"))
                .andExpect(jsonPath("$.attempts").isEmpty())
                .andExpect(jsonPath("$.fieldErrors").isEmpty());

        verify(postFetchOrchestrator, never()).resolve(any(), any(), any());
    }

    @Test
    void notFoundMapsTo404() throws Exception {
        when(postFetchOrchestrator.resolve(any(), any(), any())).thenThrow(PostResolutionException.terminal(
                FailureKind.NOT_FOUND,
                REFERENCE.postId(),
                List.of(SourceAttempt.failed(SourceFailure.of(PostSource.API, FailureKind.NOT_FOUND, "HTTP 404 upstream body")),
                        SourceAttempt.notReached(PostSource.SCRAPER),
                        SourceAttempt.notReached(PostSource.EMBED)),
                "HTTP 404"));

        mockMvc.perform(post("/api/post-fetch/posts/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"" + POST_URL + "\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("not_found"))
                .andExpect(jsonPath("$.message").value("Post not found or not publicly accessible"))
                .andExpect(jsonPath("$.attempts[0].source").value("api"))
                .andExpect(jsonPath("$.attempts[0].kind").value("not_found"))
                .andExpect(jsonPath("$.attempts[0].detail").doesNotExist())
                .andExpect(jsonPath("$.attempts[1].status").value("NOT_REACHED"));
    }

    @Test
    void contentRejectionMapsTo422() throws Exception {
        when(postFetchOrchestrator.resolve(any(), any(), any())).thenThrow(PostResolutionException.terminal(
                FailureKind.CONTENT_REJECTED, REFERENCE.postId(), List.of(), "missing mention"));

        mockMvc.perform(post("/api/post-fetch/posts/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"" + POST_URL + "\",\"requireMembership\":true}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("content_rejected"));
    }

    @Test
    void exhaustionMapsTo503WithRetryAfter() throws Exception {
        when(postFetchOrchestrator.resolve(any(), any(), any())).thenThrow(PostResolutionException.exhausted(
                REFERENCE.postId(),
                List.of(
                        SourceAttempt.skipped(PostSource.API, SourceAttemptStatus.SKIPPED_CIRCUIT_OPEN, "Circuit open",
                                NOW.plusSeconds(600)),
                        SourceAttempt.skipped(PostSource.SCRAPER, SourceAttemptStatus.SKIPPED_RATE_LIMITED, "Rate budget exhausted",
                                NOW.plusSeconds(120)),
                        SourceAttempt.failed(SourceFailure.of(PostSource.EMBED, FailureKind.TRANSIENT, "HTTP 503"))
                )));

        mockMvc.perform(post("/api/post-fetch/posts/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"" + POST_URL + "\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string("Retry-After", "120"))
                .andExpect(jsonPath("$.code").value("all_sources_exhausted"))
                .andExpect(jsonPath("$.attempts.length()").value(3));
    }

    @Test
    void deadlineWithoutRetryHintUsesDefaultRetryAfter() throws Exception {
        when(postFetchOrchestrator.resolve(any(), any(), any()))
                .thenThrow(PostResolutionException.deadlineExceeded(REFERENCE.postId(), List.of()));

        mockMvc.perform(post("/api/post-fetch/posts/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"" + POST_URL + "\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string("Retry-After", "30"))
                .andExpect(jsonPath("$.code").value("deadline_exceeded"));
    }

    @Test
    void healthReturnsSnapshot() throws Exception {
        Map<String, PostFetchHealthResponse.SourceStatus> sources = new LinkedHashMap<>();
        sources.put("api", new PostFetchHealthResponse.SourceStatus(
                true, CircuitState.OPEN, 3, FailureKind.TRANSIENT, NOW.plusSeconds(600), 0, NOW.plusSeconds(300), 4));
        when(postFetchHealthService.getHealthSnapshot()).thenReturn(new PostFetchHealthResponse(
                "post-fetch", PipelineStatus.DEGRADED, sources, 1, 2, 7));

        mockMvc.perform(get("/api/post-fetch/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.service").value("post-fetch"))
                .andExpect(jsonPath("$.status").value("DEGRADED"))
                .andExpect(jsonPath("$.sources.api.state").value("OPEN"))
                .andExpect(jsonPath("$.sources.api.openedBy").value("transient"))
                .andExpect(jsonPath("$.activeScraperSessions").value(1))
                .andExpect(jsonPath("$.cachedResults").value(7));
    }

    @Test
    void resetRequiresAdminToken() throws Exception {
        mockMvc.perform(post("/api/post-fetch/sources/api/reset"))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(post("/api/post-fetch/sources/api/reset").header("Authorization", "Bearer wrong"))
                .andExpect(status().isUnauthorized());

        verify(postFetchHealthService, never()).resetSource(any());
    }

    @Test
    void resetWithAdminTokenClosesBreaker() throws Exception {
        when(postFetchHealthService.resetSource(PostSource.API)).thenReturn(new PostFetchHealthResponse.SourceStatus(
                true, CircuitState.CLOSED, 0, null, null, null, null, 0));

        mockMvc.perform(post("/api/post-fetch/sources/api/reset").header("Authorization", "Bearer admin-secret"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("CLOSED"));
    }

    @Test
    void resetOfUnknownSourceIsNotFound() throws Exception {
        mockMvc.perform(post("/api/post-fetch/sources/mastodon/reset").header("Authorization", "Bearer admin-secret"))
                .andExpect(status().isNotFound());
    }

    @Test
    void adminEndpointsAreDisabledWithoutConfiguredToken() throws Exception {
        postFetchProperties.getAdmin().setToken("");

        mockMvc.perform(delete("/api/post-fetch/cache").header("Authorization", "Bearer admin-secret"))
                .andExpect(status().isForbidden());

        verify(postFetchHealthService, never()).clearCache();
    }

    @Test
    void clearCacheReportsClearedEntries() throws Exception {
        when(postFetchHealthService.clearCache()).thenReturn(5);

        mockMvc.perform(delete("/api/post-fetch/cache").header("Authorization", "Bearer admin-secret"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cleared").value(5));
    }

    private static NormalizedPostRecord record() {
        return new NormalizedPostRecord(
                REFERENCE.postId(),
                REFERENCE.canonicalUrl(),
                "Light node live @layeredge",
                new PostAuthor("1450000000000000000", "LayerEdge", "LayerEdge"),
                new EngagementCounts(42, 7, 3),
                EngagementAvailability.AUTHORITATIVE,
                Instant.parse("2024-11-27T12:21:47Z"),
                PostSource.API,
                true,
                NOW
        );
    }
}
