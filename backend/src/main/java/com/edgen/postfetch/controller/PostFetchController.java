package com.edgen.postfetch.controller;

import com.edgen.postfetch.config.PostFetchProperties;
import com.edgen.postfetch.dto.CacheClearResponse;
import com.edgen.postfetch.dto.PostFetchHealthResponse;
import com.edgen.postfetch.dto.ResolvePostRequest;
import com.edgen.postfetch.model.NormalizedPostRecord;
import com.edgen.postfetch.model.PostReference;
import com.edgen.postfetch.model.PostSource;
import com.edgen.postfetch.model.ResolutionPolicy;
import com.edgen.postfetch.service.PostFetchHealthService;
import com.edgen.postfetch.service.PostFetchOrchestrator;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

@RestController
@RequestMapping("/api/post-fetch")
public class PostFetchController {

    private final PostFetchOrchestrator postFetchOrchestrator;
    private final PostFetchHealthService postFetchHealthService;
    private final PostFetchProperties postFetchProperties;
    private final Clock clock;

    public PostFetchController(
            PostFetchOrchestrator postFetchOrchestrator,
            PostFetchHealthService postFetchHealthService,
            PostFetchProperties postFetchProperties,
            Clock clock) {
        this.postFetchOrchestrator = postFetchOrchestrator;
        this.postFetchHealthService = postFetchHealthService;
        this.postFetchProperties = postFetchProperties;
        this.clock = clock;
    }

    @PostMapping("/posts/resolve")
    public ResponseEntity<NormalizedPostRecord> resolve(@Valid @RequestBody ResolvePostRequest request) {
        PostReference reference = PostReference.parse(request.url());
        long timeoutMs = request.timeoutMs() == null ? postFetchProperties.getDefaultDeadlineMs() : request.timeoutMs();
        Instant deadline = clock.instant().plusMillis(timeoutMs);
        ResolutionPolicy policy = request.requireMembership()
                ? ResolutionPolicy.REQUIRE_MEMBERSHIP
                : ResolutionPolicy.ANY_CONTENT;
        return ResponseEntity.ok(postFetchOrchestrator.resolve(reference, deadline, policy));
    }

    @GetMapping("/health")
    public ResponseEntity<PostFetchHealthResponse> health() {
        return ResponseEntity.ok(postFetchHealthService.getHealthSnapshot());
    }

    @PostMapping("/sources/{source}/reset")
    public ResponseEntity<PostFetchHealthResponse.SourceStatus> resetSource(@PathVariable String source) {
        PostSource postSource;
        try {
            postSource = PostSource.fromWireValue(source);
        } catch (IllegalArgumentException ex) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(postFetchHealthService.resetSource(postSource));
    }

    @DeleteMapping("/cache")
    public ResponseEntity<CacheClearResponse> clearCache() {
        return ResponseEntity.ok(new CacheClearResponse(postFetchHealthService.clearCache()));
    }
}
