package com.edgen.postfetch.config;

import com.edgen.postfetch.source.render.RenderingEngine;
import com.edgen.postfetch.source.render.RenderingSessionPool;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import java.time.Clock;

/**
 * HTTP clients, the attempt executor and the clock shared by the fetch pipeline.
 */
@Configuration
public class PostFetchConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ThreadPoolTaskExecutor postFetchExecutor(PostFetchProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getExecutorThreads());
        executor.setMaxPoolSize(properties.getExecutorThreads());
        executor.setQueueCapacity(properties.getExecutorThreads() * 16);
        executor.setThreadNamePrefix("post-fetch-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean
    public RestClient xApiRestClient(PostFetchProperties properties) {
        PostFetchProperties.Api api = properties.getApi();
        return RestClient.builder()
                .baseUrl(api.getBaseUrl())
                .requestFactory(requestFactory(api.getConnectTimeoutMs(), api.getTimeoutMs()))
                .build();
    }

    @Bean
    public RestClient embedRestClient(PostFetchProperties properties) {
        PostFetchProperties.Embed embed = properties.getEmbed();
        return RestClient.builder()
                .requestFactory(requestFactory(embed.getConnectTimeoutMs(), embed.getTimeoutMs()))
                .build();
    }

    @Bean
    public RestClient rendererRestClient(PostFetchProperties properties) {
        PostFetchProperties.Scraper scraper = properties.getScraper();
        // Renderer replies only after its own page-load wait, so read timeout covers that wait.
        return RestClient.builder()
                .baseUrl(scraper.getRendererUrl())
                .requestFactory(requestFactory(
                        scraper.getConnectTimeoutMs(),
                        scraper.getPageLoadTimeoutMs() + scraper.getConnectTimeoutMs()))
                .build();
    }

    @Bean
    public RenderingSessionPool renderingSessionPool(RenderingEngine renderingEngine, PostFetchProperties properties) {
        return new RenderingSessionPool(renderingEngine, properties.getScraper().getMaxSessions());
    }

    private static SimpleClientHttpRequestFactory requestFactory(long connectTimeoutMs, long readTimeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) connectTimeoutMs);
        factory.setReadTimeout((int) readTimeoutMs);
        return factory;
    }
}
