package com.edgen.postfetch.source.render;

import com.edgen.postfetch.config.PostFetchProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Drives a remote headless-browser service over HTTP ({@code POST /content}).
 * The service keeps no state between calls, so a session is just a handle.
 */
@Component
public class RemoteRenderingEngine implements RenderingEngine {

    static final String CONTENT_PATH = "/content";

    private final RestClient rendererRestClient;
    private final PostFetchProperties properties;

    public RemoteRenderingEngine(
            @Qualifier("rendererRestClient") RestClient rendererRestClient,
            PostFetchProperties properties) {
        this.rendererRestClient = rendererRestClient;
        this.properties = properties;
    }

    @Override
    public RenderingSession openSession() {
        return new RemoteSession();
    }

    String render(String url, String waitForSelector, Duration timeout) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("url", url);
        body.put("waitForSelector", Map.of("selector", waitForSelector, "timeout", timeout.toMillis()));
        body.put("gotoOptions", Map.of("waitUntil", "domcontentloaded", "timeout", timeout.toMillis()));

        String token = properties.getScraper().getRendererToken();
        try {
            return rendererRestClient.post()
                    .uri(uriBuilder -> {
                        uriBuilder.path(CONTENT_PATH);
                        if (StringUtils.hasText(token)) {
                            uriBuilder.queryParam("token", token.trim());
                        }
                        return uriBuilder.build();
                    })
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.TEXT_HTML, MediaType.ALL)
                    .body(body)
                    .exchange((request, response) -> {
                        int status = response.getStatusCode().value();
                        String content = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
                        if (response.getStatusCode().is2xxSuccessful()) {
                            return content;
                        }
                        if (status == 408 || content.contains("TimeoutError")) {
                            throw RenderingException.timeout("Page did not render within " + timeout.toMillis() + "ms");
                        }
                        throw RenderingException.status(status, "Renderer returned HTTP " + status);
                    });
        } catch (ResourceAccessException ex) {
            if (ex.getCause() instanceof SocketTimeoutException) {
                throw new RenderingException("Renderer did not respond in time", 0, true, ex);
            }
            throw RenderingException.io("Renderer unreachable", ex);
        }
    }

    private final class RemoteSession implements RenderingSession {

        @Override
        public String navigate(String url, String waitForSelector, Duration timeout) {
            return render(url, waitForSelector, timeout);
        }

        @Override
        public void close() {
            // Remote pages are closed by the service after each /content call.
        }
    }
}
