package com.edgen.postfetch.web;

import com.edgen.postfetch.config.PostFetchProperties;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Guards operator endpoints with a static bearer token. A blank configured token
 * switches the endpoints off entirely.
 */
public class AdminTokenInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(AdminTokenInterceptor.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final PostFetchProperties postFetchProperties;

    public AdminTokenInterceptor(PostFetchProperties postFetchProperties) {
        this.postFetchProperties = postFetchProperties;
    }

    @Override
    public boolean preHandle(@NonNull HttpServletRequest request, @NonNull HttpServletResponse response, @NonNull Object handler)
            throws IOException {
        String expected = postFetchProperties.getAdmin().getToken();
        if (!StringUtils.hasText(expected)) {
            response.sendError(HttpServletResponse.SC_FORBIDDEN, "Admin endpoints are disabled");
            return false;
        }

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)
                || !tokensMatch(expected.trim(), authorization.substring(BEARER_PREFIX.length()).trim())) {
            log.warn("Rejected admin request without valid token: {} {}", request.getMethod(), request.getRequestURI());
            response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Admin token required");
            return false;
        }
        return true;
    }

    private static boolean tokensMatch(String expected, String presented) {
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                presented.getBytes(StandardCharsets.UTF_8)
        );
    }
}
