package com.edgen.postfetch.source;

import com.edgen.postfetch.config.PostFetchProperties;
import com.edgen.postfetch.model.EngagementAvailability;
import com.edgen.postfetch.model.EngagementCounts;
import com.edgen.postfetch.model.FailureKind;
import com.edgen.postfetch.model.NormalizedPostRecord;
import com.edgen.postfetch.model.PostAuthor;
import com.edgen.postfetch.model.PostReference;
import com.edgen.postfetch.model.PostSource;
import com.edgen.postfetch.model.RateLimitSnapshot;
import com.edgen.postfetch.model.SourceFailure;
import com.edgen.postfetch.model.SourceFetchException;
import com.edgen.postfetch.model.SourceFetchResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Structured API source: bearer-token lookup of one post with author expansion.
 */
@Component
public class XApiPostSourceClient implements PostSourceClient {

    private static final Logger log = LoggerFactory.getLogger(XApiPostSourceClient.class);
    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder().build();

    static final String LOOKUP_PATH = "/2/tweets/{id}?expansions=author_id"
            + "&tweet.fields=public_metrics,created_at&user.fields=username,name";

    private final RestClient xApiRestClient;
    private final PostFetchProperties properties;
    private final RequiredMentionPolicy mentionPolicy;
    private final Clock clock;

    public XApiPostSourceClient(
            @Qualifier("xApiRestClient") RestClient xApiRestClient,
            PostFetchProperties properties,
            RequiredMentionPolicy mentionPolicy,
            Clock clock) {
        this.xApiRestClient = xApiRestClient;
        this.properties = properties;
        this.mentionPolicy = mentionPolicy;
        this.clock = clock;
    }

    @Override
    public PostSource source() {
        return PostSource.API;
    }

    @Override
    public boolean isEnabled() {
        PostFetchProperties.Api api = properties.getApi();
        return api.isEnabled() && StringUtils.hasText(api.getBearerToken());
    }

    @Override
    public SourceFetchResult fetch(PostReference reference) {
        return xApiRestClient.get()
                .uri(LOOKUP_PATH, reference.postId())
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApi().getBearerToken().trim())
                .accept(MediaType.APPLICATION_JSON)
                .exchange((request, response) -> {
                    RateLimitSnapshot rateLimit = RateLimitHeaders.parse(response.getHeaders());
                    String body = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
                    return handleResponse(reference, response.getStatusCode(), body, rateLimit);
                });
    }

    @Override
    public SourceFailure classify(Throwable error) {
        return SourceFailures.classify(PostSource.API, error);
    }

    private SourceFetchResult handleResponse(
            PostReference reference,
            HttpStatusCode status,
            String body,
            RateLimitSnapshot rateLimit
    ) {
        JsonNode root = readTree(body);
        if (status.is2xxSuccessful()) {
            JsonNode data = root.path("data");
            if (data.isMissingNode() || data.isNull()) {
                throw errorsFailure(reference, root, rateLimit);
            }
            return new SourceFetchResult(toRecord(reference, data, root.path("includes")), rateLimit);
        }

        int code = status.value();
        if (code == 429) {
            if (isUsageCapExceeded(root)) {
                log.error("X API usage cap exceeded while fetching post {}", reference.postId());
                throw SourceFetchException.of(PostSource.API, FailureKind.QUOTA_EXCEEDED,
                        "Usage cap exceeded", rateLimit);
            }
            throw SourceFetchException.of(PostSource.API, FailureKind.RATE_LIMITED,
                    "HTTP 429 rate limited", rateLimit);
        }
        if (code == 404) {
            throw SourceFetchException.of(PostSource.API, FailureKind.NOT_FOUND,
                    "HTTP 404 post not found", rateLimit);
        }
        if (code == 401 || code == 403) {
            if (isUsageCapExceeded(root)) {
                throw SourceFetchException.of(PostSource.API, FailureKind.QUOTA_EXCEEDED,
                        "Usage cap exceeded", rateLimit);
            }
            throw SourceFetchException.of(PostSource.API, FailureKind.AUTH_FAILURE,
                    "HTTP " + code + " credentials rejected", rateLimit);
        }
        throw SourceFetchException.of(PostSource.API, FailureKind.TRANSIENT, "HTTP " + code, rateLimit);
    }

    private NormalizedPostRecord toRecord(PostReference reference, JsonNode data, JsonNode includes) {
        String authorId = data.path("author_id").asText(null);
        JsonNode author = findAuthor(includes, authorId);
        if (author == null) {
            throw SourceFetchException.of(PostSource.API, FailureKind.TRANSIENT, "Author data missing from response");
        }
        String handle = author.path("username").asText(reference.authorHandle());
        String text = data.path("text").asText("");
        JsonNode metrics = data.path("public_metrics");
        EngagementCounts engagement = new EngagementCounts(
                metrics.path("like_count").asLong(0),
                metrics.path("retweet_count").asLong(0) + metrics.path("quote_count").asLong(0),
                metrics.path("reply_count").asLong(0)
        );
        String postId = data.path("id").asText(reference.postId());
        return new NormalizedPostRecord(
                postId,
                "https://x.com/" + handle + "/status/" + postId,
                text,
                new PostAuthor(author.path("id").asText(authorId), handle, author.path("name").asText(handle)),
                engagement,
                EngagementAvailability.AUTHORITATIVE,
                parseCreatedAt(reference, data.path("created_at").asText(null)),
                PostSource.API,
                mentionPolicy.matches(text),
                clock.instant()
        );
    }

    private static JsonNode findAuthor(JsonNode includes, String authorId) {
        JsonNode users = includes.path("users");
        if (!users.isArray() || users.isEmpty()) {
            return null;
        }
        for (JsonNode user : users) {
            if (authorId == null || authorId.equals(user.path("id").asText())) {
                return user;
            }
        }
        return users.get(0);
    }

    private static Instant parseCreatedAt(PostReference reference, String raw) {
        if (StringUtils.hasText(raw)) {
            try {
                return Instant.parse(raw);
            } catch (DateTimeParseException ex) {
                log.debug("Unparseable created_at '{}' for post {}", raw, reference.postId());
            }
        }
        return reference.snowflakeTimestamp().orElseThrow(() -> SourceFetchException.of(
                PostSource.API, FailureKind.TRANSIENT, "Creation time missing from response"));
    }

    private static SourceFetchException errorsFailure(PostReference reference, JsonNode root, RateLimitSnapshot rateLimit) {
        JsonNode errors = root.path("errors");
        if (errors.isArray()) {
            for (JsonNode error : errors) {
                String title = error.path("title").asText("").toLowerCase(Locale.ROOT);
                String detail = error.path("detail").asText("");
                String type = error.path("type").asText("");
                if (title.contains("not found") || detail.contains("Could not find") || type.endsWith("resource-not-found")) {
                    return SourceFetchException.of(PostSource.API, FailureKind.NOT_FOUND, "Post not found", rateLimit);
                }
                if (title.contains("authorization") || type.endsWith("not-authorized-for-resource")) {
                    // Protected or withheld post: the post exists but is not publicly readable.
                    return SourceFetchException.of(PostSource.API, FailureKind.NOT_FOUND,
                            "Post is not publicly accessible", rateLimit);
                }
            }
        }
        log.warn("X API returned neither data nor a recognised error for post {}", reference.postId());
        return SourceFetchException.of(PostSource.API, FailureKind.TRANSIENT, "Response contained no post data", rateLimit);
    }

    private static boolean isUsageCapExceeded(JsonNode root) {
        String title = root.path("title").asText("");
        String detail = root.path("detail").asText("");
        String type = root.path("type").asText("");
        return "UsageCapExceeded".equals(title)
                || detail.toLowerCase(Locale.ROOT).contains("usage cap exceeded")
                || type.endsWith("usage-capped");
    }

    private static JsonNode readTree(String body) {
        if (!StringUtils.hasText(body)) {
            return OBJECT_MAPPER.createObjectNode();
        }
        try {
            return OBJECT_MAPPER.readTree(body);
        } catch (JsonProcessingException ex) {
            return OBJECT_MAPPER.createObjectNode();
        }
    }
}
