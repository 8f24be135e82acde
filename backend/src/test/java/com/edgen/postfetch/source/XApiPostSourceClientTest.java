package com.edgen.postfetch.source;

import com.edgen.postfetch.config.PostFetchProperties;
import com.edgen.postfetch.model.EngagementAvailability;
import com.edgen.postfetch.model.FailureKind;
import com.edgen.postfetch.model.NormalizedPostRecord;
import com.edgen.postfetch.model.PostReference;
import com.edgen.postfetch.model.PostSource;
import com.edgen.postfetch.model.SourceFetchException;
import com.edgen.postfetch.model.SourceFetchResult;
import com.edgen.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.time.Instant;

import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class XApiPostSourceClientTest {

    private static final String POST_ID = "1861747243341529383";
    private static final PostReference REFERENCE = PostReference.of(POST_ID, "LayerEdge");
    private static final Instant NOW = Instant.parse("2025-01-10T10:00:00Z");

    private MockRestServiceServer server;
    private PostFetchProperties properties;
    private XApiPostSourceClient client;

    @BeforeEach
    void setUp() {
        properties = new PostFetchProperties();
        properties.getApi().setBearerToken("test-token");
        RestClient.Builder builder = RestClient.builder().baseUrl("https://api.x.com");
        server = MockRestServiceServer.bindTo(builder).build();
        client = new XApiPostSourceClient(
                builder.build(),
                properties,
                new RequiredMentionPolicy(properties),
                new MutableClock(NOW)
        );
    }

    @Test
    void fetchMapsLookupResponseToAuthoritativeRecord() {
        HttpHeaders rateHeaders = new HttpHeaders();
        rateHeaders.add("x-rate-limit-limit", "15");
        rateHeaders.add("x-rate-limit-remaining", "14");
        rateHeaders.add("x-rate-limit-reset", "1736503200");
        server.expect(requestTo(startsWith("https://api.x.com/2/tweets/" + POST_ID)))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer test-token"))
                .andRespond(withSuccess("""
                        {
                          "data": {
                            "id": "1861747243341529383",
                            "text": "Running a light node for @layeredge today",
                            "author_id": "1450000000000000000",
                            "created_at": "2024-11-27T12:21:47.000Z",
                            "public_metrics": {"like_count": 42, "retweet_count": 7, "quote_count": 1, "reply_count": 3}
                          },
                          "includes": {
                            "users": [{"id": "1450000000000000000", "username": "LayerEdge", "name": "LayerEdge"}]
                          }
                        }
                        """, MediaType.APPLICATION_JSON).headers(rateHeaders));

        SourceFetchResult result = client.fetch(REFERENCE);
        NormalizedPostRecord record = result.record();

        server.verify();
        assertEquals(POST_ID, record.postId());
        assertEquals("https://x.com/LayerEdge/status/" + POST_ID, record.url());
        assertEquals("1450000000000000000", record.author().id());
        assertEquals("LayerEdge", record.author().handle());
        assertEquals(42, record.engagement().likes());
        assertEquals(8, record.engagement().reshares());
        assertEquals(3, record.engagement().replies());
        assertEquals(EngagementAvailability.AUTHORITATIVE, record.engagementAvailability());
        assertEquals(Instant.parse("2024-11-27T12:21:47Z"), record.createdAt());
        assertEquals(PostSource.API, record.source());
        assertTrue(record.membershipMatched());
        assertEquals(NOW, record.fetchedAt());

        assertNotNull(result.rateLimit());
        assertEquals(14, result.rateLimit().remaining());
        assertEquals(15, result.rateLimit().limit());
        assertEquals(Instant.ofEpochSecond(1736503200L), result.rateLimit().resetAt());
    }

    @Test
    void fetchTreatsLookupErrorsAsNotFound() {
        server.expect(requestTo(startsWith("https://api.x.com/2/tweets/" + POST_ID)))
                .andRespond(withSuccess("""
                        {"errors": [{"title": "Not Found Error", "detail": "Could not find tweet with id: [1861747243341529383]."}]}
                        """, MediaType.APPLICATION_JSON));

        SourceFetchException thrown = assertThrows(SourceFetchException.class, () -> client.fetch(REFERENCE));

        assertEquals(FailureKind.NOT_FOUND, thrown.getKind());
        assertFalse(thrown.getFailure().retryable());
    }

    @Test
    void fetchTreatsProtectedPostAsNotFound() {
        server.expect(requestTo(startsWith("https://api.x.com/2/tweets/" + POST_ID)))
                .andRespond(withSuccess("""
                        {"errors": [{"title": "Authorization Error", "type": "https://api.twitter.com/2/problems/not-authorized-for-resource"}]}
                        """, MediaType.APPLICATION_JSON));

        SourceFetchException thrown = assertThrows(SourceFetchException.class, () -> client.fetch(REFERENCE));

        assertEquals(FailureKind.NOT_FOUND, thrown.getKind());
    }

    @Test
    void fetchDistinguishesUsageCapFromRateLimit() {
        HttpHeaders rateHeaders = new HttpHeaders();
        rateHeaders.add("x-rate-limit-remaining", "0");
        rateHeaders.add("x-rate-limit-reset", "1736503200");
        server.expect(requestTo(startsWith("https://api.x.com/2/tweets/" + POST_ID)))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"title\":\"UsageCapExceeded\",\"detail\":\"Usage cap exceeded: Monthly product cap\"}"));
        server.expect(requestTo(startsWith("https://api.x.com/2/tweets/" + POST_ID)))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS)
                        .headers(rateHeaders)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"title\":\"Too Many Requests\",\"detail\":\"Too Many Requests\"}"));

        SourceFetchException quota = assertThrows(SourceFetchException.class, () -> client.fetch(REFERENCE));
        SourceFetchException rateLimited = assertThrows(SourceFetchException.class, () -> client.fetch(REFERENCE));

        assertEquals(FailureKind.QUOTA_EXCEEDED, quota.getKind());
        assertEquals(FailureKind.RATE_LIMITED, rateLimited.getKind());
        assertNotNull(rateLimited.getRateLimit());
        assertEquals(0, rateLimited.getRateLimit().remaining());
    }

    @Test
    void fetchMapsStatusCodesToFailureKinds() {
        server.expect(requestTo(startsWith("https://api.x.com/2/tweets/")))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));
        server.expect(requestTo(startsWith("https://api.x.com/2/tweets/")))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(requestTo(startsWith("https://api.x.com/2/tweets/")))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY));

        assertEquals(FailureKind.AUTH_FAILURE,
                assertThrows(SourceFetchException.class, () -> client.fetch(REFERENCE)).getKind());
        assertEquals(FailureKind.NOT_FOUND,
                assertThrows(SourceFetchException.class, () -> client.fetch(REFERENCE)).getKind());
        assertEquals(FailureKind.TRANSIENT,
                assertThrows(SourceFetchException.class, () -> client.fetch(REFERENCE)).getKind());
    }

    @Test
    void fetchRejectsResponseWithoutAuthorAsTransient() {
        server.expect(requestTo(startsWith("https://api.x.com/2/tweets/" + POST_ID)))
                .andRespond(withSuccess("""
                        {"data": {"id": "1861747243341529383", "text": "hello", "author_id": "1"}}
                        """, MediaType.APPLICATION_JSON));

        SourceFetchException thrown = assertThrows(SourceFetchException.class, () -> client.fetch(REFERENCE));

        assertEquals(FailureKind.TRANSIENT, thrown.getKind());
    }

    @Test
    void classifyTreatsIoErrorsAsTransient() {
        server.expect(requestTo(startsWith("https://api.x.com/2/tweets/" + POST_ID)))
                .andRespond(withException(new IOException("Connection reset")));

        RuntimeException thrown = assertThrows(RuntimeException.class, () -> client.fetch(REFERENCE));

        assertEquals(FailureKind.TRANSIENT, client.classify(thrown).kind());
        assertTrue(client.classify(thrown).retryable());
    }

    @Test
    void clientIsDisabledWithoutBearerToken() {
        assertTrue(client.isEnabled());

        properties.getApi().setBearerToken("  ");

        assertFalse(client.isEnabled());
    }
}
