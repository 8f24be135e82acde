package com.edgen.postfetch.source;

import com.edgen.postfetch.config.PostFetchProperties;
import com.edgen.postfetch.model.EngagementAvailability;
import com.edgen.postfetch.model.EngagementCounts;
import com.edgen.postfetch.model.FailureKind;
import com.edgen.postfetch.model.NormalizedPostRecord;
import com.edgen.postfetch.model.PostReference;
import com.edgen.postfetch.model.PostSource;
import com.edgen.postfetch.model.SourceFetchException;
import com.edgen.postfetch.source.render.RenderingException;
import com.edgen.postfetch.source.render.RenderingSession;
import com.edgen.postfetch.source.render.RenderingSessionPool;
import com.edgen.postfetch.source.render.SessionPoolExhaustedException;
import com.edgen.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScraperPostSourceClientTest {

    private static final String POST_ID = "1861747243341529383";
    private static final PostReference REFERENCE = PostReference.of(POST_ID, "LayerEdge");
    private static final Instant NOW = Instant.parse("2025-01-10T10:00:00Z");

    private static final String POST_PAGE = """
            <html><body>
              <article>
                <div data-testid="User-Name">
                  <a href="/LayerEdge"><span>LayerEdge</span></a>
                  <a href="/LayerEdge"><span>@LayerEdge</span></a>
                  <a href="/LayerEdge/status/1861747243341529383"><time datetime="2024-11-27T12:21:47.000Z">Nov 27</time></a>
                </div>
                <div data-testid="tweetText"><span>Light node is live, thanks </span><a href="/layeredge">@layeredge</a></div>
                <div role="group">
                  <button data-testid="reply" aria-label="12 Replies. Reply"><span>12</span></button>
                  <button data-testid="retweet" aria-label="1.2K reposts. Repost"><span>1.2K</span></button>
                  <button data-testid="like"><span>3,456</span></button>
                </div>
              </article>
            </body></html>
            """;

    private final AtomicInteger closedSessions = new AtomicInteger();
    private Supplier<String> page;
    private PostFetchProperties properties;
    private RenderingSessionPool pool;
    private ScraperPostSourceClient client;

    @BeforeEach
    void setUp() {
        properties = new PostFetchProperties();
        page = () -> POST_PAGE;
        pool = new RenderingSessionPool(() -> new RenderingSession() {
            @Override
            public String navigate(String url, String waitForSelector, Duration timeout) {
                return page.get();
            }

            @Override
            public void close() {
                closedSessions.incrementAndGet();
            }
        }, 1);
        client = new ScraperPostSourceClient(pool, properties, new RequiredMentionPolicy(properties), new MutableClock(NOW));
    }

    @Test
    void fetchExtractsPostFromRenderedPage() {
        NormalizedPostRecord record = client.fetch(REFERENCE).record();

        assertEquals("Light node is live, thanks @layeredge", record.text());
        assertEquals("LayerEdge", record.author().handle());
        assertEquals("LayerEdge", record.author().id());
        assertEquals(12, record.engagement().replies());
        assertEquals(1_200, record.engagement().reshares());
        assertEquals(3_456, record.engagement().likes());
        assertEquals(EngagementAvailability.AUTHORITATIVE, record.engagementAvailability());
        assertEquals(Instant.parse("2024-11-27T12:21:47Z"), record.createdAt());
        assertEquals(PostSource.SCRAPER, record.source());
        assertTrue(record.membershipMatched());
        assertEquals(1, closedSessions.get());
        assertEquals(0, pool.activeSessions());
    }

    @Test
    void missingEngagementButtonsMarkCountsUnavailable() {
        page = () -> """
                <html><body>
                  <article>
                    <a href="/LayerEdge/status/1861747243341529383"><time datetime="2024-11-27T12:21:47.000Z">Nov 27</time></a>
                    <div data-testid="tweetText"><span>gm @layeredge</span></div>
                    <div role="group"><button data-testid="like"><span>5</span></button></div>
                  </article>
                </body></html>
                """;

        NormalizedPostRecord record = client.fetch(REFERENCE).record();

        assertEquals(EngagementAvailability.UNAVAILABLE, record.engagementAvailability());
        assertEquals(EngagementCounts.ZERO, record.engagement());
        assertTrue(record.isDegraded());
        assertEquals("gm @layeredge", record.text());
    }

    @Test
    void fetchReportsUnavailablePageAsNotFound() {
        page = () -> "<html><body><div data-testid=\"error-detail\">Hmm...this page doesn't exist.</div></body></html>";

        SourceFetchException thrown = assertThrows(SourceFetchException.class, () -> client.fetch(REFERENCE));

        assertEquals(FailureKind.NOT_FOUND, thrown.getKind());
        assertEquals(0, pool.activeSessions());
    }

    @Test
    void fetchReportsSensitiveInterstitialAsContentRejected() {
        page = () -> "<html><body><div>Age-restricted adult content. This content might not be appropriate.</div></body></html>";

        SourceFetchException thrown = assertThrows(SourceFetchException.class, () -> client.fetch(REFERENCE));

        assertEquals(FailureKind.CONTENT_REJECTED, thrown.getKind());
    }

    @Test
    void renderTimeoutReleasesSessionAndClassifiesAsTransient() {
        page = () -> {
            throw RenderingException.timeout("waiting for selector timed out");
        };

        RenderingException thrown = assertThrows(RenderingException.class, () -> client.fetch(REFERENCE));

        assertEquals(FailureKind.TRANSIENT, client.classify(thrown).kind());
        assertEquals(1, closedSessions.get());
        assertEquals(0, pool.activeSessions());
    }

    @Test
    void classifyMapsRendererThrottlingAndPoolExhaustion() {
        assertEquals(FailureKind.RATE_LIMITED,
                client.classify(RenderingException.status(429, "Too Many Requests")).kind());
        assertEquals(FailureKind.TRANSIENT,
                client.classify(RenderingException.status(502, "Bad Gateway")).kind());
        assertEquals(FailureKind.TRANSIENT,
                client.classify(new SessionPoolExhaustedException("busy")).kind());
    }

    @Test
    void fetchFailsTransientlyWhenPoolIsBusy() {
        properties.getScraper().setSessionAcquireTimeoutMs(10);
        RenderingSession held = pool.acquire(Duration.ofMillis(10));
        try {
            SessionPoolExhaustedException thrown =
                    assertThrows(SessionPoolExhaustedException.class, () -> client.fetch(REFERENCE));
            assertEquals(FailureKind.TRANSIENT, client.classify(thrown).kind());
        } finally {
            held.close();
        }
    }
}
