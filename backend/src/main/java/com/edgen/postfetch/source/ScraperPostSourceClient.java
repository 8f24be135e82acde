package com.edgen.postfetch.source;

import com.edgen.postfetch.config.PostFetchProperties;
import com.edgen.postfetch.model.EngagementAvailability;
import com.edgen.postfetch.model.EngagementCounts;
import com.edgen.postfetch.model.FailureKind;
import com.edgen.postfetch.model.NormalizedPostRecord;
import com.edgen.postfetch.model.PostAuthor;
import com.edgen.postfetch.model.PostReference;
import com.edgen.postfetch.model.PostSource;
import com.edgen.postfetch.model.SourceFailure;
import com.edgen.postfetch.model.SourceFetchException;
import com.edgen.postfetch.model.SourceFetchResult;
import com.edgen.postfetch.source.render.RenderingException;
import com.edgen.postfetch.source.render.RenderingSession;
import com.edgen.postfetch.source.render.RenderingSessionPool;
import com.edgen.postfetch.source.render.SessionPoolExhaustedException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.OptionalLong;

/**
 * Renders the public post page in a headless browser and reads it with structural
 * selectors. Slowest source; the pool bounds how many pages render at once.
 */
@Component
public class ScraperPostSourceClient implements PostSourceClient {

    private static final Logger log = LoggerFactory.getLogger(ScraperPostSourceClient.class);

    private static final List<String> UNAVAILABLE_PHRASES = List.of(
            "this page doesn't exist",
            "this page doesn’t exist",
            "this post is unavailable",
            "this post was deleted",
            "account suspended",
            "these posts are protected"
    );
    private static final List<String> REJECTED_PHRASES = List.of(
            "age-restricted adult content",
            "potentially sensitive content",
            "caution: this account is temporarily restricted"
    );

    private final RenderingSessionPool sessionPool;
    private final PostFetchProperties properties;
    private final RequiredMentionPolicy mentionPolicy;
    private final Clock clock;

    public ScraperPostSourceClient(
            RenderingSessionPool sessionPool,
            PostFetchProperties properties,
            RequiredMentionPolicy mentionPolicy,
            Clock clock) {
        this.sessionPool = sessionPool;
        this.properties = properties;
        this.mentionPolicy = mentionPolicy;
        this.clock = clock;
    }

    @Override
    public PostSource source() {
        return PostSource.SCRAPER;
    }

    @Override
    public boolean isEnabled() {
        return properties.getScraper().isEnabled();
    }

    @Override
    public SourceFetchResult fetch(PostReference reference) {
        PostFetchProperties.Scraper scraper = properties.getScraper();
        String waitFor = scraper.getContentSelector() + ", " + scraper.getUnavailableSelector();
        String html;
        try (RenderingSession session = sessionPool.acquire(Duration.ofMillis(scraper.getSessionAcquireTimeoutMs()))) {
            html = session.navigate(reference.canonicalUrl(), waitFor, Duration.ofMillis(scraper.getPageLoadTimeoutMs()));
        }
        return SourceFetchResult.of(parse(reference, Jsoup.parse(html, reference.canonicalUrl())));
    }

    @Override
    public SourceFailure classify(Throwable error) {
        if (error instanceof SessionPoolExhaustedException) {
            return SourceFailure.of(PostSource.SCRAPER, FailureKind.TRANSIENT, error.getMessage());
        }
        if (error instanceof RenderingException) {
            RenderingException rendering = (RenderingException) error;
            if (rendering.isTimeout()) {
                return SourceFailure.of(PostSource.SCRAPER, FailureKind.TRANSIENT, "Content marker did not appear in time");
            }
            if (rendering.getStatus() == 429) {
                return SourceFailure.of(PostSource.SCRAPER, FailureKind.RATE_LIMITED, "Renderer rate limited");
            }
            return SourceFailure.of(PostSource.SCRAPER, FailureKind.TRANSIENT, SourceFailures.safeMessage(rendering));
        }
        return SourceFailures.classify(PostSource.SCRAPER, error);
    }

    NormalizedPostRecord parse(PostReference reference, Document page) {
        PostFetchProperties.Scraper scraper = properties.getScraper();
        String pageText = page.text().toLowerCase(Locale.ROOT);

        Element article = findArticle(page, reference.postId());
        Element textElement = article == null ? null : article.selectFirst("[data-testid=tweetText]");

        if (textElement == null) {
            if (!page.select(scraper.getUnavailableSelector()).isEmpty() || containsAny(pageText, UNAVAILABLE_PHRASES)) {
                throw SourceFetchException.notFound(PostSource.SCRAPER, "Post page reports the post is unavailable");
            }
            if (containsAny(pageText, REJECTED_PHRASES)) {
                throw SourceFetchException.contentRejected(PostSource.SCRAPER, "Post is behind a sensitive-content interstitial");
            }
            throw SourceFetchException.of(PostSource.SCRAPER, FailureKind.TRANSIENT, "Post content marker missing from page");
        }

        String text = textElement.wholeText().trim();
        PostAuthor author = parseAuthor(article, reference);
        OptionalLong likes = count(article, "like");
        OptionalLong reshares = count(article, "retweet");
        OptionalLong replies = count(article, "reply");
        boolean countsComplete = likes.isPresent() && reshares.isPresent() && replies.isPresent();
        if (!countsComplete) {
            log.debug("Engagement buttons missing on post {}; counts unavailable", reference.postId());
        }
        EngagementCounts engagement = countsComplete
                ? new EngagementCounts(likes.getAsLong(), reshares.getAsLong(), replies.getAsLong())
                : EngagementCounts.ZERO;

        return new NormalizedPostRecord(
                reference.postId(),
                "https://x.com/" + author.handle() + "/status/" + reference.postId(),
                text,
                author,
                engagement,
                countsComplete ? EngagementAvailability.AUTHORITATIVE : EngagementAvailability.UNAVAILABLE,
                parseCreatedAt(article, reference),
                PostSource.SCRAPER,
                mentionPolicy.matches(text),
                clock.instant()
        );
    }

    private static Element findArticle(Document page, String postId) {
        for (Element article : page.select("article")) {
            if (article.selectFirst("a[href*=/status/" + postId + "]") != null) {
                return article;
            }
        }
        return page.selectFirst("article");
    }

    private static PostAuthor parseAuthor(Element article, PostReference reference) {
        Element userName = article.selectFirst("[data-testid=User-Name]");
        String handle = reference.authorHandle();
        String displayName = null;
        if (userName != null) {
            for (Element span : userName.select("span")) {
                String value = span.ownText().trim();
                if (value.isEmpty()) {
                    continue;
                }
                if (value.startsWith("@")) {
                    handle = value.substring(1);
                } else if (displayName == null) {
                    displayName = value;
                }
            }
        }
        // The rendered page exposes no numeric account id.
        return new PostAuthor(handle, handle, displayName);
    }

    private static Instant parseCreatedAt(Element article, PostReference reference) {
        Element time = article.selectFirst("time[datetime]");
        if (time != null) {
            try {
                return Instant.parse(time.attr("datetime"));
            } catch (DateTimeParseException ex) {
                log.debug("Unparseable datetime '{}' on post {}", time.attr("datetime"), reference.postId());
            }
        }
        return reference.snowflakeTimestamp().orElseThrow(() -> SourceFetchException.of(
                PostSource.SCRAPER, FailureKind.TRANSIENT, "Creation time missing from page"));
    }

    private static OptionalLong count(Element article, String testId) {
        Element button = article.selectFirst("[data-testid=" + testId + "], [data-testid=un" + testId + "]");
        if (button == null) {
            return OptionalLong.empty();
        }
        String label = button.attr("aria-label");
        if (StringUtils.hasText(label)) {
            return OptionalLong.of(EngagementCountParser.parse(label));
        }
        return OptionalLong.of(EngagementCountParser.parse(button.text()));
    }

    private static boolean containsAny(String text, List<String> phrases) {
        for (String phrase : phrases) {
            if (text.contains(phrase)) {
                return true;
            }
        }
        return false;
    }
}
