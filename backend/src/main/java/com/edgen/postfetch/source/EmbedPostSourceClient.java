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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

/**
 * Public embed widget source. Anonymous and cheap, but carries no engagement counts:
 * records from here are always {@link EngagementAvailability#UNAVAILABLE}.
 */
@Component
public class EmbedPostSourceClient implements PostSourceClient {

    private static final Logger log = LoggerFactory.getLogger(EmbedPostSourceClient.class);
    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder().build();
    private static final DateTimeFormatter EMBED_DATE = DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH);

    private final RestClient embedRestClient;
    private final PostFetchProperties properties;
    private final RequiredMentionPolicy mentionPolicy;
    private final Clock clock;

    public EmbedPostSourceClient(
            @Qualifier("embedRestClient") RestClient embedRestClient,
            PostFetchProperties properties,
            RequiredMentionPolicy mentionPolicy,
            Clock clock) {
        this.embedRestClient = embedRestClient;
        this.properties = properties;
        this.mentionPolicy = mentionPolicy;
        this.clock = clock;
    }

    @Override
    public PostSource source() {
        return PostSource.EMBED;
    }

    @Override
    public boolean isEnabled() {
        return properties.getEmbed().isEnabled();
    }

    @Override
    public SourceFetchResult fetch(PostReference reference) {
        URI uri = UriComponentsBuilder.fromUriString(properties.getEmbed().getEndpoint())
                .queryParam("url", reference.canonicalUrl())
                .queryParam("omit_script", "true")
                .queryParam("dnt", "true")
                .encode()
                .build()
                .toUri();

        return embedRestClient.get()
                .uri(uri)
                .accept(MediaType.APPLICATION_JSON)
                .exchange((request, response) -> {
                    int status = response.getStatusCode().value();
                    if (status == 404 || status == 403 || status == 400 || status == 410) {
                        // The widget answers these for deleted, protected and suspended posts alike.
                        throw SourceFetchException.notFound(PostSource.EMBED, "HTTP " + status + " from embed endpoint");
                    }
                    if (status == 429) {
                        throw SourceFetchException.of(PostSource.EMBED, FailureKind.RATE_LIMITED, "HTTP 429 rate limited");
                    }
                    if (!response.getStatusCode().is2xxSuccessful()) {
                        throw SourceFetchException.of(PostSource.EMBED, FailureKind.TRANSIENT, "HTTP " + status);
                    }
                    String body = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
                    return SourceFetchResult.of(toRecord(reference, body));
                });
    }

    @Override
    public SourceFailure classify(Throwable error) {
        return SourceFailures.classify(PostSource.EMBED, error);
    }

    private NormalizedPostRecord toRecord(PostReference reference, String body) {
        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(body);
        } catch (JsonProcessingException ex) {
            throw SourceFetchException.transientFailure(PostSource.EMBED, "Embed response was not JSON", ex);
        }
        if (root == null || !root.hasNonNull("html")) {
            throw SourceFetchException.of(PostSource.EMBED, FailureKind.TRANSIENT, "Embed response had no markup");
        }

        Document markup = Jsoup.parseBodyFragment(root.path("html").asText());
        Element paragraph = markup.selectFirst("blockquote p");
        if (paragraph == null) {
            throw SourceFetchException.of(PostSource.EMBED, FailureKind.TRANSIENT, "Embed markup had no post text");
        }
        String text = paragraph.wholeText().trim();

        String handle = handleFromAuthorUrl(root.path("author_url").asText(null)).orElse(reference.authorHandle());
        String displayName = root.path("author_name").asText(handle);
        Instant createdAt = reference.snowflakeTimestamp()
                .or(() -> dateFromMarkup(markup))
                .orElseThrow(() -> SourceFetchException.of(PostSource.EMBED, FailureKind.TRANSIENT,
                        "Creation time unavailable from embed"));

        return new NormalizedPostRecord(
                reference.postId(),
                "https://x.com/" + handle + "/status/" + reference.postId(),
                text,
                new PostAuthor(handle, handle, displayName),
                EngagementCounts.ZERO,
                EngagementAvailability.UNAVAILABLE,
                createdAt,
                PostSource.EMBED,
                mentionPolicy.matches(text),
                clock.instant()
        );
    }

    static Optional<String> handleFromAuthorUrl(String authorUrl) {
        if (!StringUtils.hasText(authorUrl)) {
            return Optional.empty();
        }
        String trimmed = authorUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        int slash = trimmed.lastIndexOf('/');
        String handle = slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
        return handle.matches("[A-Za-z0-9_]{1,15}") ? Optional.of(handle) : Optional.empty();
    }

    private static Optional<Instant> dateFromMarkup(Document markup) {
        Element dateLink = markup.selectFirst("blockquote > a[href*=/status/]");
        if (dateLink == null) {
            return Optional.empty();
        }
        try {
            LocalDate date = LocalDate.parse(dateLink.text().trim(), EMBED_DATE);
            return Optional.of(date.atStartOfDay(ZoneOffset.UTC).toInstant());
        } catch (DateTimeParseException ex) {
            log.debug("Unparseable embed date '{}'", dateLink.text());
            return Optional.empty();
        }
    }
}
