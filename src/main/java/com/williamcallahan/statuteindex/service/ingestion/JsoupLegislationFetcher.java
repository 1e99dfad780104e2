package com.williamcallahan.statuteindex.service.ingestion;

import com.williamcallahan.statuteindex.config.AppProperties;
import com.williamcallahan.statuteindex.domain.ingestion.FetchResult;
import com.williamcallahan.statuteindex.support.RetrySupport;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Rate-limited HTTP client for legislation feeds and document markup.
 *
 * <p>Requests are spaced at least {@code app.legislation.min-request-delay} apart. HTTP 429 and
 * 5xx responses are retried with exponential backoff starting at two seconds; the final response
 * is returned whatever its status. I/O failures that persist through every attempt surface as
 * {@link LegislationFetchException}.</p>
 */
@Component
public class JsoupLegislationFetcher implements LegislationFetcher {
    private static final Logger log = LoggerFactory.getLogger(JsoupLegislationFetcher.class);

    private static final String ACCEPT_HEADER = "application/xml, application/atom+xml, text/xml, */*";
    private static final Duration INITIAL_BACKOFF = Duration.ofSeconds(2);
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final int HTTP_SERVER_ERROR = 500;

    private final AppProperties.Legislation settings;
    private final RetrySupport.Sleeper sleeper;
    private final Clock clock;
    private final Object rateLimitLock = new Object();
    private long lastRequestMillis;

    @Autowired
    public JsoupLegislationFetcher(AppProperties appProperties) {
        this(appProperties, RetrySupport.Sleeper.THREAD_SLEEP, Clock.systemUTC());
    }

    JsoupLegislationFetcher(AppProperties appProperties, RetrySupport.Sleeper sleeper, Clock clock) {
        this.settings = appProperties.getLegislation();
        this.sleeper = sleeper;
        this.clock = clock;
    }

    @Override
    public FetchResult fetchFeedPage(int page) {
        if (page < 1) {
            throw new IllegalArgumentException("Feed pages start at 1: " + page);
        }
        return fetch(feedPageUrl(page));
    }

    @Override
    public FetchResult fetchDocumentMarkup(int year, int number) {
        return fetch(documentMarkupUrl(year, number));
    }

    String feedPageUrl(int page) {
        return collectionUrl() + "/data.feed?page=" + page;
    }

    String documentMarkupUrl(int year, int number) {
        return collectionUrl() + "/" + year + "/" + number + "/data.akn";
    }

    /**
     * Fetches a URL with rate limiting and retry.
     */
    FetchResult fetch(String url) {
        try {
            return RetrySupport.executeWithRetry(
                    () -> {
                        awaitRateLimit();
                        return executeRequest(url);
                    },
                    JsoupLegislationFetcher::isRetryableStatus,
                    failure -> failure instanceof UncheckedIOException,
                    "Fetch " + url,
                    Math.max(0, settings.getMaxRetries()) + 1,
                    INITIAL_BACKOFF,
                    sleeper);
        } catch (UncheckedIOException ioFailure) {
            throw new LegislationFetchException(
                    url, "Failed to fetch " + url + " after " + settings.getMaxRetries() + " retries", ioFailure.getCause());
        }
    }

    /**
     * Performs a single HTTP GET; overridden in tests to simulate upstream responses.
     *
     * @throws UncheckedIOException when the request fails at the transport level
     */
    protected FetchResult executeRequest(String url) {
        try {
            Connection.Response response = Jsoup.connect(url)
                    .userAgent(settings.getUserAgent())
                    .header("Accept", ACCEPT_HEADER)
                    .timeout((int) settings.getRequestTimeout().toMillis())
                    .ignoreContentType(true)
                    .ignoreHttpErrors(true)
                    .maxBodySize(0)
                    .execute();
            log.debug("GET {} -> {}", url, response.statusCode());
            return new FetchResult(response.statusCode(), response.body(), response.contentType());
        } catch (IOException transportFailure) {
            throw new UncheckedIOException(transportFailure);
        }
    }

    private void awaitRateLimit() {
        long minDelayMillis = settings.getMinRequestDelay().toMillis();
        synchronized (rateLimitLock) {
            long elapsed = clock.millis() - lastRequestMillis;
            if (elapsed < minDelayMillis) {
                try {
                    sleeper.sleep(Duration.ofMillis(minDelayMillis - elapsed));
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while waiting for rate limit", interrupted);
                }
            }
            lastRequestMillis = clock.millis();
        }
    }

    private String collectionUrl() {
        String baseUrl = settings.getBaseUrl().trim();
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        return baseUrl + "/" + settings.getCollection();
    }

    private static boolean isRetryableStatus(FetchResult result) {
        return result.status() == HTTP_TOO_MANY_REQUESTS || result.status() >= HTTP_SERVER_ERROR;
    }
}
