package com.unit.catalog.fetch;

import com.unit.catalog.metrics.MetricsService;
import com.unit.catalog.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Blocking HTTP client for the external catalog's listing and detail endpoints.
 *
 * <p>Every request carries the configured timeout. Rate limiting (429) waits for the
 * server's {@code Retry-After}, capped; server errors and I/O failures back off with
 * jitter. Both are retried up to {@link FetchConfig#getMaxRetries()} times. Any other
 * non-success status fails immediately and permanently.</p>
 */
public class CatalogFetchClient {
    private static final Logger log = LoggerFactory.getLogger(CatalogFetchClient.class);

    static final String KIND_QUICKLIST = "quicklist";
    static final String KIND_DETAIL = "detail";

    private final FetchConfig config;
    private final HttpClient httpClient;
    private final Sleeper sleeper;
    private final DoubleSupplier random;
    private final MetricsService metricsService;

    public CatalogFetchClient(FetchConfig config) {
        this(config, null, Sleeper.SYSTEM, () -> ThreadLocalRandom.current().nextDouble(), null);
    }

    public CatalogFetchClient(FetchConfig config, MetricsService metricsService) {
        this(config, null, Sleeper.SYSTEM, () -> ThreadLocalRandom.current().nextDouble(), metricsService);
    }

    CatalogFetchClient(FetchConfig config, HttpClient httpClient, Sleeper sleeper, DoubleSupplier random,
                       MetricsService metricsService) {
        this.config = config;
        this.httpClient = httpClient != null ? httpClient : HttpClient.newBuilder()
                .connectTimeout(config.getRequestTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.sleeper = sleeper;
        this.random = random;
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    /**
     * Fetches one listing partition as raw JSON.
     */
    public String fetchQuickList(int unitType, TonnagePartition partition) {
        String url = config.getBaseUrl() + "/Unit/QuickList?Types=" + unitType
                + "&MinTons=" + partition.minTons() + "&MaxTons=" + partition.maxTons();
        return fetchWithRetry(url, KIND_QUICKLIST);
    }

    /**
     * Fetches one unit's detail page as raw HTML.
     */
    public String fetchDetail(int externalId) {
        return fetchWithRetry(config.getBaseUrl() + "/Unit/Details/" + externalId, KIND_DETAIL);
    }

    /**
     * Waits the courtesy delay with jitter. A no-op when the delay is zero.
     */
    public void courtesyPause() {
        if (config.getCourtesyDelay().isZero()) {
            return;
        }
        try {
            sleeper.sleep(jittered(config.getCourtesyDelay()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw FetchException.interrupted("courtesy delay", e);
        }
    }

    String fetchWithRetry(String url, String kind) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(config.getRequestTimeout())
                .header("User-Agent", config.getUserAgent())
                .GET()
                .build();
        int maxRetries = config.getMaxRetries();

        try {
            for (int attempt = 0; ; attempt++) {
                metricsService.incrementFetchRequest(kind);
                Duration wait;
                try {
                    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                    int status = response.statusCode();
                    if (status >= 200 && status < 300) {
                        log.debug("fetch.ok url={} status={} attempt={}", url, status, attempt);
                        return response.body();
                    }
                    if (status != 429 && status < 500) {
                        metricsService.incrementFetchPermanentFailure(kind);
                        log.warn("fetch.failed.permanent url={} status={}", url, status);
                        throw FetchException.permanent(url, status);
                    }
                    if (attempt >= maxRetries) {
                        throw FetchException.retriesExhausted(url, status, maxRetries, null);
                    }
                    if (status == 429) {
                        wait = retryAfter(response);
                        log.warn("fetch.rateLimited url={} retryAfter={} attempt={}", url, wait, attempt);
                    } else {
                        wait = jittered(config.backoffFor(attempt));
                        log.warn("fetch.serverError url={} status={} wait={} attempt={}", url, status, wait, attempt);
                    }
                } catch (IOException e) {
                    if (attempt >= maxRetries) {
                        throw FetchException.retriesExhausted(url, -1, maxRetries, e);
                    }
                    wait = jittered(config.backoffFor(attempt));
                    log.warn("fetch.ioError url={} error={} wait={} attempt={}", url, e.getMessage(), wait, attempt);
                }
                metricsService.incrementFetchRetry(kind);
                sleeper.sleep(wait);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw FetchException.interrupted(url, e);
        }
    }

    private Duration retryAfter(HttpResponse<String> response) {
        Optional<String> header = response.headers().firstValue("Retry-After");
        Duration wait = config.getDefaultRetryAfter();
        if (header.isPresent()) {
            try {
                wait = Duration.ofSeconds(Long.parseLong(header.get().trim()));
            } catch (NumberFormatException e) {
                log.debug("fetch.retryAfter.unparseable value='{}'", header.get());
            }
        }
        return wait.compareTo(config.getMaxRetryAfter()) > 0 ? config.getMaxRetryAfter() : wait;
    }

    Duration jittered(Duration base) {
        double factor = 1 - config.getJitter() + 2 * config.getJitter() * random.getAsDouble();
        return Duration.ofMillis(Math.round(base.toMillis() * factor));
    }
}
