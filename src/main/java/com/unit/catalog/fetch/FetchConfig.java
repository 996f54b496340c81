package com.unit.catalog.fetch;

import java.time.Duration;
import java.util.List;

/**
 * Settings for talking to the external catalog.
 */
public class FetchConfig {

    public static final String DEFAULT_BASE_URL = "https://masterunitlist.azurewebsites.net";
    static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) "
                    + "Chrome/131.0.0.0 Safari/537.36";

    private final String baseUrl;
    private final String userAgent;
    private final Duration requestTimeout;
    private final Duration courtesyDelay;
    private final int maxRetries;
    private final List<Duration> backoff;
    private final Duration defaultRetryAfter;
    private final Duration maxRetryAfter;
    private final double jitter;
    private final List<Integer> unitTypes;
    private final List<TonnagePartition> partitions;

    private FetchConfig(Builder builder) {
        this.baseUrl = stripTrailingSlash(builder.baseUrl);
        this.userAgent = builder.userAgent;
        this.requestTimeout = builder.requestTimeout;
        this.courtesyDelay = builder.courtesyDelay;
        this.maxRetries = builder.maxRetries;
        this.backoff = List.copyOf(builder.backoff);
        this.defaultRetryAfter = builder.defaultRetryAfter;
        this.maxRetryAfter = builder.maxRetryAfter;
        this.jitter = builder.jitter;
        this.unitTypes = List.copyOf(builder.unitTypes);
        this.partitions = List.copyOf(builder.partitions);
    }

    public static FetchConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    /**
     * Pause between successful requests. Politeness only; zero disables it.
     */
    public Duration getCourtesyDelay() {
        return courtesyDelay;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * Wait before retry {@code attempt} (0-based). The last entry repeats for later attempts.
     */
    public Duration backoffFor(int attempt) {
        return backoff.get(Math.min(attempt, backoff.size() - 1));
    }

    public Duration getDefaultRetryAfter() {
        return defaultRetryAfter;
    }

    public Duration getMaxRetryAfter() {
        return maxRetryAfter;
    }

    /**
     * Relative jitter applied to the courtesy delay and to backoff waits, 0.3 meaning ±30%.
     */
    public double getJitter() {
        return jitter;
    }

    /**
     * External catalog unit type ids whose listings are fetched.
     */
    public List<Integer> getUnitTypes() {
        return unitTypes;
    }

    public List<TonnagePartition> getPartitions() {
        return partitions;
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url;
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    @Override
    public String toString() {
        return "FetchConfig{baseUrl=" + baseUrl + ", timeout=" + requestTimeout + ", delay=" + courtesyDelay
                + ", maxRetries=" + maxRetries + ", types=" + unitTypes + ", partitions=" + partitions.size() + '}';
    }

    public static class Builder {
        private String baseUrl = DEFAULT_BASE_URL;
        private String userAgent = DEFAULT_USER_AGENT;
        private Duration requestTimeout = Duration.ofSeconds(30);
        private Duration courtesyDelay = Duration.ofMillis(1000);
        private int maxRetries = 3;
        private List<Duration> backoff = List.of(Duration.ofSeconds(2), Duration.ofSeconds(5), Duration.ofSeconds(15));
        private Duration defaultRetryAfter = Duration.ofSeconds(5);
        private Duration maxRetryAfter = Duration.ofSeconds(60);
        private double jitter = 0.3;
        private List<Integer> unitTypes = List.of(18);
        private List<TonnagePartition> partitions = TonnagePartition.DEFAULTS;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder courtesyDelay(Duration courtesyDelay) {
            this.courtesyDelay = courtesyDelay;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder backoff(List<Duration> backoff) {
            this.backoff = backoff;
            return this;
        }

        public Builder defaultRetryAfter(Duration defaultRetryAfter) {
            this.defaultRetryAfter = defaultRetryAfter;
            return this;
        }

        public Builder maxRetryAfter(Duration maxRetryAfter) {
            this.maxRetryAfter = maxRetryAfter;
            return this;
        }

        public Builder jitter(double jitter) {
            this.jitter = jitter;
            return this;
        }

        public Builder unitTypes(List<Integer> unitTypes) {
            this.unitTypes = unitTypes;
            return this;
        }

        public Builder partitions(List<TonnagePartition> partitions) {
            this.partitions = partitions;
            return this;
        }

        public FetchConfig build() {
            if (baseUrl == null || baseUrl.isBlank()) {
                throw new IllegalArgumentException("baseUrl must not be blank");
            }
            if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
                throw new IllegalArgumentException("requestTimeout must be positive");
            }
            if (courtesyDelay == null || courtesyDelay.isNegative()) {
                throw new IllegalArgumentException("courtesyDelay must not be negative");
            }
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must be >= 0");
            }
            if (backoff == null || backoff.isEmpty()) {
                throw new IllegalArgumentException("backoff must contain at least one duration");
            }
            if (jitter < 0 || jitter >= 1) {
                throw new IllegalArgumentException("jitter must be in [0, 1)");
            }
            if (unitTypes == null || unitTypes.isEmpty()) {
                throw new IllegalArgumentException("at least one unit type is required");
            }
            if (partitions == null || partitions.isEmpty()) {
                throw new IllegalArgumentException("at least one tonnage partition is required");
            }
            return new FetchConfig(this);
        }
    }
}
