package com.unit.catalog.fetch;

/**
 * A request to the external catalog that did not produce a usable response.
 *
 * <p>Transient failures (rate limiting, server errors, connection problems) were retried
 * and eventually gave up; a later run may try again. Permanent failures (client errors)
 * are never retried for that resource.</p>
 */
public class FetchException extends RuntimeException {

    private final String resource;
    private final int statusCode;
    private final boolean transientFailure;

    private FetchException(String resource, int statusCode, boolean transientFailure, String message, Throwable cause) {
        super(message, cause);
        this.resource = resource;
        this.statusCode = statusCode;
        this.transientFailure = transientFailure;
    }

    public static FetchException retriesExhausted(String resource, int statusCode, int retries, Throwable cause) {
        String detail = statusCode > 0 ? "HTTP " + statusCode : String.valueOf(cause);
        return new FetchException(resource, statusCode, true,
                "Request to " + resource + " failed after " + retries + " retries: " + detail, cause);
    }

    public static FetchException permanent(String resource, int statusCode) {
        return new FetchException(resource, statusCode, false,
                "Request to " + resource + " failed: HTTP " + statusCode, null);
    }

    public static FetchException interrupted(String resource, InterruptedException cause) {
        return new FetchException(resource, -1, true, "Interrupted while fetching " + resource, cause);
    }

    public String getResource() {
        return resource;
    }

    /**
     * HTTP status of the last response, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
