package com.williamcallahan.statuteindex.service.ingestion;

/**
 * Signals that an upstream legislation request failed after retries were exhausted.
 */
public class LegislationFetchException extends RuntimeException {

    private final String url;

    public LegislationFetchException(String message) {
        this(null, message, null);
    }

    public LegislationFetchException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    /**
     * Returns the requested URL, or null when the failure is not tied to one request.
     */
    public String getUrl() {
        return url;
    }
}
