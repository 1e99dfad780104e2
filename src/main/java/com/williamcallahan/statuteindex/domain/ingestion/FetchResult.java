package com.williamcallahan.statuteindex.domain.ingestion;

/**
 * Raw response captured by the legislation fetcher.
 *
 * @param status HTTP status code
 * @param body response body text, empty when none
 * @param contentType response content type, empty when absent
 */
public record FetchResult(int status, String body, String contentType) {
    private static final int HTTP_OK = 200;
    private static final int HTTP_MOVED_PERMANENTLY = 301;
    private static final int HTTP_FOUND = 302;
    private static final int HTTP_NOT_FOUND = 404;

    public FetchResult {
        body = body == null ? "" : body;
        contentType = contentType == null ? "" : contentType;
    }

    public boolean isOk() {
        return status == HTTP_OK;
    }

    /**
     * Returns true for statuses meaning the document has no markup rendition to fetch.
     */
    public boolean isUnavailable() {
        return status == HTTP_NOT_FOUND || status == HTTP_MOVED_PERMANENTLY || status == HTTP_FOUND;
    }
}
