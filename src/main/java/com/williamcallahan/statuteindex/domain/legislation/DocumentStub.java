package com.williamcallahan.statuteindex.domain.legislation;

import com.williamcallahan.statuteindex.support.StatuteIdentifiers;
import java.util.Objects;

/**
 * Catalog entry discovered from a legislation feed page, used to schedule content fetches.
 *
 * @param collection collection segment the document belongs to (for example {@code ukpga})
 * @param year enactment year
 * @param number sequence number within the year
 * @param title whitespace-normalized document title
 * @param url canonical document URL
 * @param updated last-updated timestamp as published by the feed (may be empty)
 */
public record DocumentStub(String collection, int year, int number, String title, String url, String updated) {

    public DocumentStub {
        if (collection == null || collection.isBlank()) {
            throw new IllegalArgumentException("Collection is required");
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Document title is required");
        }
        Objects.requireNonNull(url, "Document URL is required");
        updated = updated == null ? "" : updated;
    }

    /**
     * Returns the store identifier for this document, for example {@code ukpga-2018-12}.
     */
    public String documentId() {
        return StatuteIdentifiers.documentId(collection, year, number);
    }

    /**
     * Returns the key used to deduplicate catalog entries across feed pages.
     */
    public String catalogKey() {
        return year + "-" + number;
    }
}
