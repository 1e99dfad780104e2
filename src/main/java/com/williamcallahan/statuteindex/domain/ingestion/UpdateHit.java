package com.williamcallahan.statuteindex.domain.ingestion;

import java.util.Objects;

/**
 * An upstream document that is new or newer than the local copy.
 *
 * @param documentId document identifier
 * @param title upstream title
 * @param remoteUpdated upstream last-updated timestamp
 * @param localUpdated cached last-updated timestamp, or {@code null} for new documents
 */
public record UpdateHit(String documentId, String title, String remoteUpdated, String localUpdated) {

    public UpdateHit {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(title, "title");
        remoteUpdated = remoteUpdated == null ? "" : remoteUpdated;
    }
}
