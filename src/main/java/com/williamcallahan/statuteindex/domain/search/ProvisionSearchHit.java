package com.williamcallahan.statuteindex.domain.search;

import java.util.Objects;

/**
 * One full-text search match.
 *
 * @param documentId owning document identifier
 * @param documentTitle owning document title
 * @param provisionRef provision reference within the document
 * @param section section label
 * @param title provision heading, may be {@code null}
 * @param snippet leading excerpt of the body text
 * @param score match score, higher is better
 */
public record ProvisionSearchHit(
        String documentId,
        String documentTitle,
        String provisionRef,
        String section,
        String title,
        String snippet,
        double score) {

    public ProvisionSearchHit {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(provisionRef, "provisionRef");
        snippet = snippet == null ? "" : snippet;
    }
}
