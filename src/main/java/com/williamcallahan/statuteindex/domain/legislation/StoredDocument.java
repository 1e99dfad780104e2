package com.williamcallahan.statuteindex.domain.legislation;

import java.util.Objects;

/**
 * Document row as held by the provision store.
 *
 * @param id store identifier
 * @param type document type identifier
 * @param title full title, usually ending in the year
 * @param shortName abbreviated name, may be empty
 * @param status lifecycle status
 * @param issuedDate ISO issue date, may be empty
 * @param url canonical URL, may be empty
 */
public record StoredDocument(
        String id, String type, String title, String shortName, DocumentStatus status, String issuedDate, String url) {

    public StoredDocument {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Document id is required");
        }
        Objects.requireNonNull(title, "Document title is required");
        Objects.requireNonNull(status, "Document status is required");
        type = type == null ? ParsedStatute.TYPE_STATUTE : type;
        shortName = shortName == null ? "" : shortName;
        issuedDate = issuedDate == null ? "" : issuedDate;
        url = url == null ? "" : url;
    }

    /**
     * Builds the store row for a freshly parsed statute.
     */
    public static StoredDocument fromStatute(ParsedStatute statute) {
        DocumentStatus status = DocumentStatus.fromIdentifier(statute.status()).orElse(DocumentStatus.IN_FORCE);
        return new StoredDocument(
                statute.id(),
                statute.type(),
                statute.title(),
                statute.shortName(),
                status,
                statute.issuedDate(),
                statute.url());
    }

    public boolean isRepealed() {
        return status == DocumentStatus.REPEALED;
    }
}
