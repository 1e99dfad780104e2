package com.williamcallahan.statuteindex.domain.legislation;

import java.util.List;
import java.util.Objects;

/**
 * Whether a stored statute, and optionally one of its provisions, is currently in force.
 *
 * @param documentId resolved document identifier
 * @param title document title
 * @param type document type identifier
 * @param status lifecycle status
 * @param current false only when the statute has been repealed
 * @param provisionExists whether the requested provision exists; {@code null} when none was requested
 * @param warnings findings such as repeal or a missing provision
 */
public record CurrencyReport(
        String documentId,
        String title,
        String type,
        DocumentStatus status,
        boolean current,
        Boolean provisionExists,
        List<String> warnings) {

    public CurrencyReport {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(status, "status");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
