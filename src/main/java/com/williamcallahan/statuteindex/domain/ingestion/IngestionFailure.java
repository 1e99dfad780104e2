package com.williamcallahan.statuteindex.domain.ingestion;

import java.util.Objects;

/**
 * Captures a single document ingestion failure with document and phase context so triage is faster.
 *
 * @param documentId document identifier, for example {@code ukpga-2018-12}
 * @param phase ingestion phase that failed ({@code fetch}, {@code parse} or {@code write})
 * @param details failure details for diagnostics
 */
public record IngestionFailure(String documentId, String phase, String details) {
    public static final String PHASE_FETCH = "fetch";
    public static final String PHASE_PARSE = "parse";
    public static final String PHASE_WRITE = "write";

    public IngestionFailure {
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("Document id is required");
        }
        if (phase == null || phase.isBlank()) {
            throw new IllegalArgumentException("Failure phase is required");
        }
        Objects.requireNonNull(details, "Failure details are required");
    }
}
