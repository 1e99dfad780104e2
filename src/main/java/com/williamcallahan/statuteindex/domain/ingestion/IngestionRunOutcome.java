package com.williamcallahan.statuteindex.domain.ingestion;

import java.util.List;

/**
 * Represents the outcome of a content ingestion run so operators can assess partial failures.
 *
 * @param status status indicator ("success" or "partial-success")
 * @param processed number of documents visited, including skipped ones
 * @param skipped documents whose seed already existed
 * @param failed documents that could not be fetched or parsed
 * @param totalProvisions provisions extracted during this run
 * @param failures per-document failures encountered during ingestion
 */
public record IngestionRunOutcome(
        String status, int processed, int skipped, int failed, int totalProvisions, List<IngestionFailure> failures) {
    private static final String STATUS_SUCCESS = "success";
    private static final String STATUS_PARTIAL_SUCCESS = "partial-success";

    public IngestionRunOutcome {
        if (processed < 0 || skipped < 0 || failed < 0 || totalProvisions < 0) {
            throw new IllegalArgumentException("Ingestion counters must be non-negative");
        }
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    /**
     * Creates an outcome whose status reflects whether any document failed.
     */
    public static IngestionRunOutcome of(
            int processed, int skipped, int failed, int totalProvisions, List<IngestionFailure> failures) {
        String status = failed > 0 ? STATUS_PARTIAL_SUCCESS : STATUS_SUCCESS;
        return new IngestionRunOutcome(status, processed, skipped, failed, totalProvisions, failures);
    }
}
