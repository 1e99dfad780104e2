package com.williamcallahan.statuteindex.domain.ingestion;

import java.util.List;

/**
 * Drift between the upstream feed and the local catalog.
 *
 * @param entriesChecked number of upstream entries inspected
 * @param pagesChecked number of feed pages read
 * @param updated documents with a newer upstream timestamp
 * @param added documents missing locally
 */
public record UpdateCheckReport(int entriesChecked, int pagesChecked, List<UpdateHit> updated, List<UpdateHit> added) {

    public UpdateCheckReport {
        updated = updated == null ? List.of() : List.copyOf(updated);
        added = added == null ? List.of() : List.copyOf(added);
    }

    public boolean hasChanges() {
        return !updated.isEmpty() || !added.isEmpty();
    }
}
