package com.williamcallahan.statuteindex.domain.ingestion;

import com.williamcallahan.statuteindex.domain.legislation.DocumentStub;
import java.util.List;

/**
 * Deduplicated catalog produced by walking the feed.
 *
 * @param documents unique catalog entries, first occurrence wins
 * @param entriesSeen entries read before deduplication
 * @param pagesRead feed pages read
 * @param hitPageLimit whether the walk stopped at the page-count ceiling
 */
public record DiscoveryOutcome(List<DocumentStub> documents, int entriesSeen, int pagesRead, boolean hitPageLimit) {

    public DiscoveryOutcome {
        documents = documents == null ? List.of() : List.copyOf(documents);
    }
}
