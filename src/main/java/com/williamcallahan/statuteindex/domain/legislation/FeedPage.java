package com.williamcallahan.statuteindex.domain.legislation;

import java.util.List;
import java.util.OptionalInt;

/**
 * One parsed page of the legislation entry feed.
 *
 * <p>A page with no entries never reports a next page, regardless of any stale
 * next-link in the source document.</p>
 *
 * @param entries catalog entries in feed order
 * @param hasNextPage whether the feed advertises another page
 * @param totalResults total-count hint published by the feed, or {@code null}
 */
public record FeedPage(List<DocumentStub> entries, boolean hasNextPage, Integer totalResults) {

    public FeedPage {
        entries = entries == null ? List.of() : List.copyOf(entries);
        if (entries.isEmpty()) {
            hasNextPage = false;
        }
    }

    /**
     * Returns the total-count hint when the feed published one.
     */
    public OptionalInt totalResultsHint() {
        return totalResults == null ? OptionalInt.empty() : OptionalInt.of(totalResults);
    }
}
