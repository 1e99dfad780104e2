package com.williamcallahan.statuteindex.domain.search;

import java.util.List;
import java.util.Objects;

/**
 * Search results plus the expression that produced them.
 *
 * @param query original free-text query
 * @param expression full-text expression the results came from, empty when nothing was run
 * @param usedFallback whether the looser fallback expression was needed
 * @param results matches in rank order
 */
public record SearchOutcome(String query, String expression, boolean usedFallback, List<ProvisionSearchHit> results) {

    public SearchOutcome {
        Objects.requireNonNull(query, "query");
        expression = expression == null ? "" : expression;
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static SearchOutcome empty(String query) {
        return new SearchOutcome(query == null ? "" : query, "", false, List.of());
    }
}
