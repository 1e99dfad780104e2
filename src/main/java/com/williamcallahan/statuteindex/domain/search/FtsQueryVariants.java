package com.williamcallahan.statuteindex.domain.search;

import java.util.Objects;
import java.util.Optional;

/**
 * Full-text search expressions derived from one free-text query.
 *
 * @param primary strict expression tried first
 * @param fallback looser expression tried when the primary finds nothing, or {@code null}
 */
public record FtsQueryVariants(String primary, String fallback) {

    public FtsQueryVariants {
        Objects.requireNonNull(primary, "Primary expression is required");
    }

    /**
     * Creates variants with no fallback expression.
     */
    public static FtsQueryVariants primaryOnly(String primary) {
        return new FtsQueryVariants(primary, null);
    }

    public Optional<String> fallbackExpression() {
        return Optional.ofNullable(fallback);
    }
}
