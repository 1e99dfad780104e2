package com.williamcallahan.statuteindex.service.search;

import com.williamcallahan.statuteindex.config.AppProperties;
import com.williamcallahan.statuteindex.domain.legislation.DocumentStatus;
import com.williamcallahan.statuteindex.domain.legislation.StoredDocument;
import com.williamcallahan.statuteindex.domain.search.FtsQueryVariants;
import com.williamcallahan.statuteindex.domain.search.ProvisionSearchHit;
import com.williamcallahan.statuteindex.domain.search.SearchOutcome;
import com.williamcallahan.statuteindex.service.store.DocumentResolver;
import com.williamcallahan.statuteindex.service.store.ProvisionStore;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Keyword search over stored provisions: the strict expression first, the loose fallback only
 * when the strict one finds nothing.
 */
@Service
public class LegislationSearchService {
    private static final Logger log = LoggerFactory.getLogger(LegislationSearchService.class);

    private final ProvisionStore store;
    private final DocumentResolver resolver;
    private final FtsQueryBuilder queryBuilder;
    private final AppProperties.Search searchSettings;

    public LegislationSearchService(ProvisionStore store, FtsQueryBuilder queryBuilder, AppProperties appProperties) {
        this.store = Objects.requireNonNull(store, "Provision store is required");
        this.resolver = new DocumentResolver(store);
        this.queryBuilder = Objects.requireNonNull(queryBuilder, "queryBuilder");
        this.searchSettings = appProperties.getSearch();
    }

    /**
     * Searches provisions.
     *
     * @param query free-text or expression query
     * @param documentFilter identifier or title restricting the search to one document (optional)
     * @param statusFilter status identifier such as {@code in_force} (optional)
     * @param requestedLimit maximum results (optional; clamped to the configured bounds)
     * @return ranked hits with the expression that produced them
     * @throws IllegalArgumentException when the status filter names no known status
     */
    public SearchOutcome search(String query, String documentFilter, String statusFilter, Integer requestedLimit) {
        if (query == null || query.isBlank()) {
            return SearchOutcome.empty(query);
        }
        DocumentStatus status = parseStatus(statusFilter);
        String documentId = null;
        if (documentFilter != null && !documentFilter.isBlank()) {
            Optional<StoredDocument> document = resolver.resolve(documentFilter);
            if (document.isEmpty()) {
                log.debug("Search filter names unknown document {}", documentFilter);
                return SearchOutcome.empty(query);
            }
            documentId = document.get().id();
        }
        int limit = clampLimit(requestedLimit);

        FtsQueryVariants variants = queryBuilder.build(query);
        List<ProvisionSearchHit> primaryHits = store.search(variants.primary(), documentId, status, limit);
        if (!primaryHits.isEmpty() || variants.fallbackExpression().isEmpty()) {
            return new SearchOutcome(query, variants.primary(), false, primaryHits);
        }
        String fallback = variants.fallback();
        List<ProvisionSearchHit> fallbackHits = store.search(fallback, documentId, status, limit);
        return new SearchOutcome(query, fallback, true, fallbackHits);
    }

    /**
     * Returns the expressions a query normalizes to, for diagnostics.
     */
    public FtsQueryVariants queryVariants(String query) {
        return queryBuilder.build(query);
    }

    int clampLimit(Integer requestedLimit) {
        int maxLimit = Math.max(1, searchSettings.getMaxLimit());
        int limit = requestedLimit == null ? searchSettings.getDefaultLimit() : requestedLimit;
        return Math.max(1, Math.min(limit, maxLimit));
    }

    private static DocumentStatus parseStatus(String statusFilter) {
        if (statusFilter == null || statusFilter.isBlank()) {
            return null;
        }
        return DocumentStatus.fromIdentifier(statusFilter)
                .orElseThrow(() -> new IllegalArgumentException("Unknown document status: " + statusFilter));
    }
}
