package com.williamcallahan.statuteindex.web;

import com.williamcallahan.statuteindex.domain.legislation.CurrencyReport;
import com.williamcallahan.statuteindex.domain.legislation.StoredProvision;
import com.williamcallahan.statuteindex.domain.search.FtsQueryVariants;
import com.williamcallahan.statuteindex.domain.search.SearchOutcome;
import com.williamcallahan.statuteindex.service.lookup.LegislationLookupService;
import com.williamcallahan.statuteindex.service.search.LegislationSearchService;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read endpoints over the provision store: keyword search, provision retrieval and currency checks.
 */
@RestController
@RequestMapping("/api/legislation")
public class LegislationController extends BaseController {
    private static final Logger log = LoggerFactory.getLogger(LegislationController.class);

    private final LegislationSearchService searchService;
    private final LegislationLookupService lookupService;

    public LegislationController(
            LegislationSearchService searchService,
            LegislationLookupService lookupService,
            ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.searchService = searchService;
        this.lookupService = lookupService;
    }

    /**
     * Keyword search across provisions.
     *
     * @param query free text, or an explicit expression using quotes, AND, OR, NOT or a trailing *
     * @param documentId restricts results to one document (identifier or title)
     * @param status restricts results to documents with this status
     * @param limit maximum number of results
     */
    @GetMapping("/search")
    public ResponseEntity<SearchOutcome> search(
            @RequestParam(name = "query") String query,
            @RequestParam(name = "documentId", required = false) String documentId,
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "limit", required = false) Integer limit) {
        SearchOutcome outcome = searchService.search(query, documentId, status, limit);
        log.debug("Search '{}' via '{}' returned {} hits", query, outcome.expression(), outcome.results().size());
        return ResponseEntity.ok(outcome);
    }

    @GetMapping("/query-variants")
    public ResponseEntity<FtsQueryVariants> queryVariants(@RequestParam(name = "query") String query) {
        return ResponseEntity.ok(searchService.queryVariants(query));
    }

    /**
     * Retrieves one provision by reference or section number, or every provision of the document.
     */
    @GetMapping("/provision")
    public ResponseEntity<?> provision(
            @RequestParam(name = "documentId") String documentId,
            @RequestParam(name = "section", required = false) String section,
            @RequestParam(name = "provisionRef", required = false) String provisionRef) {
        List<StoredProvision> provisions = lookupService.getProvision(documentId, section, provisionRef);
        if (provisions.isEmpty()) {
            return notFound("No provision found for " + documentId);
        }
        return ResponseEntity.ok(provisions.stream().map(ProvisionView::from).toList());
    }

    @GetMapping("/currency")
    public ResponseEntity<?> currency(
            @RequestParam(name = "documentId") String documentId,
            @RequestParam(name = "provisionRef", required = false) String provisionRef) {
        Optional<CurrencyReport> report = lookupService.checkCurrency(documentId, provisionRef);
        if (report.isEmpty()) {
            return notFound("Document not found: " + documentId);
        }
        return ResponseEntity.ok(CurrencyResponse.from(report.get()));
    }
}
