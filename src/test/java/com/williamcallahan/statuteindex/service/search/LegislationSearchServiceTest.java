package com.williamcallahan.statuteindex.service.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.statuteindex.config.AppProperties;
import com.williamcallahan.statuteindex.domain.legislation.ParsedStatute;
import com.williamcallahan.statuteindex.domain.legislation.ProvisionRecord;
import com.williamcallahan.statuteindex.domain.search.SearchOutcome;
import com.williamcallahan.statuteindex.service.store.InMemoryProvisionStore;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies strict-then-loose search over the provision store.
 */
class LegislationSearchServiceTest {

    private LegislationSearchService searchService;

    @BeforeEach
    void setUp() {
        InMemoryProvisionStore store = new InMemoryProvisionStore();
        store.save(new ParsedStatute("ukpga-2018-12", "statute", "Data Protection Act 2018", "DPA 2018", "in_force",
                "", "", List.of(
                        new ProvisionRecord("s1", "1", "Overview", "This Act makes provision about the processing of personal data."),
                        new ProvisionRecord("s2", "2", null, "Data protection principles apply."))));
        store.save(new ParsedStatute("ukpga-1998-29", "statute", "Data Protection Act 1998", "DPA 1998", "repealed",
                "", "", List.of(new ProvisionRecord("s1", "1", null, "Personal data relating to individuals."))));

        AppProperties appProperties = new AppProperties();
        appProperties.getSearch().setDefaultLimit(10);
        appProperties.getSearch().setMaxLimit(2);
        searchService = new LegislationSearchService(store, new FtsQueryBuilder(), appProperties);
    }

    @Test
    void search_usesStrictExpressionWhenItMatches() {
        SearchOutcome outcome = searchService.search("data protection", null, null, null);

        assertFalse(outcome.usedFallback());
        assertEquals("\"data\"* \"protection\"*", outcome.expression());
        assertEquals(1, outcome.results().size());
        assertEquals("s2", outcome.results().get(0).provisionRef());
    }

    @Test
    void search_fallsBackToLooseExpressionWhenStrictFindsNothing() {
        SearchOutcome outcome = searchService.search("processing individuals", null, null, null);

        assertTrue(outcome.usedFallback());
        assertEquals("processing* OR individuals*", outcome.expression());
        assertEquals(2, outcome.results().size());
    }

    @Test
    void search_appliesDocumentAndStatusFilters() {
        SearchOutcome byTitle = searchService.search("personal", "Data Protection Act 1998", null, null);
        assertEquals(1, byTitle.results().size());
        assertEquals("ukpga-1998-29", byTitle.results().get(0).documentId());

        SearchOutcome inForce = searchService.search("personal", null, "in_force", null);
        assertTrue(inForce.results().stream().allMatch(hit -> hit.documentId().equals("ukpga-2018-12")));
    }

    @Test
    void search_unknownDocumentFilterFindsNothing() {
        assertTrue(searchService.search("data", "Finance Act 2021", null, null).results().isEmpty());
    }

    @Test
    void search_blankQueryFindsNothing() {
        SearchOutcome outcome = searchService.search("  ", null, null, null);

        assertTrue(outcome.results().isEmpty());
        assertEquals("", outcome.expression());
    }

    @Test
    void search_unknownStatusIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> searchService.search("data", null, "revoked", null));
    }

    @Test
    void clampLimit_keepsLimitWithinConfiguredBounds() {
        assertEquals(2, searchService.clampLimit(null));
        assertEquals(2, searchService.clampLimit(500));
        assertEquals(1, searchService.clampLimit(0));
        assertEquals(1, searchService.clampLimit(-3));
    }
}
