package com.williamcallahan.statuteindex.service.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.statuteindex.domain.legislation.ParsedStatute;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies document resolution from identifiers, slugs, titles and citation names.
 */
class DocumentResolverTest {

    private DocumentResolver resolver;

    @BeforeEach
    void setUp() {
        InMemoryProvisionStore store = new InMemoryProvisionStore();
        store.save(new ParsedStatute(
                "ukpga-2018-12", "statute", "Data Protection Act 2018", "DPA 2018", "in_force", "", "", List.of()));
        store.save(new ParsedStatute(
                "data-protection-act-1998", "statute", "Data Protection Act 1998", "DPA 1998", "repealed", "", "", List.of()));
        store.save(new ParsedStatute(
                "ukpga-2010-15", "statute", "Equality Act 2010", "Equality Act 2010", "in_force", "", "", List.of()));
        resolver = new DocumentResolver(store);
    }

    @Test
    void resolve_exactIdentifierIgnoringCase() {
        assertEquals("ukpga-2018-12", resolver.resolve("UKPGA-2018-12").orElseThrow().id());
    }

    @Test
    void resolve_titleBecomesSlugCandidate() {
        assertEquals("data-protection-act-1998", resolver.resolve("Data Protection Act 1998").orElseThrow().id());
    }

    @Test
    void resolve_fallsBackToTitleContainment() {
        assertEquals("ukpga-2010-15", resolver.resolve("equality").orElseThrow().id());
        assertTrue(resolver.resolve("Finance Act").isEmpty());
        assertTrue(resolver.resolve(" ").isEmpty());
    }

    @Test
    void resolveCitation_requiresYearAfterTitle() {
        assertEquals("ukpga-2018-12", resolver.resolveCitation("Data Protection Act", 2018).orElseThrow().id());
        assertEquals("data-protection-act-1998", resolver.resolveCitation("Data Protection Act", 1998).orElseThrow().id());
        assertTrue(resolver.resolveCitation("Data Protection Act", 2010).isEmpty());
    }

    @Test
    void resolveCitation_matchesShortName() {
        assertEquals("ukpga-2018-12", resolver.resolveCitation("dpa", 2018).orElseThrow().id());
        assertTrue(resolver.resolveCitation(null, 2018).isEmpty());
    }
}
