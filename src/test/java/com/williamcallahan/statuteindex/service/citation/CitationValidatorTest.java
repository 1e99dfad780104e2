package com.williamcallahan.statuteindex.service.citation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.statuteindex.domain.citation.ParsedCitation;
import com.williamcallahan.statuteindex.domain.citation.ValidationResult;
import com.williamcallahan.statuteindex.domain.legislation.ParsedStatute;
import com.williamcallahan.statuteindex.domain.legislation.ProvisionRecord;
import com.williamcallahan.statuteindex.service.store.InMemoryProvisionStore;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies citations are checked against stored documents and sections.
 */
class CitationValidatorTest {

    private final CitationParser parser = new CitationParser();
    private InMemoryProvisionStore store;
    private CitationValidator validator;

    @BeforeEach
    void setUp() {
        store = new InMemoryProvisionStore();
        store.save(new ParsedStatute(
                "ukpga-2018-12", "statute", "Data Protection Act 2018", "DPA 2018", "in_force", "2018-05-23", "",
                List.of(
                        new ProvisionRecord("s3", "3", "Terms relating to processing", "In this Act..."),
                        new ProvisionRecord("s3(1)", "3(1)", "Terms relating to processing", "Subsection text."))));
        store.save(new ParsedStatute(
                "ukpga-1998-29", "statute", "Data Protection Act 1998", "DPA 1998", "repealed", "1998-07-16", "",
                List.of(new ProvisionRecord("s1", "1", "Basic interpretative provisions", "In this Act..."))));
        validator = new CitationValidator(store);
    }

    @Test
    void validate_existingDocumentAndSection() {
        ValidationResult result = validator.validate(parser.parse("Section 3, Data Protection Act 2018"));

        assertTrue(result.documentExists());
        assertTrue(result.provisionExists());
        assertEquals("Data Protection Act 2018", result.documentTitle());
        assertEquals("in_force", result.status());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void validate_resolvesAbbreviationThroughShortName() {
        ValidationResult result = validator.validate(parser.parse("s. 3 DPA 2018"));

        assertTrue(result.documentExists());
        assertEquals("Data Protection Act 2018", result.documentTitle());
    }

    @Test
    void validate_distinguishesDocumentsByYear() {
        ValidationResult result = validator.validate(parser.parse("Section 1, Data Protection Act 1998"));

        assertTrue(result.documentExists());
        assertEquals("repealed", result.status());
        assertEquals(List.of("This statute has been repealed"), result.warnings());
    }

    @Test
    void validate_missingSectionIsAWarningNotAFailure() {
        ValidationResult result = validator.validate(parser.parse("Section 99, Data Protection Act 2018"));

        assertTrue(result.documentExists());
        assertFalse(result.provisionExists());
        assertEquals(List.of("Section 99 not found in Data Protection Act 2018"), result.warnings());
    }

    @Test
    void validate_findsSectionLabelledByItsReference() {
        store.save(new ParsedStatute(
                "ukpga-2010-15", "statute", "Equality Act 2010", "", "in_force", "2010-10-01", "",
                List.of(new ProvisionRecord("s3", "s3", "Terms", "Defined terms."))));

        ValidationResult result = validator.validate(parser.parse("Section 3, Equality Act 2010"));

        assertTrue(result.documentExists());
        assertTrue(result.provisionExists());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void validate_unknownDocument() {
        ValidationResult result = validator.validate(parser.parse("Section 1, Equality Act 2010"));

        assertFalse(result.documentExists());
        assertFalse(result.provisionExists());
        assertNull(result.documentTitle());
        assertEquals(List.of("Document \"Equality Act 2010\" not found"), result.warnings());
    }

    @Test
    void validate_barePinpointNamesNoDocument() {
        ValidationResult result = validator.validate(parser.parse("s. 3"));

        assertFalse(result.documentExists());
        assertEquals(List.of("Citation does not name a document"), result.warnings());
    }

    @Test
    void validate_invalidCitationCarriesParseReason() {
        ValidationResult result = validator.validate(parser.parse("gibberish"));

        assertFalse(result.documentExists());
        assertEquals(List.of("Could not parse citation: \"gibberish\""), result.warnings());
    }

    @Test
    void validator_requiresAStoreAndACitation() {
        assertThrows(NullPointerException.class, () -> new CitationValidator(null));
        assertThrows(IllegalArgumentException.class, () -> validator.validate((ParsedCitation) null));
    }
}
