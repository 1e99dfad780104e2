package com.williamcallahan.statuteindex.service.lookup;

import com.williamcallahan.statuteindex.domain.citation.CitationFormat;
import com.williamcallahan.statuteindex.domain.citation.FormattedCitation;
import com.williamcallahan.statuteindex.domain.citation.ParsedCitation;
import com.williamcallahan.statuteindex.domain.citation.ValidationResult;
import com.williamcallahan.statuteindex.domain.legislation.CurrencyReport;
import com.williamcallahan.statuteindex.domain.legislation.StoredDocument;
import com.williamcallahan.statuteindex.domain.legislation.StoredProvision;
import com.williamcallahan.statuteindex.service.citation.CitationFormatter;
import com.williamcallahan.statuteindex.service.citation.CitationParser;
import com.williamcallahan.statuteindex.service.citation.CitationValidator;
import com.williamcallahan.statuteindex.service.store.DocumentResolver;
import com.williamcallahan.statuteindex.service.store.ProvisionStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.springframework.stereotype.Service;

/**
 * Read-side operations over the provision store: provision retrieval, currency checks and the
 * citation tools (parse, validate, format) applied to free-text input.
 */
@Service
public class LegislationLookupService {

    static final String EMPTY_CITATION = "Empty citation";

    private final ProvisionStore store;
    private final DocumentResolver resolver;
    private final CitationParser parser;
    private final CitationFormatter formatter;
    private final CitationValidator validator;

    public LegislationLookupService(
            ProvisionStore store, CitationParser parser, CitationFormatter formatter, CitationValidator validator) {
        this.store = Objects.requireNonNull(store, "Provision store is required");
        this.resolver = new DocumentResolver(store);
        this.parser = Objects.requireNonNull(parser, "parser");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    /**
     * Retrieves provisions of a document.
     *
     * @param documentIdOrTitle store identifier, slug or title
     * @param section section number such as {@code 3}, used when no reference is given (optional)
     * @param provisionRef exact provision reference such as {@code s3(1)} (optional)
     * @return the single matching provision, every provision in document order when neither
     *     section nor reference is given, or an empty list when nothing resolves
     */
    public List<StoredProvision> getProvision(String documentIdOrTitle, String section, String provisionRef) {
        Optional<StoredDocument> document = resolver.resolve(documentIdOrTitle);
        if (document.isEmpty()) {
            return List.of();
        }
        String documentId = document.get().id();
        Optional<String> reference = requestedReference(section, provisionRef);
        if (reference.isEmpty()) {
            return store.provisions(documentId);
        }
        return store.findProvision(documentId, reference.get()).map(List::of).orElse(List.of());
    }

    /**
     * Reports whether a statute (and optionally one provision) is in force.
     *
     * @return report, or empty when the document cannot be resolved
     */
    public Optional<CurrencyReport> checkCurrency(String documentIdOrTitle, String provisionRef) {
        return resolver.resolve(documentIdOrTitle).map(document -> currencyOf(document, provisionRef));
    }

    /**
     * Parses citation text; blank text is an invalid "Empty citation".
     */
    public ParsedCitation parseCitation(String citationText) {
        if (citationText == null || citationText.isBlank()) {
            return ParsedCitation.invalid(EMPTY_CITATION);
        }
        return parser.parse(citationText);
    }

    public ValidationResult validateCitation(String citationText) {
        return validator.validate(parseCitation(citationText));
    }

    /**
     * Parses citation text in either title-first or title-last order and renders it.
     *
     * @param citationText raw citation
     * @param formatIdentifier {@code full}, {@code short} or {@code pinpoint}; blank means full
     * @throws IllegalArgumentException when the format identifier is unknown
     */
    public FormattedCitation formatCitation(String citationText, String formatIdentifier) {
        CitationFormat format = CitationFormat.fromIdentifier(formatIdentifier);
        ParsedCitation citation = citationText == null || citationText.isBlank()
                ? ParsedCitation.invalid(EMPTY_CITATION)
                : parser.parseAnyOrder(citationText);
        return new FormattedCitation(citation, format, formatter.format(citation, format).orElse(null));
    }

    private CurrencyReport currencyOf(StoredDocument document, String provisionRef) {
        List<String> warnings = new ArrayList<>();
        boolean current = !document.isRepealed();
        if (!current) {
            warnings.add("This statute has been repealed");
        }
        Boolean provisionExists = null;
        if (provisionRef != null && !provisionRef.isBlank()) {
            provisionExists = store.findProvision(document.id(), provisionRef.trim()).isPresent();
            if (!provisionExists) {
                warnings.add("Provision " + provisionRef.trim() + " not found in " + document.title());
            }
        }
        return new CurrencyReport(
                document.id(), document.title(), document.type(), document.status(), current, provisionExists, warnings);
    }

    private static Optional<String> requestedReference(String section, String provisionRef) {
        if (provisionRef != null && !provisionRef.isBlank()) {
            return Optional.of(provisionRef.trim());
        }
        if (section != null && !section.isBlank()) {
            return Optional.of("s" + section.trim());
        }
        return Optional.empty();
    }
}
