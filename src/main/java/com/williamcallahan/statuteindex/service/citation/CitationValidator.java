package com.williamcallahan.statuteindex.service.citation;

import com.williamcallahan.statuteindex.domain.citation.ParsedCitation;
import com.williamcallahan.statuteindex.domain.citation.ValidationResult;
import com.williamcallahan.statuteindex.domain.legislation.StoredDocument;
import com.williamcallahan.statuteindex.service.store.DocumentResolver;
import com.williamcallahan.statuteindex.service.store.ProvisionStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Checks a parsed citation against the provision store so that only citations to stored documents
 * and sections are reported as existing.
 */
@Service
public class CitationValidator {
    private static final Logger log = LoggerFactory.getLogger(CitationValidator.class);

    private final ProvisionStore store;
    private final DocumentResolver resolver;

    public CitationValidator(ProvisionStore store) {
        this.store = Objects.requireNonNull(store, "Provision store is required to validate citations");
        this.resolver = new DocumentResolver(store);
    }

    /**
     * Validates a citation.
     *
     * @param citation parsed citation, valid or not
     * @return existence flags for document and provision plus warnings; never throws for bad input
     */
    public ValidationResult validate(ParsedCitation citation) {
        if (citation == null) {
            throw new IllegalArgumentException("Citation is required");
        }
        if (citation instanceof ParsedCitation.Invalid invalid) {
            return ValidationResult.documentMissing(citation, invalid.reason());
        }
        ParsedCitation.Valid valid = (ParsedCitation.Valid) citation;
        if (valid.title() == null) {
            return ValidationResult.documentMissing(citation, "Citation does not name a document");
        }

        Optional<StoredDocument> resolved = resolver.resolveCitation(valid.title(), valid.year());
        if (resolved.isEmpty()) {
            String cited = valid.year() == null ? valid.title() : valid.title() + " " + valid.year();
            log.debug("Citation names unknown document {}", cited);
            return ValidationResult.documentMissing(citation, "Document \"" + cited + "\" not found");
        }

        StoredDocument document = resolved.get();
        List<String> warnings = new ArrayList<>();
        if (document.isRepealed()) {
            warnings.add("This statute has been repealed");
        }

        boolean provisionExists = false;
        if (valid.section() != null) {
            String sectionReference = "s" + valid.section();
            // sections published without a number carry their reference as label
            provisionExists = store.provisions(document.id()).stream()
                    .anyMatch(stored -> valid.section().equals(stored.provision().section())
                            || sectionReference.equals(stored.provision().provisionRef()));
            if (!provisionExists) {
                warnings.add("Section " + valid.section() + " not found in " + document.title());
            }
        }

        return new ValidationResult(
                citation, true, provisionExists, document.title(), document.status().identifier(), warnings);
    }
}
