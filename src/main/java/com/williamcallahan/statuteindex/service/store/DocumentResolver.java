package com.williamcallahan.statuteindex.service.store;

import com.williamcallahan.statuteindex.domain.legislation.StoredDocument;
import com.williamcallahan.statuteindex.support.AsciiTextNormalizer;
import com.williamcallahan.statuteindex.support.StatuteIdentifiers;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves caller-supplied document names to stored documents: exact identifier candidates
 * first, then title containment.
 */
public class DocumentResolver {

    private final ProvisionStore store;

    public DocumentResolver(ProvisionStore store) {
        this.store = Objects.requireNonNull(store, "Provision store is required");
    }

    /**
     * Resolves an identifier, slug or title fragment.
     */
    public Optional<StoredDocument> resolve(String identifierOrTitle) {
        if (!StatuteIdentifiers.isValid(identifierOrTitle)) {
            return Optional.empty();
        }
        for (String candidate : StatuteIdentifiers.candidates(identifierOrTitle)) {
            Optional<StoredDocument> exact = store.findDocument(candidate);
            if (exact.isPresent()) {
                return exact;
            }
        }
        String fragment = identifierOrTitle.trim();
        return store.documents().stream()
                .filter(document -> AsciiTextNormalizer.containsIgnoreCase(document.title(), fragment))
                .findFirst();
    }

    /**
     * Resolves the document a citation names by title (or abbreviation) and year.
     *
     * <p>The title must appear in the stored title with the year somewhere after it; an abbreviation
     * such as {@code DPA} matches the stored short name {@code DPA 2018}.</p>
     */
    public Optional<StoredDocument> resolveCitation(String title, Integer year) {
        if (!StatuteIdentifiers.isValid(title)) {
            return Optional.empty();
        }
        String yearText = year == null ? "" : String.valueOf(year);
        String titledName = yearText.isEmpty() ? title.trim() : title.trim() + " " + yearText;
        for (String candidate : StatuteIdentifiers.candidates(titledName)) {
            Optional<StoredDocument> exact = store.findDocument(candidate);
            if (exact.isPresent()) {
                return exact;
            }
        }
        String loweredTitle = AsciiTextNormalizer.toLowerAscii(title.trim());
        for (StoredDocument document : store.documents()) {
            String storedTitle = AsciiTextNormalizer.toLowerAscii(document.title());
            int titleAt = storedTitle.indexOf(loweredTitle);
            if (titleAt >= 0 && storedTitle.indexOf(yearText, titleAt + loweredTitle.length()) >= 0) {
                return Optional.of(document);
            }
        }
        String loweredName = AsciiTextNormalizer.toLowerAscii(titledName);
        return store.documents().stream()
                .filter(document -> !document.shortName().isEmpty())
                .filter(document -> AsciiTextNormalizer.toLowerAscii(document.shortName()).equals(loweredName))
                .findFirst();
    }
}
