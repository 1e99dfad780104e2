package com.williamcallahan.statuteindex.domain.legislation;

import java.util.Objects;
import java.util.Optional;

/**
 * Addressable unit of statutory text extracted from a legislation document.
 *
 * @param provisionRef short stable reference within the document, for example {@code s3(1)}
 * @param section human-facing section label, for example {@code 3(1)}
 * @param title heading of the enclosing section, or {@code null} when the markup has none
 * @param content whitespace-normalized body text, never blank
 */
public record ProvisionRecord(String provisionRef, String section, String title, String content) {

    public ProvisionRecord {
        if (provisionRef == null || provisionRef.isBlank()) {
            throw new IllegalArgumentException("Provision reference is required");
        }
        Objects.requireNonNull(section, "Section label is required");
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Provision body text must not be blank: " + provisionRef);
        }
    }

    /**
     * Returns the heading when present.
     */
    public Optional<String> heading() {
        return Optional.ofNullable(title).filter(heading -> !heading.isBlank());
    }

    /**
     * Returns a copy carrying a different reference, used when a reference collides in one document.
     */
    public ProvisionRecord withProvisionRef(String replacementRef) {
        return new ProvisionRecord(replacementRef, section, title, content);
    }
}
