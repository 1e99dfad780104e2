package com.williamcallahan.statuteindex.domain.citation;

import java.util.List;
import java.util.Objects;

/**
 * Result of checking a citation against the provision store. Always freshly computed, never persisted.
 *
 * @param citation the parsed citation that was checked
 * @param documentExists whether the cited document resolved to a stored document
 * @param provisionExists whether the cited section exists under that document
 * @param documentTitle title of the resolved document, or {@code null}
 * @param status status identifier of the resolved document, or {@code null}
 * @param warnings human-readable findings in the order they were raised
 */
public record ValidationResult(
        ParsedCitation citation,
        boolean documentExists,
        boolean provisionExists,
        String documentTitle,
        String status,
        List<String> warnings) {

    public ValidationResult {
        Objects.requireNonNull(citation, "citation");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Builds a result for a citation whose document could not be resolved.
     */
    public static ValidationResult documentMissing(ParsedCitation citation, String warning) {
        return new ValidationResult(citation, false, false, null, null, List.of(warning));
    }
}
