package com.williamcallahan.statuteindex.domain.citation;

import java.util.Objects;
import java.util.Optional;

/**
 * A citation rendered in one output convention.
 *
 * @param citation citation that was parsed from the input
 * @param format requested convention
 * @param formatted rendered text, or {@code null} when the citation could not be rendered
 */
public record FormattedCitation(ParsedCitation citation, CitationFormat format, String formatted) {

    public FormattedCitation {
        Objects.requireNonNull(citation, "citation");
        Objects.requireNonNull(format, "format");
    }

    public boolean valid() {
        return formatted != null;
    }

    /**
     * Returns why the citation could not be rendered.
     */
    public Optional<String> error() {
        if (formatted != null) {
            return Optional.empty();
        }
        if (citation instanceof ParsedCitation.Invalid invalid) {
            return Optional.of(invalid.reason());
        }
        return Optional.of("Citation has no section to format");
    }
}
