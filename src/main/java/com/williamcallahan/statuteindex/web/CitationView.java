package com.williamcallahan.statuteindex.web;

import com.williamcallahan.statuteindex.domain.citation.ParsedCitation;

/**
 * JSON view of a parsed citation with an explicit {@code valid} flag.
 */
public record CitationView(
        boolean valid,
        String type,
        String title,
        Integer year,
        String section,
        String subsection,
        String paragraph,
        String error) {

    static CitationView from(ParsedCitation citation) {
        if (citation instanceof ParsedCitation.Valid valid) {
            return new CitationView(
                    true,
                    valid.type().getIdentifier(),
                    valid.title(),
                    valid.year(),
                    valid.section(),
                    valid.subsection(),
                    valid.paragraph(),
                    null);
        }
        ParsedCitation.Invalid invalid = (ParsedCitation.Invalid) citation;
        return new CitationView(false, invalid.type().getIdentifier(), null, null, null, null, null, invalid.reason());
    }
}
