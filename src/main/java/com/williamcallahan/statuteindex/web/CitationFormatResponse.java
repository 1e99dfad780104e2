package com.williamcallahan.statuteindex.web;

import com.williamcallahan.statuteindex.domain.citation.FormattedCitation;

/**
 * JSON view of a formatting request.
 *
 * @param valid whether the citation could be rendered
 * @param format convention that was applied
 * @param formatted rendered citation, null when invalid
 * @param error reason the citation could not be rendered, null when valid
 * @param citation the parsed citation
 */
public record CitationFormatResponse(
        boolean valid, String format, String formatted, String error, CitationView citation) {

    static CitationFormatResponse from(FormattedCitation formatted) {
        return new CitationFormatResponse(
                formatted.valid(),
                formatted.format().getIdentifier(),
                formatted.formatted(),
                formatted.error().orElse(null),
                CitationView.from(formatted.citation()));
    }
}
