package com.williamcallahan.statuteindex.service.citation;

import com.williamcallahan.statuteindex.domain.citation.CitationFormat;
import com.williamcallahan.statuteindex.domain.citation.ParsedCitation;
import java.util.Objects;
import java.util.Optional;
import org.springframework.stereotype.Service;

/**
 * Renders structured citations in the supported output conventions.
 */
@Service
public class CitationFormatter {

    /**
     * Formats a citation.
     *
     * @param citation parsed citation
     * @param format output convention
     * @return rendered citation, or empty when the citation is invalid or names no section
     */
    public Optional<String> format(ParsedCitation citation, CitationFormat format) {
        Objects.requireNonNull(citation, "citation");
        Objects.requireNonNull(format, "format");
        return citation.asValid()
                .filter(valid -> valid.section() != null)
                .map(valid -> render(valid, format));
    }

    /**
     * Builds the pinpoint portion, for example {@code 3(1)(a)}.
     */
    public static String pinpoint(ParsedCitation.Valid citation) {
        StringBuilder pinpoint = new StringBuilder(citation.section());
        if (citation.subsection() != null) {
            pinpoint.append('(').append(citation.subsection()).append(')');
        }
        if (citation.paragraph() != null) {
            pinpoint.append('(').append(citation.paragraph()).append(')');
        }
        return pinpoint.toString();
    }

    private static String render(ParsedCitation.Valid citation, CitationFormat format) {
        String pinpoint = pinpoint(citation);
        String document = documentPart(citation);
        return switch (format) {
            case FULL -> document.isEmpty() ? "Section " + pinpoint : "Section " + pinpoint + ", " + document;
            case SHORT -> document.isEmpty() ? "s. " + pinpoint : "s. " + pinpoint + " " + document;
            case PINPOINT -> "s. " + pinpoint;
        };
    }

    private static String documentPart(ParsedCitation.Valid citation) {
        StringBuilder document = new StringBuilder();
        if (citation.title() != null) {
            document.append(citation.title());
        }
        if (citation.year() != null) {
            if (document.length() > 0) {
                document.append(' ');
            }
            document.append(citation.year());
        }
        return document.toString();
    }
}
