package com.williamcallahan.statuteindex.service.citation;

import com.williamcallahan.statuteindex.domain.citation.CitationType;
import com.williamcallahan.statuteindex.domain.citation.ParsedCitation;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Service;

/**
 * Parses free-text UK legal citations into structured form.
 *
 * <p>Recognized surface forms, tried in this order (first match wins):</p>
 * <ol>
 *   <li>{@code Section 3, Data Protection Act 2018} or {@code s. 3(1)(a) Data Protection Act 2018}</li>
 *   <li>{@code s. 3 DPA 2018} (uppercase abbreviation)</li>
 *   <li>{@code s. 3(1)} bare pinpoint with no document, parsed with type {@link CitationType#UNKNOWN}</li>
 * </ol>
 *
 * <p>The pinpoint token is then split into section, subsection and paragraph. A token that
 * matched a surface form but does not split cleanly is kept whole as the section.</p>
 */
@Service
public class CitationParser {

    private static final String PINPOINT = "\\d+[A-Z]*(?:\\(\\d+[A-Z]*\\))*(?:\\([a-z]+\\))*";

    private static final Pattern TITLED_CITATION = Pattern.compile(
            "^(?:Section|s\\.?)\\s+(" + PINPOINT + ")\\s*,?\\s+(.+?)\\s+(\\d{4})$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ABBREVIATED_CITATION =
            Pattern.compile("^s\\.?\\s+(" + PINPOINT + ")\\s+([A-Z][A-Z0-9&\\s]*?)\\s+(\\d{4})$");
    private static final Pattern BARE_PINPOINT =
            Pattern.compile("^(?:Section|s\\.?)\\s+(" + PINPOINT + ")$", Pattern.CASE_INSENSITIVE);

    private static final Pattern PINPOINT_PARTS =
            Pattern.compile("^(\\d+[A-Z]*)(?:\\((\\d+[A-Z]*)\\))?(?:\\(([a-z]+)\\))?$");

    private static final Pattern TITLE_LAST_CITATION = Pattern.compile(
            "^(.+?)\\s+(\\d{4})\\s*,?\\s+((?:Section|s\\.?)\\s+" + PINPOINT + ")$", Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> DOCUMENT_FORMS = List.of(TITLED_CITATION, ABBREVIATED_CITATION);

    /**
     * Parses a citation string.
     *
     * @param citation raw citation text
     * @return a valid citation, or an invalid one whose reason quotes the input
     * @throws IllegalArgumentException when the citation is null
     */
    public ParsedCitation parse(String citation) {
        if (citation == null) {
            throw new IllegalArgumentException("Citation text is required");
        }
        String trimmed = citation.trim();

        for (Pattern form : DOCUMENT_FORMS) {
            Matcher matcher = form.matcher(trimmed);
            if (matcher.matches()) {
                return fromPinpoint(
                        CitationType.STATUTE, matcher.group(1), matcher.group(2), Integer.valueOf(matcher.group(3)));
            }
        }

        Matcher bare = BARE_PINPOINT.matcher(trimmed);
        if (bare.matches()) {
            return fromPinpoint(CitationType.UNKNOWN, bare.group(1), null, null);
        }

        return ParsedCitation.invalid("Could not parse citation: \"" + trimmed + "\"");
    }

    /**
     * Parses a citation, also accepting the title-last phrasing {@code Data Protection Act 2018, s. 3}
     * by reordering it into the title-first form.
     *
     * @param citation raw citation text
     * @return parsed citation; invalid inputs keep the reason for the original text
     */
    public ParsedCitation parseAnyOrder(String citation) {
        ParsedCitation parsed = parse(citation);
        if (parsed.valid()) {
            return parsed;
        }
        Matcher titleLast = TITLE_LAST_CITATION.matcher(citation.trim());
        if (!titleLast.matches()) {
            return parsed;
        }
        ParsedCitation reordered =
                parse(titleLast.group(3) + ", " + titleLast.group(1) + " " + titleLast.group(2));
        return reordered.valid() ? reordered : parsed;
    }

    private static ParsedCitation fromPinpoint(CitationType type, String pinpoint, String title, Integer year) {
        Matcher parts = PINPOINT_PARTS.matcher(pinpoint);
        if (!parts.matches()) {
            return ParsedCitation.of(type, title, year, pinpoint, null, null);
        }
        return ParsedCitation.of(type, title, year, parts.group(1), parts.group(2), parts.group(3));
    }
}
