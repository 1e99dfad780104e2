package com.williamcallahan.statuteindex.domain.citation;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of parsing a free-text legal citation.
 *
 * <p>Callers must handle both variants: a {@link Valid} citation carries the structured fields,
 * an {@link Invalid} one only the reason the input was rejected.</p>
 */
public sealed interface ParsedCitation permits ParsedCitation.Valid, ParsedCitation.Invalid {

    /**
     * Returns true when the input matched a recognized citation form.
     */
    boolean valid();

    /**
     * Returns the instrument type; {@link CitationType#UNKNOWN} for invalid citations.
     */
    CitationType type();

    /**
     * Returns the structured citation when parsing succeeded.
     */
    default Optional<Valid> asValid() {
        return Optional.empty();
    }

    /**
     * Creates a valid citation.
     */
    static ParsedCitation of(
            CitationType type, String title, Integer year, String section, String subsection, String paragraph) {
        return new Valid(type, title, year, section, subsection, paragraph);
    }

    /**
     * Creates an invalid citation carrying the rejection reason.
     */
    static ParsedCitation invalid(String reason) {
        return new Invalid(reason);
    }

    /**
     * Structured citation. Section, subsection and paragraph are strings because legal numbering
     * includes letters and composite forms such as {@code 12A}.
     *
     * @param type instrument type
     * @param title cited document title or abbreviation, {@code null} for a bare pinpoint
     * @param year cited document year, {@code null} for a bare pinpoint
     * @param section section number, or the whole pinpoint token when it could not be decomposed
     * @param subsection subsection number, or {@code null}
     * @param paragraph paragraph letter, or {@code null}
     */
    record Valid(CitationType type, String title, Integer year, String section, String subsection, String paragraph)
            implements ParsedCitation {

        public Valid {
            Objects.requireNonNull(type, "Citation type is required");
            title = blankToNull(title);
            section = blankToNull(section);
            subsection = blankToNull(subsection);
            paragraph = blankToNull(paragraph);
        }

        @Override
        public boolean valid() {
            return true;
        }

        @Override
        public Optional<Valid> asValid() {
            return Optional.of(this);
        }

        private static String blankToNull(String value) {
            if (value == null) {
                return null;
            }
            String trimmed = value.trim();
            return trimmed.isEmpty() ? null : trimmed;
        }
    }

    /**
     * Rejected citation.
     *
     * @param reason human-readable reason, including the original input
     */
    record Invalid(String reason) implements ParsedCitation {

        public Invalid {
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("Invalid citation reason is required");
            }
        }

        @Override
        public boolean valid() {
            return false;
        }

        @Override
        public CitationType type() {
            return CitationType.UNKNOWN;
        }
    }
}
