package com.williamcallahan.statuteindex.domain.citation;

import com.williamcallahan.statuteindex.support.AsciiTextNormalizer;

/**
 * Output conventions a structured citation can be rendered in.
 */
public enum CitationFormat {
    /**
     * {@code Section 3(1)(a), Data Protection Act 2018}
     */
    FULL("full"),

    /**
     * {@code s. 3(1)(a) Data Protection Act 2018}
     */
    SHORT("short"),

    /**
     * {@code s. 3(1)(a)}
     */
    PINPOINT("pinpoint");

    private final String identifier;

    CitationFormat(String identifier) {
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }

    /**
     * Resolves a format from its identifier; a blank identifier means {@link #FULL}.
     *
     * @param identifier format identifier such as {@code "pinpoint"}
     * @return matching format
     * @throws IllegalArgumentException when the identifier names no known format
     */
    public static CitationFormat fromIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return FULL;
        }
        String normalized = AsciiTextNormalizer.toLowerAscii(identifier.trim());
        for (CitationFormat format : values()) {
            if (format.identifier.equals(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown citation format: " + identifier);
    }
}
