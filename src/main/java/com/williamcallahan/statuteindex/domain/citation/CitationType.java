package com.williamcallahan.statuteindex.domain.citation;

/**
 * Kind of instrument a parsed citation refers to.
 */
public enum CitationType {
    /**
     * Primary legislation (an Act).
     */
    STATUTE("statute"),

    /**
     * Secondary legislation made under an Act.
     */
    STATUTORY_INSTRUMENT("statutory_instrument"),

    /**
     * Instrument could not be determined, for example a bare pinpoint.
     */
    UNKNOWN("unknown");

    private final String identifier;

    CitationType(String identifier) {
        this.identifier = identifier;
    }

    /**
     * Gets the wire identifier for this citation type.
     * @return string identifier
     */
    public String getIdentifier() {
        return identifier;
    }
}
