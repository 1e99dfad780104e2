package com.williamcallahan.statuteindex.domain.legislation;

import java.util.Locale;
import java.util.Optional;

/**
 * Lifecycle status of a stored legislation document.
 */
public enum DocumentStatus {
    IN_FORCE("in_force"),
    AMENDED("amended"),
    REPEALED("repealed"),
    NOT_YET_IN_FORCE("not_yet_in_force");

    private final String identifier;

    DocumentStatus(String identifier) {
        this.identifier = identifier;
    }

    /**
     * Returns the identifier used in seed files and by the store.
     */
    public String identifier() {
        return identifier;
    }

    /**
     * Resolves a status from its identifier, ignoring case and surrounding whitespace.
     */
    public static Optional<DocumentStatus> fromIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return Optional.empty();
        }
        String normalized = identifier.trim().toLowerCase(Locale.ROOT);
        for (DocumentStatus status : values()) {
            if (status.identifier.equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
