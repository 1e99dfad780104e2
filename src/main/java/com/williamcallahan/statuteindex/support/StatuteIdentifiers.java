package com.williamcallahan.statuteindex.support;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Statute identifier handling.
 *
 * <p>Callers name statutes either by store identifier ({@code ukpga-2018-12}) or by a slug or
 * title ({@code data-protection-act-2018}, {@code Data Protection Act 2018}). Candidates cover the
 * spellings the store may hold so exact lookups are tried before any fuzzy title match.</p>
 */
public final class StatuteIdentifiers {

    private StatuteIdentifiers() {}

    /**
     * Returns true when the identifier has visible content.
     */
    public static boolean isValid(String identifier) {
        return identifier != null && !identifier.isBlank();
    }

    /**
     * Returns lookup candidates for a caller-supplied identifier, most specific first.
     *
     * @param identifier raw identifier or title
     * @return ordered, duplicate-free candidates; empty when the identifier is blank
     */
    public static List<String> candidates(String identifier) {
        if (!isValid(identifier)) {
            return List.of();
        }
        String trimmed = identifier.trim();
        String lowered = AsciiTextNormalizer.toLowerAscii(trimmed);
        Set<String> candidates = new LinkedHashSet<>();
        candidates.add(lowered);
        candidates.add(trimmed);
        if (lowered.contains(" ")) {
            candidates.add(lowered.replaceAll("\\s+", "-"));
        }
        if (lowered.contains("-")) {
            candidates.add(lowered.replace('-', ' '));
        }
        return List.copyOf(candidates);
    }

    /**
     * Builds the store identifier for a collection document.
     */
    public static String documentId(String collection, int year, int number) {
        return collection + "-" + year + "-" + number;
    }
}
