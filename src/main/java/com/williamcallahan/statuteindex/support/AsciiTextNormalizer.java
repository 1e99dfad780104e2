package com.williamcallahan.statuteindex.support;

import java.util.regex.Pattern;

/**
 * Locale-independent text helpers shared by the markup, feed and citation code.
 *
 * <p>Lowercasing only touches ASCII letters so identifiers such as collection slugs and
 * status codes compare the same way regardless of the JVM default locale.</p>
 */
public final class AsciiTextNormalizer {

    private static final int CASE_OFFSET = 'a' - 'A';
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private AsciiTextNormalizer() {}

    /**
     * Converts ASCII uppercase letters to lowercase, leaving other characters unchanged.
     *
     * @param text the input text to normalize (may be null)
     * @return the normalized text with ASCII letters lowercased, or empty string if null
     */
    public static String toLowerAscii(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder normalized = new StringBuilder(text.length());
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            if (current >= 'A' && current <= 'Z') {
                normalized.append((char) (current + CASE_OFFSET));
            } else {
                normalized.append(current);
            }
        }
        return normalized.toString();
    }

    /**
     * Collapses every whitespace run to a single space and trims the result.
     *
     * @param text the input text (may be null)
     * @return collapsed text, or empty string if null
     */
    public static String collapseWhitespace(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return WHITESPACE_RUN.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Case-insensitive ASCII containment check.
     */
    public static boolean containsIgnoreCase(String haystack, String needle) {
        if (haystack == null || needle == null) {
            return false;
        }
        return toLowerAscii(haystack).contains(toLowerAscii(needle));
    }
}
