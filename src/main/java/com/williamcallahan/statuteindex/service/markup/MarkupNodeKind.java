package com.williamcallahan.statuteindex.service.markup;

import java.util.Set;

/**
 * Classifies legislative markup elements by the role they play while provisions are walked out.
 */
enum MarkupNodeKind {
    /** Structural grouping (part, chapter, cross heading, schedules); only its descendants matter. */
    CONTAINER("container", ""),
    SECTION("section", "s"),
    /** Generic hierarchical container, used for schedules and annexes. */
    HCONTAINER("hcontainer", "hc"),
    /** Numbered sub-unit of a section. */
    SUBSECTION("subsection", "ss"),
    /** Label or text-bearing child consumed by its enclosing provision. */
    TEXT("text", "");

    private static final Set<String> TEXT_ELEMENTS = Set.of(
            "num", "heading", "subheading", "content", "p", "block", "blockList",
            "intro", "wrapUp", "paragraph", "subparagraph");

    private final String elementName;
    private final String referencePrefix;

    MarkupNodeKind(String elementName, String referencePrefix) {
        this.elementName = elementName;
        this.referencePrefix = referencePrefix;
    }

    /**
     * Element name used in placeholder references such as {@code section-unknown}.
     */
    String elementName() {
        return elementName;
    }

    /**
     * Short code prefixed to a cleaned number label when no element identifier is available.
     */
    String referencePrefix() {
        return referencePrefix;
    }

    static MarkupNodeKind classify(String localName) {
        if (localName == null) {
            return CONTAINER;
        }
        return switch (localName) {
            case "section" -> SECTION;
            case "hcontainer" -> HCONTAINER;
            case "subsection" -> SUBSECTION;
            default -> TEXT_ELEMENTS.contains(localName) ? TEXT : CONTAINER;
        };
    }
}
