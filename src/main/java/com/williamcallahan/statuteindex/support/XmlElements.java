package com.williamcallahan.statuteindex.support;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jsoup.nodes.Element;

/**
 * Namespace-agnostic helpers over jsoup XML element trees.
 *
 * <p>Feeds mix prefixed and unprefixed names ({@code openSearch:totalResults}) and legislative
 * markup may or may not carry a namespace prefix, so lookups compare local names only.</p>
 */
public final class XmlElements {

    private XmlElements() {}

    /**
     * Returns the element name without any namespace prefix.
     */
    public static String localName(Element element) {
        String tagName = element.tagName();
        int separator = tagName.indexOf(':');
        return separator < 0 ? tagName : tagName.substring(separator + 1);
    }

    /**
     * Finds the first direct child with the given local name.
     */
    public static Optional<Element> firstChild(Element parent, String localName) {
        for (Element child : parent.children()) {
            if (localName.equals(localName(child))) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    /**
     * Lists direct children with the given local name in document order.
     */
    public static List<Element> children(Element parent, String localName) {
        List<Element> matches = new ArrayList<>();
        for (Element child : parent.children()) {
            if (localName.equals(localName(child))) {
                matches.add(child);
            }
        }
        return matches;
    }

    /**
     * Returns the whitespace-collapsed text of the first matching child, or empty string.
     */
    public static String childText(Element parent, String localName) {
        return firstChild(parent, localName)
                .map(child -> AsciiTextNormalizer.collapseWhitespace(child.text()))
                .orElse("");
    }

    /**
     * Depth-first search for the first descendant (or the element itself) with the given local name.
     */
    public static Optional<Element> firstDescendant(Element root, String localName) {
        for (Element candidate : root.getAllElements()) {
            if (localName.equals(localName(candidate))) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
