package com.williamcallahan.statuteindex.service.markup;

import com.williamcallahan.statuteindex.domain.legislation.ProvisionExtraction;
import com.williamcallahan.statuteindex.domain.legislation.ProvisionRecord;
import com.williamcallahan.statuteindex.domain.legislation.ReferenceConflict;
import com.williamcallahan.statuteindex.support.AsciiTextNormalizer;
import com.williamcallahan.statuteindex.support.XmlElements;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Walks a legislative document body and emits one provision per text-bearing section-like node.
 *
 * <p>Containers (parts, chapters, cross headings, schedules) are descended in document order.
 * Each section or generic container contributes its own text (direct text plus content, p, block,
 * intro, wrap-up and numbered paragraph children); each subsection below it becomes a separate
 * provision labelled {@code parent(sub)}. Nodes whose text is blank after whitespace
 * normalization are dropped.</p>
 *
 * <p>The walk itself is a pure recursive function over the element tree. Reference uniqueness is
 * enforced afterwards: a repeated reference keeps its first record and re-keys later ones with a
 * {@code ~n} suffix, reporting each as a {@link ReferenceConflict}.</p>
 */
@Component
public class ProvisionTreeWalker {
    private static final Logger log = LoggerFactory.getLogger(ProvisionTreeWalker.class);

    private static final Pattern SECTION_ID = Pattern.compile("section-(\\d+[A-Za-z]*)$");
    private static final Pattern SUBSECTION_ID = Pattern.compile("section-(\\d+[A-Za-z]*)-(\\d+[A-Za-z]*)$");
    private static final Pattern LABEL_NOISE = Pattern.compile("[.\\s()]");
    private static final Pattern SECTION_LABEL_NOISE = Pattern.compile("[.\\s]");
    private static final String CONFLICT_SEPARATOR = "~";
    private static final String ELEMENT_ID_ATTRIBUTE = "eId";

    /**
     * Extracts the provisions of a document body.
     *
     * @param body body element of a parsed legislative document (may be null)
     * @return provisions in document order with unique references, plus any re-keyed conflicts
     */
    public ProvisionExtraction walk(Element body) {
        if (body == null) {
            return ProvisionExtraction.empty();
        }
        return ensureUniqueReferences(visitChildren(body));
    }

    private List<ProvisionRecord> visitChildren(Element parent) {
        List<ProvisionRecord> records = new ArrayList<>();
        for (Element child : parent.children()) {
            records.addAll(visit(child));
        }
        return records;
    }

    private List<ProvisionRecord> visit(Element node) {
        MarkupNodeKind kind = MarkupNodeKind.classify(XmlElements.localName(node));
        return switch (kind) {
            case SECTION, HCONTAINER -> visitSectionLike(node, kind);
            case SUBSECTION -> visitSubUnit(node, null, null, "");
            case CONTAINER -> visitChildren(node);
            case TEXT -> List.of();
        };
    }

    private List<ProvisionRecord> visitSectionLike(Element node, MarkupNodeKind kind) {
        List<ProvisionRecord> records = new ArrayList<>();
        String number = XmlElements.childText(node, "num");
        String heading = XmlElements.childText(node, "heading");
        String reference = deriveReference(node.attr(ELEMENT_ID_ATTRIBUTE), kind, number, null);
        String label = number.isEmpty() ? reference : SECTION_LABEL_NOISE.matcher(number).replaceAll("");

        try {
            String text = ownText(node);
            if (!text.isEmpty()) {
                records.add(new ProvisionRecord(reference, label, emptyToNull(heading), text));
            }
        } catch (RuntimeException nodeFailure) {
            log.debug("Skipping malformed {} node {}: {}", kind.elementName(), reference, nodeFailure.getMessage());
        }

        for (Element child : node.children()) {
            MarkupNodeKind childKind = MarkupNodeKind.classify(XmlElements.localName(child));
            if (childKind == MarkupNodeKind.SUBSECTION) {
                records.addAll(visitSubUnit(child, reference, label, heading));
            } else if (childKind != MarkupNodeKind.TEXT) {
                records.addAll(visit(child));
            }
        }
        return records;
    }

    private List<ProvisionRecord> visitSubUnit(Element node, String parentReference, String parentLabel, String parentHeading) {
        List<ProvisionRecord> records = new ArrayList<>();
        String number = XmlElements.childText(node, "num");
        String reference =
                deriveReference(node.attr(ELEMENT_ID_ATTRIBUTE), MarkupNodeKind.SUBSECTION, number, parentReference);
        String label = subUnitLabel(parentLabel, number, reference);
        String ownHeading = XmlElements.childText(node, "heading");
        String heading = ownHeading.isEmpty() ? parentHeading : ownHeading;

        try {
            String text = ownText(node);
            if (!text.isEmpty()) {
                records.add(new ProvisionRecord(reference, label, emptyToNull(heading), text));
            }
        } catch (RuntimeException nodeFailure) {
            log.debug("Skipping malformed subsection node {}: {}", reference, nodeFailure.getMessage());
        }

        for (Element child : node.children()) {
            if (MarkupNodeKind.classify(XmlElements.localName(child)) != MarkupNodeKind.TEXT) {
                records.addAll(visit(child));
            }
        }
        return records;
    }

    /**
     * Collects the text a node owns directly, excluding nested sub-units and sections.
     */
    private String ownText(Element node) {
        List<String> parts = new ArrayList<>();
        addIfPresent(parts, node.ownText());
        for (Element child : node.children()) {
            switch (XmlElements.localName(child)) {
                case "content", "intro", "wrapUp" -> addIfPresent(parts, ownText(child));
                case "p", "block", "blockList" -> addIfPresent(parts, child.text());
                case "paragraph", "subparagraph" -> addIfPresent(parts, numberedText(child));
                default -> {
                    // num, heading and structural children are handled by the walk
                }
            }
        }
        return AsciiTextNormalizer.collapseWhitespace(String.join(" ", parts));
    }

    private String numberedText(Element paragraph) {
        String body = ownText(paragraph);
        if (body.isEmpty()) {
            return "";
        }
        String number = XmlElements.childText(paragraph, "num");
        return number.isEmpty() ? body : number + " " + body;
    }

    /**
     * Derives a provision reference, preferring the element identifier over the number label.
     */
    static String deriveReference(String elementId, MarkupNodeKind kind, String number, String parentReference) {
        if (elementId != null && !elementId.isBlank()) {
            Matcher subsection = SUBSECTION_ID.matcher(elementId);
            if (subsection.find()) {
                return "s" + subsection.group(1) + "(" + subsection.group(2) + ")";
            }
            Matcher section = SECTION_ID.matcher(elementId);
            if (section.find()) {
                return "s" + section.group(1);
            }
            return elementId.trim();
        }
        String cleaned = number == null ? "" : LABEL_NOISE.matcher(number).replaceAll("");
        if (!cleaned.isEmpty()) {
            if (kind == MarkupNodeKind.SUBSECTION && parentReference != null) {
                return parentReference + "(" + cleaned + ")";
            }
            return kind.referencePrefix() + cleaned;
        }
        return kind.elementName() + "-unknown";
    }

    private static String subUnitLabel(String parentLabel, String number, String reference) {
        String cleaned = LABEL_NOISE.matcher(number).replaceAll("");
        if (cleaned.isEmpty()) {
            return reference;
        }
        return parentLabel == null ? cleaned : parentLabel + "(" + cleaned + ")";
    }

    private ProvisionExtraction ensureUniqueReferences(List<ProvisionRecord> records) {
        Set<String> assigned = new HashSet<>();
        List<ProvisionRecord> unique = new ArrayList<>(records.size());
        List<ReferenceConflict> conflicts = new ArrayList<>();
        for (ProvisionRecord provisionRecord : records) {
            String reference = provisionRecord.provisionRef();
            if (assigned.add(reference)) {
                unique.add(provisionRecord);
                continue;
            }
            int ordinal = 1;
            String replacement;
            do {
                ordinal++;
                replacement = reference + CONFLICT_SEPARATOR + ordinal;
            } while (!assigned.add(replacement));
            log.warn("Provision reference {} repeats (section {}); re-keyed as {}",
                    reference, provisionRecord.section(), replacement);
            conflicts.add(new ReferenceConflict(reference, replacement, provisionRecord.section()));
            unique.add(provisionRecord.withProvisionRef(replacement));
        }
        return new ProvisionExtraction(unique, conflicts);
    }

    private static void addIfPresent(List<String> parts, String text) {
        if (text != null && !text.isBlank()) {
            parts.add(text);
        }
    }

    private static String emptyToNull(String text) {
        return text == null || text.isEmpty() ? null : text;
    }
}
