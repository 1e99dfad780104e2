package com.williamcallahan.statuteindex.service.markup;

import com.williamcallahan.statuteindex.domain.legislation.DocumentStatus;
import com.williamcallahan.statuteindex.domain.legislation.DocumentStub;
import com.williamcallahan.statuteindex.domain.legislation.ParsedStatute;
import com.williamcallahan.statuteindex.domain.legislation.ProvisionExtraction;
import com.williamcallahan.statuteindex.support.XmlElements;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns one Akoma Ntoso document into a statute seed: metadata from the FRBR work
 * identification plus the provisions walked out of its body.
 */
@Service
public class AknStatuteParser {
    private static final Logger log = LoggerFactory.getLogger(AknStatuteParser.class);

    private static final int SHORT_TITLE_WORD_LIMIT = 3;
    private static final int MAX_INITIALS = 4;
    private static final int MIN_SIGNIFICANT_WORDS = 2;
    private static final int MIN_SIGNIFICANT_WORD_LENGTH = 3;
    private static final int FALLBACK_TITLE_LENGTH = 30;
    private static final Set<String> MINOR_WORDS = Set.of("The", "And", "For", "Of", "In", "To", "With");

    private final InlineMarkupFlattener flattener;
    private final ProvisionTreeWalker walker;

    public AknStatuteParser(InlineMarkupFlattener flattener, ProvisionTreeWalker walker) {
        this.flattener = Objects.requireNonNull(flattener, "flattener");
        this.walker = Objects.requireNonNull(walker, "walker");
    }

    /**
     * Parses a legislative markup document into a statute seed.
     *
     * @param markup raw document markup
     * @param stub catalog entry the markup was fetched for; supplies identifiers and title fallback
     * @return assembled statute with provisions in document order
     */
    public ParsedStatute parse(String markup, DocumentStub stub) {
        Objects.requireNonNull(stub, "Catalog entry is required");
        Document document = Jsoup.parse(flattener.flatten(markup), "", Parser.xmlParser());

        Optional<Element> work = XmlElements.firstDescendant(document, "FRBRWork");
        String title = work.flatMap(frbr -> XmlElements.firstChild(frbr, "FRBRalias"))
                .map(alias -> alias.attr("value").trim())
                .filter(value -> !value.isEmpty())
                .orElse(stub.title());
        String issuedDate = work.flatMap(frbr -> XmlElements.firstChild(frbr, "FRBRdate"))
                .map(date -> date.attr("date").trim())
                .filter(value -> !value.isEmpty())
                .orElse(stub.year() + "-01-01");

        ProvisionExtraction extraction = locateBody(document)
                .map(walker::walk)
                .orElseGet(() -> {
                    log.debug("No body element in markup for {}", stub.documentId());
                    return ProvisionExtraction.empty();
                });
        if (extraction.hasConflicts()) {
            log.warn("{} provision reference conflict(s) in {}", extraction.conflicts().size(), stub.documentId());
        }

        return new ParsedStatute(
                stub.documentId(),
                ParsedStatute.TYPE_STATUTE,
                title,
                buildShortName(title, stub.year()),
                DocumentStatus.IN_FORCE.identifier(),
                issuedDate,
                stub.url(),
                extraction.provisions());
    }

    private static Optional<Element> locateBody(Document document) {
        Optional<Element> nested = XmlElements.firstDescendant(document, "akomaNtoso")
                .flatMap(root -> XmlElements.firstChild(root, "act"))
                .flatMap(act -> XmlElements.firstChild(act, "body"));
        return nested.isPresent() ? nested : XmlElements.firstDescendant(document, "body");
    }

    /**
     * Builds an abbreviated citation name such as {@code DPA 2018}.
     */
    static String buildShortName(String title, int year) {
        String trimmedTitle = title == null ? "" : title.trim();
        String[] words = trimmedTitle.replaceAll("[()]", "").split("\\s+");
        if (words.length <= SHORT_TITLE_WORD_LIMIT) {
            return withYear(trimmedTitle, year);
        }

        List<String> significant = new ArrayList<>();
        for (String word : words) {
            if (word.length() >= MIN_SIGNIFICANT_WORD_LENGTH
                    && Character.isUpperCase(word.charAt(0))
                    && !MINOR_WORDS.contains(word)) {
                significant.add(word);
            }
        }
        if (significant.size() >= MIN_SIGNIFICANT_WORDS) {
            StringBuilder initials = new StringBuilder();
            for (String word : significant.subList(0, Math.min(MAX_INITIALS, significant.size()))) {
                initials.append(word.charAt(0));
            }
            return initials + " " + year;
        }

        String prefix = trimmedTitle.substring(0, Math.min(FALLBACK_TITLE_LENGTH, trimmedTitle.length())).trim();
        return withYear(prefix, year);
    }

    private static String withYear(String text, int year) {
        String yearText = String.valueOf(year);
        if (text.endsWith(yearText)) {
            return text;
        }
        return text.isEmpty() ? yearText : text + " " + yearText;
    }
}
