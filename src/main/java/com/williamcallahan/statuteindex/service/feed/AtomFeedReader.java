package com.williamcallahan.statuteindex.service.feed;

import com.williamcallahan.statuteindex.config.AppProperties;
import com.williamcallahan.statuteindex.domain.legislation.DocumentStub;
import com.williamcallahan.statuteindex.domain.legislation.FeedPage;
import com.williamcallahan.statuteindex.support.AsciiTextNormalizer;
import com.williamcallahan.statuteindex.support.XmlElements;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Reads one page of the legislation Atom feed into catalog entries.
 *
 * <p>Entries without a title, or whose link and id do not point at
 * {@code /<collection>/<year>/<number>}, are not catalog members and are dropped. A page with no
 * entries is treated as the last page even when it still advertises a next link.</p>
 */
@Component
public class AtomFeedReader {
    private static final Logger log = LoggerFactory.getLogger(AtomFeedReader.class);

    private static final String REL_ATTRIBUTE = "rel";
    private static final String HREF_ATTRIBUTE = "href";

    private final String baseUrl;
    private final String collection;
    private final Pattern documentPath;

    @Autowired
    public AtomFeedReader(AppProperties appProperties) {
        this(appProperties.getLegislation().getBaseUrl(), appProperties.getLegislation().getCollection());
    }

    public AtomFeedReader(String baseUrl, String collection) {
        if (collection == null || collection.isBlank()) {
            throw new IllegalArgumentException("Collection is required");
        }
        this.baseUrl = trimTrailingSlash(baseUrl);
        this.collection = collection.trim();
        this.documentPath = Pattern.compile("/" + Pattern.quote(this.collection) + "/(\\d{4})/(\\d+)");
    }

    /**
     * Parses one feed page.
     *
     * @param feedXml raw Atom XML (may be null or empty)
     * @return entries in feed order with pagination hints
     */
    public FeedPage read(String feedXml) {
        if (feedXml == null || feedXml.isBlank()) {
            return new FeedPage(List.of(), false, null);
        }
        Document document = Jsoup.parse(feedXml, "", Parser.xmlParser());
        Element feed = XmlElements.firstDescendant(document, "feed").orElse(document);

        List<DocumentStub> entries = new ArrayList<>();
        for (Element entry : XmlElements.children(feed, "entry")) {
            toStub(entry).ifPresent(entries::add);
        }

        boolean hasNextPage = XmlElements.children(feed, "link").stream()
                .anyMatch(link -> "next".equals(link.attr(REL_ATTRIBUTE)));
        Integer totalResults = XmlElements.firstChild(feed, "totalResults")
                .map(total -> parseCount(total.text()))
                .orElse(null);

        return new FeedPage(entries, hasNextPage, totalResults);
    }

    private Optional<DocumentStub> toStub(Element entry) {
        String title = XmlElements.childText(entry, "title");
        if (title.isEmpty()) {
            log.debug("Dropping feed entry without a title");
            return Optional.empty();
        }
        String identifier = XmlElements.childText(entry, "id");
        String link = preferredLink(entry);
        String location = link.isEmpty() ? identifier : link;

        Matcher matcher = documentPath.matcher(location);
        if (!matcher.find()) {
            log.debug("Dropping feed entry outside the {} collection: {}", collection, location);
            return Optional.empty();
        }
        int year = Integer.parseInt(matcher.group(1));
        int number;
        try {
            number = Integer.parseInt(matcher.group(2));
        } catch (NumberFormatException overflow) {
            log.debug("Dropping feed entry with unusable number: {}", location);
            return Optional.empty();
        }
        String canonicalUrl = baseUrl + "/" + collection + "/" + year + "/" + number;
        String updated = XmlElements.childText(entry, "updated");
        return Optional.of(new DocumentStub(
                collection, year, number, AsciiTextNormalizer.collapseWhitespace(title), canonicalUrl, updated));
    }

    private static String preferredLink(Element entry) {
        List<Element> links = XmlElements.children(entry, "link");
        for (Element link : links) {
            String rel = link.attr(REL_ATTRIBUTE);
            if ("self".equals(rel) || "alternate".equals(rel)) {
                return link.attr(HREF_ATTRIBUTE);
            }
        }
        return links.isEmpty() ? "" : links.get(0).attr(HREF_ATTRIBUTE);
    }

    private static Integer parseCount(String text) {
        try {
            return Integer.valueOf(text.trim());
        } catch (NumberFormatException malformed) {
            return null;
        }
    }

    private static String trimTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        String trimmed = url.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
