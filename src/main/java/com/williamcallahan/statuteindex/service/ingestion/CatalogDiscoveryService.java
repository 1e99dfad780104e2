package com.williamcallahan.statuteindex.service.ingestion;

import com.williamcallahan.statuteindex.config.AppProperties;
import com.williamcallahan.statuteindex.domain.ingestion.DiscoveryOutcome;
import com.williamcallahan.statuteindex.domain.ingestion.FetchResult;
import com.williamcallahan.statuteindex.domain.legislation.DocumentStub;
import com.williamcallahan.statuteindex.domain.legislation.FeedPage;
import com.williamcallahan.statuteindex.service.feed.AtomFeedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Walks the collection feed page by page to build the catalog of documents to ingest.
 *
 * <p>The walk stops at the first page without a next link, the first non-200 response, or the
 * configured page ceiling. Entries are deduplicated by year and number, first occurrence wins,
 * and the result is persisted as the catalog index.</p>
 */
@Service
public class CatalogDiscoveryService {
    private static final Logger INGESTION_LOG = LoggerFactory.getLogger("INGESTION");

    private final LegislationFetcher fetcher;
    private final AtomFeedReader feedReader;
    private final SeedFileStore seedFileStore;
    private final int pageLimit;

    public CatalogDiscoveryService(
            LegislationFetcher fetcher,
            AtomFeedReader feedReader,
            SeedFileStore seedFileStore,
            AppProperties appProperties) {
        this.fetcher = fetcher;
        this.feedReader = feedReader;
        this.seedFileStore = seedFileStore;
        this.pageLimit = appProperties.getIngestion().getDiscoveryPageLimit();
    }

    /**
     * Discovers the catalog and writes the catalog index.
     *
     * @return deduplicated catalog with walk statistics
     * @throws IOException if the catalog index cannot be written
     * @throws LegislationFetchException if a feed page cannot be fetched at all
     */
    public DiscoveryOutcome discover() throws IOException {
        INGESTION_LOG.info("[INGESTION] Discovering catalog from feed (page limit {})", pageLimit);
        List<DocumentStub> allEntries = new ArrayList<>();
        int page = 1;
        int pagesRead = 0;
        boolean hasMore = true;
        boolean hitPageLimit = false;

        while (hasMore) {
            if (page > pageLimit) {
                INGESTION_LOG.warn("[INGESTION] Hit page limit of {}, stopping discovery", pageLimit);
                hitPageLimit = true;
                break;
            }
            FetchResult result = fetcher.fetchFeedPage(page);
            if (!result.isOk()) {
                INGESTION_LOG.info("[INGESTION] Feed page {} returned HTTP {}, stopping discovery", page, result.status());
                break;
            }
            FeedPage feedPage = feedReader.read(result.body());
            pagesRead++;
            allEntries.addAll(feedPage.entries());
            INGESTION_LOG.info("[INGESTION] Feed page {}: {} entries{}", page, feedPage.entries().size(),
                    feedPage.totalResultsHint().isPresent()
                            ? " (" + feedPage.totalResultsHint().getAsInt() + " total)"
                            : "");
            hasMore = feedPage.hasNextPage();
            page++;
        }

        List<DocumentStub> catalog = deduplicate(allEntries);
        INGESTION_LOG.info("[INGESTION] Discovered {} unique documents (from {} entries, {} pages)",
                catalog.size(), allEntries.size(), pagesRead);
        seedFileStore.writeCatalogIndex(catalog);
        INGESTION_LOG.info("[INGESTION] Catalog index saved to {}", seedFileStore.catalogIndexPath());
        return new DiscoveryOutcome(catalog, allEntries.size(), pagesRead, hitPageLimit);
    }

    /**
     * Deduplicates catalog entries by year and number; the first occurrence wins.
     */
    static List<DocumentStub> deduplicate(List<DocumentStub> entries) {
        Map<String, DocumentStub> unique = new LinkedHashMap<>();
        for (DocumentStub entry : entries) {
            unique.putIfAbsent(entry.catalogKey(), entry);
        }
        return new ArrayList<>(unique.values());
    }
}
