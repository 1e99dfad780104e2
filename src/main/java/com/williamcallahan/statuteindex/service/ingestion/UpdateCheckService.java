package com.williamcallahan.statuteindex.service.ingestion;

import com.williamcallahan.statuteindex.config.AppProperties;
import com.williamcallahan.statuteindex.domain.ingestion.FetchResult;
import com.williamcallahan.statuteindex.domain.ingestion.UpdateCheckReport;
import com.williamcallahan.statuteindex.domain.ingestion.UpdateHit;
import com.williamcallahan.statuteindex.domain.legislation.DocumentStub;
import com.williamcallahan.statuteindex.domain.legislation.FeedPage;
import com.williamcallahan.statuteindex.domain.legislation.StoredDocument;
import com.williamcallahan.statuteindex.service.feed.AtomFeedReader;
import com.williamcallahan.statuteindex.service.store.ProvisionStore;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Compares the most recent feed pages with the local catalog to detect new and updated documents.
 *
 * <p>An upstream entry is new when its document is absent from the provision store, and updated
 * when its {@code updated} timestamp sorts after the one recorded in the cached catalog index.</p>
 */
@Service
public class UpdateCheckService {
    private static final Logger log = LoggerFactory.getLogger(UpdateCheckService.class);

    private final LegislationFetcher fetcher;
    private final AtomFeedReader feedReader;
    private final SeedFileStore seedFileStore;
    private final ProvisionStore provisionStore;
    private final int pageLimit;

    public UpdateCheckService(
            LegislationFetcher fetcher,
            AtomFeedReader feedReader,
            SeedFileStore seedFileStore,
            ProvisionStore provisionStore,
            AppProperties appProperties) {
        this.fetcher = fetcher;
        this.feedReader = feedReader;
        this.seedFileStore = seedFileStore;
        this.provisionStore = provisionStore;
        this.pageLimit = appProperties.getIngestion().getUpdateCheckPageLimit();
    }

    /**
     * Runs the check.
     *
     * @return new and updated documents within the scanned window
     * @throws IOException if the cached catalog index exists but cannot be read
     * @throws LegislationFetchException if a feed page cannot be fetched or returns a non-200 status
     */
    public UpdateCheckReport check() throws IOException {
        Set<String> localDocuments = provisionStore.documents().stream()
                .map(StoredDocument::id)
                .collect(Collectors.toSet());
        Map<String, DocumentStub> localIndex = new HashMap<>();
        for (DocumentStub entry : seedFileStore.readCatalogIndex().orElse(List.of())) {
            localIndex.put(entry.documentId(), entry);
        }

        List<DocumentStub> recent = new ArrayList<>();
        int pagesChecked = 0;
        for (int page = 1; page <= pageLimit; page++) {
            FetchResult result = fetcher.fetchFeedPage(page);
            if (!result.isOk()) {
                throw new LegislationFetchException("HTTP " + result.status() + " on feed page " + page);
            }
            FeedPage feedPage = feedReader.read(result.body());
            pagesChecked++;
            recent.addAll(feedPage.entries());
            if (!feedPage.hasNextPage()) {
                break;
            }
        }
        log.info("Checked {} upstream entries from {} page(s)", recent.size(), pagesChecked);

        List<UpdateHit> updated = new ArrayList<>();
        List<UpdateHit> added = new ArrayList<>();
        for (DocumentStub entry : recent) {
            String documentId = entry.documentId();
            if (!localDocuments.contains(documentId)) {
                added.add(new UpdateHit(documentId, entry.title(), entry.updated(), null));
                continue;
            }
            DocumentStub cached = localIndex.get(documentId);
            if (cached != null && !cached.updated().isEmpty() && entry.updated().compareTo(cached.updated()) > 0) {
                updated.add(new UpdateHit(documentId, entry.title(), entry.updated(), cached.updated()));
            }
        }
        return new UpdateCheckReport(recent.size(), pagesChecked, updated, added);
    }
}
