package com.williamcallahan.statuteindex.service.ingestion;

import com.williamcallahan.statuteindex.domain.ingestion.FetchResult;
import com.williamcallahan.statuteindex.domain.ingestion.IngestionFailure;
import com.williamcallahan.statuteindex.domain.ingestion.IngestionRunOutcome;
import com.williamcallahan.statuteindex.domain.legislation.DocumentStub;
import com.williamcallahan.statuteindex.domain.legislation.ParsedStatute;
import com.williamcallahan.statuteindex.service.markup.AknStatuteParser;
import com.williamcallahan.statuteindex.service.store.ProvisionStore;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Two-phase ingestion: catalog discovery (or a cached catalog index), then one markup fetch,
 * parse and seed write per catalog entry.
 *
 * <p>Content ingestion is incremental: documents whose seed file already exists are skipped.
 * Documents with no markup rendition get a placeholder seed so they are not requested again.
 * A failing document is recorded and the run continues with the next one.</p>
 */
@Service
public class StatuteIngestionService {
    private static final Logger INGESTION_LOG = LoggerFactory.getLogger("INGESTION");

    private static final int PROGRESS_INTERVAL = 100;

    private final CatalogDiscoveryService discoveryService;
    private final LegislationFetcher fetcher;
    private final AknStatuteParser statuteParser;
    private final SeedFileStore seedFileStore;
    private final ProvisionStore provisionStore;

    public StatuteIngestionService(
            CatalogDiscoveryService discoveryService,
            LegislationFetcher fetcher,
            AknStatuteParser statuteParser,
            SeedFileStore seedFileStore,
            ProvisionStore provisionStore) {
        this.discoveryService = discoveryService;
        this.fetcher = fetcher;
        this.statuteParser = statuteParser;
        this.seedFileStore = seedFileStore;
        this.provisionStore = provisionStore;
    }

    /**
     * Runs discovery (unless a cached catalog may be reused) followed by content ingestion.
     *
     * @param limit maximum number of catalog entries to process; null or non-positive for all
     * @param skipDiscovery reuse the cached catalog index when one exists
     * @return counters and per-document failures
     * @throws IOException if the catalog index cannot be read or written
     */
    public IngestionRunOutcome run(Integer limit, boolean skipDiscovery) throws IOException {
        List<DocumentStub> catalog;
        Optional<List<DocumentStub>> cached = skipDiscovery ? seedFileStore.readCatalogIndex() : Optional.empty();
        if (cached.isPresent()) {
            catalog = cached.get();
            INGESTION_LOG.info("[INGESTION] Using cached catalog index {} ({} documents)",
                    seedFileStore.catalogIndexPath(), catalog.size());
        } else {
            if (skipDiscovery) {
                INGESTION_LOG.info("[INGESTION] No cached catalog index, running discovery");
            }
            catalog = discoveryService.discover().documents();
        }
        return ingest(catalog, limit);
    }

    /**
     * Fetches, parses and stores each catalog entry.
     *
     * @param catalog documents to ingest in order
     * @param limit maximum number of entries to process; null or non-positive for all
     * @return counters and per-document failures
     */
    public IngestionRunOutcome ingest(List<DocumentStub> catalog, Integer limit) {
        List<DocumentStub> toProcess =
                limit != null && limit > 0 && limit < catalog.size() ? catalog.subList(0, limit) : catalog;
        INGESTION_LOG.info("[INGESTION] Fetching content for {} documents", toProcess.size());

        int processed = 0;
        int skipped = 0;
        int totalProvisions = 0;
        List<IngestionFailure> failures = new ArrayList<>();

        for (DocumentStub stub : toProcess) {
            if (seedFileStore.hasSeed(stub)) {
                skipped++;
            } else {
                Optional<ParsedStatute> ingested = ingestOne(stub, failures);
                if (ingested.isPresent()) {
                    totalProvisions += ingested.get().provisions().size();
                }
            }
            processed++;
            if (processed % PROGRESS_INTERVAL == 0) {
                INGESTION_LOG.info("[INGESTION] Progress: {}/{} ({} skipped, {} failed, {} provisions)",
                        processed, toProcess.size(), skipped, failures.size(), totalProvisions);
            }
        }

        IngestionRunOutcome outcome =
                IngestionRunOutcome.of(processed, skipped, failures.size(), totalProvisions, failures);
        INGESTION_LOG.info("[INGESTION] Content phase complete: processed {}, skipped {}, failed {}, provisions {}",
                outcome.processed(), outcome.skipped(), outcome.failed(), outcome.totalProvisions());
        return outcome;
    }

    private Optional<ParsedStatute> ingestOne(DocumentStub stub, List<IngestionFailure> failures) {
        String documentId = stub.documentId();
        FetchResult result;
        try {
            result = fetcher.fetchDocumentMarkup(stub.year(), stub.number());
        } catch (LegislationFetchException fetchFailure) {
            INGESTION_LOG.error("[INGESTION] ✗ Fetch failed for {}: {}", documentId, fetchFailure.getMessage());
            failures.add(new IngestionFailure(documentId, IngestionFailure.PHASE_FETCH, String.valueOf(fetchFailure.getMessage())));
            return Optional.empty();
        }

        if (!result.isOk()) {
            if (result.isUnavailable()) {
                ParsedStatute placeholder = ParsedStatute.placeholder(stub);
                if (writeSeed(stub, placeholder, failures)) {
                    provisionStore.save(placeholder);
                    failures.add(new IngestionFailure(documentId, IngestionFailure.PHASE_FETCH,
                            "HTTP " + result.status() + ": no markup rendition, placeholder seed written"));
                }
            } else {
                INGESTION_LOG.error("[INGESTION] ✗ HTTP {} for {}", result.status(), documentId);
                failures.add(new IngestionFailure(documentId, IngestionFailure.PHASE_FETCH, "HTTP " + result.status()));
            }
            return Optional.empty();
        }

        ParsedStatute statute;
        try {
            statute = statuteParser.parse(result.body(), stub);
        } catch (RuntimeException parseFailure) {
            INGESTION_LOG.error("[INGESTION] ✗ Parse failed for {}: {}", documentId, parseFailure.getMessage());
            failures.add(new IngestionFailure(documentId, IngestionFailure.PHASE_PARSE, String.valueOf(parseFailure.getMessage())));
            return Optional.empty();
        }

        if (!writeSeed(stub, statute, failures)) {
            return Optional.empty();
        }
        provisionStore.save(statute);
        INGESTION_LOG.debug("[INGESTION] ✓ {} with {} provisions", documentId, statute.provisions().size());
        return Optional.of(statute);
    }

    private boolean writeSeed(DocumentStub stub, ParsedStatute statute, List<IngestionFailure> failures) {
        try {
            seedFileStore.writeSeed(stub, statute);
            return true;
        } catch (IOException writeFailure) {
            INGESTION_LOG.error("[INGESTION] ✗ Could not write seed {}: {}",
                    seedFileStore.seedPath(stub), writeFailure.getMessage());
            failures.add(new IngestionFailure(stub.documentId(), IngestionFailure.PHASE_WRITE, String.valueOf(writeFailure.getMessage())));
            return false;
        }
    }
}
