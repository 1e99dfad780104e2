package com.williamcallahan.statuteindex.service.ingestion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.williamcallahan.statuteindex.config.AppProperties;
import com.williamcallahan.statuteindex.domain.ingestion.FetchResult;
import com.williamcallahan.statuteindex.domain.ingestion.IngestionFailure;
import com.williamcallahan.statuteindex.domain.ingestion.IngestionRunOutcome;
import com.williamcallahan.statuteindex.domain.legislation.DocumentStub;
import com.williamcallahan.statuteindex.service.feed.AtomFeedReader;
import com.williamcallahan.statuteindex.service.markup.AknStatuteParser;
import com.williamcallahan.statuteindex.service.markup.InlineMarkupFlattener;
import com.williamcallahan.statuteindex.service.markup.ProvisionTreeWalker;
import com.williamcallahan.statuteindex.service.store.InMemoryProvisionStore;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies incremental content ingestion and per-document failure isolation.
 */
class StatuteIngestionServiceTest {

    private static final String MARKUP = "<akomaNtoso><act><body>"
            + "<section eId=\"section-1\"><num>1</num><heading>Purpose</heading>"
            + "<subsection eId=\"section-1-1\"><num>(1)</num><content><p>First.</p></content></subsection>"
            + "<subsection eId=\"section-1-2\"><num>(2)</num><content><p>Second.</p></content></subsection>"
            + "</section></body></act></akomaNtoso>";

    @TempDir
    Path tempDir;

    private LegislationFetcher fetcher;
    private SeedFileStore seedFileStore;
    private InMemoryProvisionStore store;
    private CatalogDiscoveryService discoveryService;
    private StatuteIngestionService ingestionService;

    @BeforeEach
    void setUp() {
        fetcher = mock(LegislationFetcher.class);
        seedFileStore = new SeedFileStore(tempDir.resolve("source"), tempDir.resolve("seed"), "ukpga");
        store = new InMemoryProvisionStore();
        discoveryService = new CatalogDiscoveryService(
                fetcher, new AtomFeedReader("https://www.legislation.gov.uk", "ukpga"), seedFileStore, new AppProperties());
        ingestionService = new StatuteIngestionService(
                discoveryService,
                fetcher,
                new AknStatuteParser(new InlineMarkupFlattener(), new ProvisionTreeWalker()),
                seedFileStore,
                store);
    }

    private static DocumentStub stub(int year, int number) {
        return new DocumentStub("ukpga", year, number, "Example Act " + year, "https://example.test/" + number, "");
    }

    @Test
    void ingest_parsesWritesSeedsAndFillsStore() {
        when(fetcher.fetchDocumentMarkup(2020, 1)).thenReturn(new FetchResult(200, MARKUP, "application/xml"));

        IngestionRunOutcome outcome = ingestionService.ingest(List.of(stub(2020, 1)), null);

        assertEquals("success", outcome.status());
        assertEquals(1, outcome.processed());
        assertEquals(2, outcome.totalProvisions());
        assertTrue(seedFileStore.hasSeed(stub(2020, 1)));
        assertTrue(store.findProvision("ukpga-2020-1", "s1(2)").isPresent());
    }

    @Test
    void ingest_skipsDocumentsThatAlreadyHaveSeeds() throws IOException {
        when(fetcher.fetchDocumentMarkup(2020, 1)).thenReturn(new FetchResult(200, MARKUP, ""));
        ingestionService.ingest(List.of(stub(2020, 1)), null);

        IngestionRunOutcome second = ingestionService.ingest(List.of(stub(2020, 1)), null);

        assertEquals(1, second.processed());
        assertEquals(1, second.skipped());
        assertEquals(0, second.totalProvisions());
        verify(fetcher, times(1)).fetchDocumentMarkup(2020, 1);
    }

    @Test
    void ingest_continuesPastFailingDocuments() {
        when(fetcher.fetchDocumentMarkup(2020, 1)).thenThrow(new LegislationFetchException("u", "timed out", null));
        when(fetcher.fetchDocumentMarkup(2020, 2)).thenReturn(new FetchResult(500, "", ""));
        when(fetcher.fetchDocumentMarkup(2020, 3)).thenReturn(new FetchResult(200, MARKUP, ""));

        IngestionRunOutcome outcome = ingestionService.ingest(List.of(stub(2020, 1), stub(2020, 2), stub(2020, 3)), null);

        assertEquals("partial-success", outcome.status());
        assertEquals(3, outcome.processed());
        assertEquals(2, outcome.failed());
        assertEquals(2, outcome.totalProvisions());
        assertEquals(List.of("ukpga-2020-1", "ukpga-2020-2"),
                outcome.failures().stream().map(IngestionFailure::documentId).toList());
        assertEquals("HTTP 500", outcome.failures().get(1).details());
    }

    @Test
    void ingest_writesPlaceholderForDocumentsWithoutMarkup() {
        when(fetcher.fetchDocumentMarkup(1850, 4)).thenReturn(new FetchResult(404, "", ""));

        IngestionRunOutcome outcome = ingestionService.ingest(List.of(stub(1850, 4)), null);

        assertEquals(1, outcome.failed());
        assertEquals(IngestionFailure.PHASE_FETCH, outcome.failures().get(0).phase());
        assertTrue(seedFileStore.hasSeed(stub(1850, 4)));
        assertTrue(store.findDocument("ukpga-1850-4").isPresent());
        assertTrue(store.provisions("ukpga-1850-4").isEmpty());
    }

    @Test
    void ingest_recordsParseFailures() {
        AknStatuteParser failingParser = mock(AknStatuteParser.class);
        when(failingParser.parse(anyString(), any()))
                .thenThrow(new IllegalStateException("broken markup"));
        when(fetcher.fetchDocumentMarkup(2020, 1)).thenReturn(new FetchResult(200, MARKUP, ""));
        StatuteIngestionService service =
                new StatuteIngestionService(discoveryService, fetcher, failingParser, seedFileStore, store);

        IngestionRunOutcome outcome = service.ingest(List.of(stub(2020, 1)), null);

        assertEquals(IngestionFailure.PHASE_PARSE, outcome.failures().get(0).phase());
        assertEquals("broken markup", outcome.failures().get(0).details());
    }

    @Test
    void ingest_honoursLimit() {
        when(fetcher.fetchDocumentMarkup(anyInt(), anyInt())).thenReturn(new FetchResult(200, MARKUP, ""));

        IngestionRunOutcome outcome =
                ingestionService.ingest(List.of(stub(2020, 1), stub(2020, 2), stub(2020, 3)), 2);

        assertEquals(2, outcome.processed());
        verify(fetcher, never()).fetchDocumentMarkup(2020, 3);
    }

    @Test
    void ingest_zeroLimitProcessesWholeCatalog() {
        when(fetcher.fetchDocumentMarkup(anyInt(), anyInt())).thenReturn(new FetchResult(200, MARKUP, ""));

        IngestionRunOutcome outcome =
                ingestionService.ingest(List.of(stub(2020, 1), stub(2020, 2), stub(2020, 3)), 0);

        assertEquals(3, outcome.processed());
        verify(fetcher).fetchDocumentMarkup(2020, 3);
    }

    @Test
    void run_reusesCachedCatalogWhenSkippingDiscovery() throws IOException {
        seedFileStore.writeCatalogIndex(List.of(stub(2020, 1)));
        when(fetcher.fetchDocumentMarkup(2020, 1)).thenReturn(new FetchResult(200, MARKUP, ""));

        IngestionRunOutcome outcome = ingestionService.run(null, true);

        assertEquals(1, outcome.processed());
        verify(fetcher, never()).fetchFeedPage(anyInt());
    }

    @Test
    void run_discoversWhenNoCachedCatalogExists() throws IOException {
        when(fetcher.fetchFeedPage(1)).thenReturn(new FetchResult(200,
                CatalogDiscoveryServiceTest.feedPage(false, "2020/1"), ""));
        when(fetcher.fetchDocumentMarkup(2020, 1)).thenReturn(new FetchResult(200, MARKUP, ""));

        IngestionRunOutcome outcome = ingestionService.run(null, true);

        assertEquals(1, outcome.processed());
        assertTrue(seedFileStore.readCatalogIndex().isPresent());
    }
}
