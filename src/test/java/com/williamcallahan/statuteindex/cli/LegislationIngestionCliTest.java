package com.williamcallahan.statuteindex.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.williamcallahan.statuteindex.domain.ingestion.IngestionFailure;
import com.williamcallahan.statuteindex.domain.ingestion.IngestionRunOutcome;
import com.williamcallahan.statuteindex.domain.ingestion.UpdateCheckReport;
import com.williamcallahan.statuteindex.domain.ingestion.UpdateHit;
import com.williamcallahan.statuteindex.service.ingestion.LegislationFetchException;
import com.williamcallahan.statuteindex.service.ingestion.StatuteIngestionService;
import com.williamcallahan.statuteindex.service.ingestion.UpdateCheckService;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies exit codes of the batch entry point.
 */
class LegislationIngestionCliTest {

    private StatuteIngestionService ingestionService;
    private UpdateCheckService updateCheckService;
    private LegislationIngestionCli cli;

    @BeforeEach
    void setUp() {
        ingestionService = mock(StatuteIngestionService.class);
        updateCheckService = mock(UpdateCheckService.class);
        cli = new LegislationIngestionCli(ingestionService, updateCheckService);
    }

    @Test
    void run_ingestSucceedsEvenWithDocumentFailures() throws IOException {
        when(ingestionService.run(5, true)).thenReturn(IngestionRunOutcome.of(
                5, 1, 1, 40, List.of(new IngestionFailure("ukpga-2020-1", IngestionFailure.PHASE_FETCH, "HTTP 500"))));

        cli.run("ingest", "--limit", "5", "--skip-discovery");

        assertEquals(LegislationIngestionCli.EXIT_OK, cli.getExitCode());
        verify(ingestionService).run(5, true);
    }

    @Test
    void run_ingestAbortIsReported() throws IOException {
        when(ingestionService.run(null, false)).thenThrow(new IOException("disk full"));

        cli.run();

        assertEquals(LegislationIngestionCli.EXIT_INGEST_FAILED, cli.getExitCode());
    }

    @Test
    void run_checkUpdatesExitCodes() throws IOException {
        when(updateCheckService.check()).thenReturn(new UpdateCheckReport(10, 1, List.of(), List.of()));
        cli.run("check-updates");
        assertEquals(LegislationIngestionCli.EXIT_OK, cli.getExitCode());

        when(updateCheckService.check()).thenReturn(new UpdateCheckReport(
                10, 1, List.of(), List.of(new UpdateHit("ukpga-2024-3", "New Act 2024", "2024-02-01", null))));
        cli.run("check-updates");
        assertEquals(LegislationIngestionCli.EXIT_UPDATES_FOUND, cli.getExitCode());

        when(updateCheckService.check()).thenThrow(new LegislationFetchException("HTTP 502 on feed page 1"));
        cli.run("check-updates");
        assertEquals(LegislationIngestionCli.EXIT_CHECK_FAILED, cli.getExitCode());
    }

    @Test
    void run_usageErrorRunsNothing() {
        cli.run("rebuild");

        assertEquals(LegislationIngestionCli.EXIT_USAGE, cli.getExitCode());
        verifyNoInteractions(ingestionService, updateCheckService);
    }
}
