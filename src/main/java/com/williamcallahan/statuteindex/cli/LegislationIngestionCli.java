package com.williamcallahan.statuteindex.cli;

import com.williamcallahan.statuteindex.StatuteIndexApplication;
import com.williamcallahan.statuteindex.domain.ingestion.IngestionFailure;
import com.williamcallahan.statuteindex.domain.ingestion.IngestionRunOutcome;
import com.williamcallahan.statuteindex.domain.ingestion.UpdateCheckReport;
import com.williamcallahan.statuteindex.domain.ingestion.UpdateHit;
import com.williamcallahan.statuteindex.service.ingestion.StatuteIngestionService;
import com.williamcallahan.statuteindex.service.ingestion.UpdateCheckService;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Command-line entry point for the batch pipeline.
 *
 * <pre>
 *   ingest [--limit N] [--skip-discovery]
 *   check-updates
 * </pre>
 *
 * <p>{@code check-updates} exits 0 when nothing changed, 1 when updates were found and 2 when the
 * check itself failed. {@code ingest} exits 0 when the run completed (even with per-document
 * failures) and 1 when it aborted.</p>
 */
@Component
@ConditionalOnProperty(prefix = "app.cli", name = "enabled", havingValue = "true")
public class LegislationIngestionCli implements CommandLineRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(LegislationIngestionCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_UPDATES_FOUND = 1;
    static final int EXIT_INGEST_FAILED = 1;
    static final int EXIT_CHECK_FAILED = 2;
    static final int EXIT_USAGE = 2;
    private static final int MAX_LISTED_HITS = 20;

    private final StatuteIngestionService ingestionService;
    private final UpdateCheckService updateCheckService;
    private int exitCode = EXIT_OK;

    public LegislationIngestionCli(StatuteIngestionService ingestionService, UpdateCheckService updateCheckService) {
        this.ingestionService = ingestionService;
        this.updateCheckService = updateCheckService;
    }

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(StatuteIndexApplication.class);
        application.setWebApplicationType(WebApplicationType.NONE);
        application.setDefaultProperties(Map.of("app.cli.enabled", "true"));
        System.exit(SpringApplication.exit(application.run(args)));
    }

    @Override
    public void run(String... args) {
        IngestionArguments arguments;
        try {
            arguments = IngestionArguments.parse(args);
        } catch (IllegalArgumentException usageError) {
            log.error("{}. Usage: ingest [--limit N] [--skip-discovery] | check-updates", usageError.getMessage());
            exitCode = EXIT_USAGE;
            return;
        }
        exitCode = IngestionArguments.COMMAND_CHECK_UPDATES.equals(arguments.command())
                ? checkUpdates()
                : ingest(arguments);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int ingest(IngestionArguments arguments) {
        log.info("===============================================");
        log.info("Starting legislation ingestion");
        if (arguments.limit() != null) {
            log.info("  --limit {}", arguments.limit());
        }
        if (arguments.skipDiscovery()) {
            log.info("  --skip-discovery");
        }
        log.info("===============================================");
        try {
            IngestionRunOutcome outcome = ingestionService.run(arguments.limit(), arguments.skipDiscovery());
            log.info("Ingestion {}: processed {}, skipped {}, failed {}, provisions {}",
                    outcome.status(), outcome.processed(), outcome.skipped(), outcome.failed(), outcome.totalProvisions());
            for (IngestionFailure failure : outcome.failures()) {
                log.debug("  {} [{}] {}", failure.documentId(), failure.phase(), failure.details());
            }
            return EXIT_OK;
        } catch (Exception ingestionFailure) {
            log.error("Ingestion aborted: {}", ingestionFailure.getMessage(), ingestionFailure);
            return EXIT_INGEST_FAILED;
        }
    }

    int checkUpdates() {
        try {
            UpdateCheckReport report = updateCheckService.check();
            log.info("Updated documents: {}", report.updated().size());
            log.info("New documents:     {}", report.added().size());
            logHits("Updated upstream documents:", report.updated(), true);
            logHits("New upstream documents missing locally:", report.added(), false);
            if (report.hasChanges()) {
                return EXIT_UPDATES_FOUND;
            }
            log.info("No recent upstream changes detected in the checked window.");
            return EXIT_OK;
        } catch (Exception checkFailure) {
            log.error("Update check failed: {}", checkFailure.getMessage());
            return EXIT_CHECK_FAILED;
        }
    }

    private static void logHits(String heading, List<UpdateHit> hits, boolean showTimestamp) {
        if (hits.isEmpty()) {
            return;
        }
        log.info(heading);
        for (UpdateHit hit : hits.subList(0, Math.min(MAX_LISTED_HITS, hits.size()))) {
            log.info("  - {} ({})", hit.documentId(), showTimestamp ? hit.remoteUpdated() : hit.title());
        }
    }
}
