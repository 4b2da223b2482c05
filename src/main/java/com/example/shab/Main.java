package com.example.shab;

import lombok.extern.slf4j.Slf4j;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * {@code bootstrap <ids-file>} ingests every identifier of a file once;
 * {@code schedule} (the default) runs {@link IngestJob} on the configured cron.
 */
@Slf4j
public class Main {

    public static void main(String[] args) {
        String command = args.length > 0 ? args[0] : "schedule";
        try {
            AppContext.init();
            switch (command) {
                case "bootstrap":
                    if (args.length < 2) {
                        System.err.println("Usage: bootstrap <ids-file>");
                        System.exit(2);
                    }
                    System.exit(bootstrap(Paths.get(args[1])));
                    break;
                case "schedule":
                    schedule();
                    break;
                default:
                    System.err.println("Unknown command: " + command + " (expected bootstrap or schedule)");
                    System.exit(2);
            }
        } catch (ConfigurationException e) {
            log.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    private static int bootstrap(Path idsFile) {
        List<String> ids;
        try {
            ids = BootstrapOrchestrator.readIdentifiers(idsFile);
        } catch (IOException e) {
            log.error("Error reading identifier file {}: {}", idsFile, e.getMessage());
            return 1;
        }
        BootstrapOrchestrator orchestrator = AppContext.getOrchestrator();
        Thread stopHook = new Thread(orchestrator::requestStop, "bootstrap-stop");
        Runtime.getRuntime().addShutdownHook(stopHook);
        BatchStatistics stats = orchestrator.run(ids, Config.getBatchSize(), Config.getInterBatchDelay());
        Runtime.getRuntime().removeShutdownHook(stopHook);

        System.out.println("Total:               " + stats.getTotal());
        System.out.println("Inserted:            " + stats.getInserted());
        System.out.println("Skipped (duplicate): " + stats.getSkippedDuplicate());
        System.out.println("Skipped (no auction): " + stats.getSkippedNonAuction());
        System.out.println("Errors:              " + stats.getErrored());
        if (stats.getNotProcessed() > 0) {
            System.out.println("Not processed:       " + stats.getNotProcessed());
        }
        for (IngestionResult result : stats.getResults()) {
            if (result.isError()) {
                System.out.println("  " + result.getPublicationId() + " " + result.getErrorKind() + ": " + result.getDetail());
            }
        }
        return stats.getErrored() == 0 ? 0 : 3;
    }

    private static void schedule() {
        Scheduler scheduler = IngestJob.scheduleJob(Config.getCron());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            AppContext.getOrchestrator().requestStop();
            try {
                scheduler.shutdown(true);
            } catch (SchedulerException e) {
                log.error("Error stopping scheduler: {}", e.getMessage());
            }
        }, "scheduler-stop"));
        log.info("Ingestion scheduler running");
    }
}
