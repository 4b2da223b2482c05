package com.example.shab;

import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.quartz.*;
import org.quartz.impl.StdSchedulerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Periodic re-run of the orchestrator over the configured identifier file. Stored
 * publications are skipped, so each run only ingests what is new in the file.
 */
@NoArgsConstructor
@Slf4j
@DisallowConcurrentExecution
public class IngestJob implements Job {

    @Override
    public void execute(JobExecutionContext context) throws JobExecutionException {
        Path idsFile = Paths.get(Config.getIdsFile());
        if (!Files.exists(idsFile)) {
            log.warn("Identifier file {} not found, nothing to ingest", idsFile);
            return;
        }
        log.info("Starting scheduled ingestion from {}", idsFile);
        try {
            List<String> ids = BootstrapOrchestrator.readIdentifiers(idsFile);
            BatchStatistics stats = AppContext.getOrchestrator().run(ids, Config.getBatchSize(), Config.getInterBatchDelay());
            log.info("Job completed: {}", stats);
        } catch (IOException e) {
            log.error("Error reading identifier file {}: {}", idsFile, e.getMessage());
            throw new JobExecutionException(e);
        }
    }

    public static Scheduler scheduleJob(String cron) {
        try {
            Scheduler scheduler = StdSchedulerFactory.getDefaultScheduler();
            scheduler.start();

            JobDetail job = JobBuilder.newJob(IngestJob.class)
                    .withIdentity("ingestJob", "shab")
                    .build();

            Trigger trigger = TriggerBuilder.newTrigger()
                    .withIdentity("ingestTrigger", "shab")
                    .withSchedule(CronScheduleBuilder.cronSchedule(cron))
                    .build();

            scheduler.scheduleJob(job, trigger);
            log.info("Scheduler started with cron '{}'", cron);
            return scheduler;
        } catch (SchedulerException | RuntimeException e) {
            throw new ConfigurationException("Error scheduling ingestion job with cron '" + cron + "': " + e.getMessage(), e);
        }
    }
}
