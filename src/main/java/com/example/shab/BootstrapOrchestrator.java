package com.example.shab;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs {@link IngestionService} over a list of identifiers in fixed-size batches. Each batch runs
 * on a pool as wide as the batch; the next batch starts only after every identifier of the
 * current one has a result, and after the inter-batch delay.
 */
@Slf4j
public class BootstrapOrchestrator {
    public static final String MDC_BATCH = "batch";

    private final IngestionService ingestionService;
    private final int maxAttempts;
    private final Duration retryBackoff;
    private final AtomicBoolean stopRequested = new AtomicBoolean();

    public BootstrapOrchestrator(IngestionService ingestionService, int maxAttempts, Duration retryBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.ingestionService = ingestionService;
        this.maxAttempts = maxAttempts;
        this.retryBackoff = retryBackoff;
    }

    /**
     * Stops scheduling new batches. The batch in flight still completes. The flag is sticky:
     * later runs on this instance return without processing anything.
     */
    public void requestStop() {
        stopRequested.set(true);
        log.info("Stop requested, no further batches will be started");
    }

    public BatchStatistics run(List<String> identifiers, int batchSize, Duration interBatchDelay) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        List<String> ids = new ArrayList<>();
        for (String raw : identifiers) {
            String id = IngestionService.cleanId(raw);
            if (id != null) {
                ids.add(id);
            }
        }
        BatchStatistics stats = new BatchStatistics(ids.size());
        int batches = (ids.size() + batchSize - 1) / batchSize;
        log.info("Starting ingestion of {} publication(s) in {} batch(es) of up to {}", ids.size(), batches, batchSize);

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(batchSize, Math.max(ids.size(), 1)));
        try {
            for (int b = 0; b < batches; b++) {
                if (stopRequested.get()) {
                    log.warn("Stopping before batch {}/{}", b + 1, batches);
                    break;
                }
                if (b > 0 && !pause(interBatchDelay)) {
                    break;
                }
                List<String> batch = ids.subList(b * batchSize, Math.min((b + 1) * batchSize, ids.size()));
                MDC.put(MDC_BATCH, String.valueOf(b + 1));
                try {
                    runBatch(pool, batch, stats);
                } finally {
                    MDC.remove(MDC_BATCH);
                }
                log.info("Batch {}/{} done: {}", b + 1, batches, stats);
            }
        } finally {
            pool.shutdown();
        }
        log.info("Ingestion finished: {}", stats);
        return stats;
    }

    private void runBatch(ExecutorService pool, List<String> batch, BatchStatistics stats) {
        List<Future<IngestionResult>> futures = new ArrayList<>();
        for (String id : batch) {
            futures.add(pool.submit(withMdc(() -> ingestWithRetry(id))));
        }
        for (int i = 0; i < futures.size(); i++) {
            stats.record(await(batch.get(i), futures.get(i)));
        }
    }

    private IngestionResult await(String id, Future<IngestionResult> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.error("Worker for {} failed: {}", id, e.getCause().getMessage(), e.getCause());
            return IngestionResult.error(id, IngestionResult.ErrorKind.UNEXPECTED, e.getCause().toString());
        } catch (InterruptedException e) {
            requestStop();
            return awaitUninterruptibly(id, future);
        }
    }

    // in-flight identifiers always finish; the interrupt is restored once they have
    private IngestionResult awaitUninterruptibly(String id, Future<IngestionResult> future) {
        try {
            while (true) {
                try {
                    return future.get();
                } catch (InterruptedException e) {
                    log.debug("Still waiting for {} after interrupt", id);
                } catch (ExecutionException e) {
                    return IngestionResult.error(id, IngestionResult.ErrorKind.UNEXPECTED, e.getCause().toString());
                }
            }
        } finally {
            Thread.currentThread().interrupt();
        }
    }

    IngestionResult ingestWithRetry(String id) throws InterruptedException {
        IngestionResult result = ingestionService.ingest(id);
        int attempt = 1;
        while (result.isRetryable() && attempt < maxAttempts && !stopRequested.get()) {
            log.warn("Attempt {}/{} for {} failed ({}), retrying in {} ms", attempt, maxAttempts, id,
                    result.getErrorKind(), retryBackoff.toMillis());
            Thread.sleep(retryBackoff.toMillis() * attempt);
            attempt++;
            result = ingestionService.ingest(id);
        }
        return result.withAttempts(attempt);
    }

    private boolean pause(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted between batches, stopping");
            stopRequested.set(true);
            return false;
        }
    }

    private static <T> Callable<T> withMdc(Callable<T> task) {
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();
        return () -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                return task.call();
            } finally {
                MDC.clear();
            }
        };
    }

    /**
     * Reads one identifier per line. Blank lines and lines starting with '#' are ignored.
     */
    public static List<String> readIdentifiers(Path file) throws IOException {
        List<String> ids = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                ids.add(trimmed);
            }
        }
        return ids;
    }
}
