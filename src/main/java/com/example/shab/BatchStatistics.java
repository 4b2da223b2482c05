package com.example.shab;

import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Aggregate counters of one orchestrator run. {@link #getResults()} follows input order.
 */
@Getter
@ToString(exclude = "results")
public class BatchStatistics {
    private final int total;
    private int inserted;
    private int skippedDuplicate;
    private int skippedNonAuction;
    private int errored;
    /** Identifiers never attempted because a stop was requested. */
    private int notProcessed;
    private final List<IngestionResult> results = new ArrayList<>();

    public BatchStatistics(int total) {
        this.total = total;
        this.notProcessed = total;
    }

    void record(IngestionResult result) {
        results.add(result);
        notProcessed--;
        switch (result.getStatus()) {
            case INSERTED:
                inserted++;
                break;
            case SKIPPED_DUPLICATE:
                skippedDuplicate++;
                break;
            case SKIPPED_NON_AUCTION:
                skippedNonAuction++;
                break;
            default:
                errored++;
        }
    }

    public int getProcessed() {
        return inserted + skippedDuplicate + skippedNonAuction + errored;
    }

    public List<IngestionResult> getResults() {
        return Collections.unmodifiableList(results);
    }
}
