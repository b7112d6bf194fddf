package com.propertyintel.insights.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Per-run summary. Every listing that failed appears in {@link #listingsFailed},
 * even though partial failure does not fail the run.
 */
@Value
@Builder
public class SyncReport {

    String accountId;
    TriggerSource trigger;
    SyncWindow window;
    boolean firstRun;
    Instant startedAt;
    Instant completedAt;

    int listingsTotal;
    int listingsOk;
    List<ListingFailure> listingsFailed;
    List<ListingResult> results;

    /** Stopped early by shutdown; remaining listings were not attempted. */
    boolean aborted;

    /** Whether last_sync_at was written for this run. */
    boolean markedSynced;

    public int rowsWritten() {
        return results.stream().mapToInt(ListingResult::totalRows).sum();
    }

    public record ListingFailure(String listingId, String reason) {
    }
}
