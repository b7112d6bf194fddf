package com.propertyintel.insights.scheduler;

import com.propertyintel.insights.model.SyncReport;
import com.propertyintel.insights.model.TriggerSource;

import java.util.concurrent.CompletableFuture;

/**
 * What happened to a trigger. {@code report} is only set when the run was accepted.
 */
public record TriggerResult(String accountId, TriggerSource source, Outcome outcome,
                            CompletableFuture<SyncReport> report) {

    public enum Outcome {
        ACCEPTED,
        /** A run for this account was already in flight. */
        DROPPED,
        /** The service is shutting down. */
        REJECTED
    }

    static TriggerResult accepted(String accountId, TriggerSource source, CompletableFuture<SyncReport> report) {
        return new TriggerResult(accountId, source, Outcome.ACCEPTED, report);
    }

    static TriggerResult dropped(String accountId, TriggerSource source) {
        return new TriggerResult(accountId, source, Outcome.DROPPED, null);
    }

    static TriggerResult rejected(String accountId, TriggerSource source) {
        return new TriggerResult(accountId, source, Outcome.REJECTED, null);
    }

    public boolean isAccepted() {
        return outcome == Outcome.ACCEPTED;
    }
}
