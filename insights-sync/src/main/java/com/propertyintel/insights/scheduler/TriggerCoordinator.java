package com.propertyintel.insights.scheduler;

import com.propertyintel.insights.model.Account;
import com.propertyintel.insights.model.SyncReport;
import com.propertyintel.insights.model.TriggerSource;
import com.propertyintel.insights.service.AccountProvider;
import com.propertyintel.insights.service.AccountSyncOrchestrator;
import com.propertyintel.insights.service.SyncPreconditionException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Single entry point for starting account syncs.
 *
 * Holds a registry of in-flight runs keyed by account id. A trigger for an
 * account already in the registry is dropped, not queued. Accepted runs execute
 * on the sync executor and the caller gets a future for the report straight away.
 * The registry entry is removed when the run ends, however it ends.
 */
@Component
@Slf4j
public class TriggerCoordinator {

    private final AccountProvider accountProvider;
    private final AccountSyncOrchestrator orchestrator;
    private final TaskExecutor executor;
    private final Clock clock;

    private final ConcurrentMap<String, InFlightRun> inFlight = new ConcurrentHashMap<>();
    private volatile boolean stopping;

    public TriggerCoordinator(AccountProvider accountProvider,
                              AccountSyncOrchestrator orchestrator,
                              @Qualifier("syncExecutor") TaskExecutor executor,
                              Clock clock) {
        this.accountProvider = accountProvider;
        this.orchestrator = orchestrator;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * @throws SyncPreconditionException if the account is unknown, inactive or lacks credentials
     */
    public TriggerResult trigger(String accountId, TriggerSource source) {
        if (stopping) {
            log.info("Ignoring {} trigger for {}: shutting down", source, accountId);
            return TriggerResult.rejected(accountId, source);
        }

        Account account = accountProvider.get(accountId)
                .orElseThrow(() -> new SyncPreconditionException(accountId, SyncPreconditionException.Reason.NOT_FOUND));
        SyncPreconditionException.check(account);

        InFlightRun run = new InFlightRun(source, clock.instant());
        InFlightRun existing = inFlight.putIfAbsent(accountId, run);
        if (existing != null) {
            log.info("Dropping {} trigger for {}: {} run in flight since {}",
                    source, accountId, existing.source(), existing.startedAt());
            return TriggerResult.dropped(accountId, source);
        }

        CompletableFuture<SyncReport> report = new CompletableFuture<>();
        try {
            executor.execute(() -> execute(account, source, run, report));
        } catch (TaskRejectedException e) {
            inFlight.remove(accountId, run);
            log.error("Executor rejected {} run for {}: {}", source, accountId, e.getMessage());
            throw e;
        }
        log.info("Accepted {} trigger for {}", source, accountId);
        return TriggerResult.accepted(accountId, source, report);
    }

    /** Account ids with a run in flight, sorted. */
    public Set<String> inFlight() {
        return new TreeSet<>(inFlight.keySet());
    }

    /** When the in-flight run for the account was accepted, if there is one. */
    public Optional<Instant> runningSince(String accountId) {
        return Optional.ofNullable(inFlight.get(accountId)).map(InFlightRun::startedAt);
    }

    public boolean isStopping() {
        return stopping;
    }

    /**
     * Stop accepting triggers and ask running syncs to stop after their current
     * listing. The sync executor then waits out the shutdown grace period.
     */
    @PreDestroy
    public void shutdown() {
        stopping = true;
        log.info("Trigger coordinator stopping; {} run(s) in flight: {}", inFlight.size(), inFlight());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /** The registry entry is released before the report future completes. */
    private void execute(Account account, TriggerSource source, InFlightRun run, CompletableFuture<SyncReport> report) {
        SyncReport result = null;
        RuntimeException failure = null;
        try {
            result = orchestrator.run(account, source, () -> stopping);
        } catch (RuntimeException e) {
            log.error("{} sync for {} failed: {}", source, account.getAccountId(), e.getMessage(), e);
            failure = e;
        } finally {
            inFlight.remove(account.getAccountId(), run);
        }
        if (failure != null) {
            report.completeExceptionally(failure);
        } else {
            report.complete(result);
        }
    }

    private record InFlightRun(TriggerSource source, Instant startedAt) {
    }
}
