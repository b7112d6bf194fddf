package com.propertyintel.insights.service;

import com.propertyintel.insights.client.ListingClient;
import com.propertyintel.insights.client.exception.UpstreamException;
import com.propertyintel.insights.config.InsightsSyncProperties;
import com.propertyintel.insights.model.Account;
import com.propertyintel.insights.model.ListingRef;
import com.propertyintel.insights.model.ListingResult;
import com.propertyintel.insights.model.SyncReport;
import com.propertyintel.insights.model.SyncWindow;
import com.propertyintel.insights.model.TriggerSource;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.BooleanSupplier;

/**
 * Runs one account's sync: Planning → Enumerating → PerListing → Finalizing.
 *
 * Only precondition and enumeration failures escape as exceptions. Every
 * listing failure is captured in the report and iteration carries on.
 * last_sync_at is written once, after every listing has been attempted, unless
 * the run was stopped early or the service is in dry-run mode.
 */
@Service
@Slf4j
public class AccountSyncOrchestrator {

    private final AccountProvider accountProvider;
    private final ListingClient listingClient;
    private final ListingSyncUnit listingSyncUnit;
    private final WindowPlanner windowPlanner;
    private final InsightsSyncProperties properties;
    private final Clock clock;

    public AccountSyncOrchestrator(AccountProvider accountProvider,
                                   ListingClient listingClient,
                                   ListingSyncUnit listingSyncUnit,
                                   WindowPlanner windowPlanner,
                                   InsightsSyncProperties properties,
                                   Clock clock) {
        if (properties.getSync().getListingParallelism() < 1) {
            throw new IllegalStateException("insights-sync.sync.listing-parallelism must be at least 1, was "
                    + properties.getSync().getListingParallelism());
        }
        this.accountProvider = accountProvider;
        this.listingClient = listingClient;
        this.listingSyncUnit = listingSyncUnit;
        this.windowPlanner = windowPlanner;
        this.properties = properties;
        this.clock = clock;
    }

    public SyncReport run(Account account, TriggerSource trigger) {
        return run(account, trigger, () -> false);
    }

    /**
     * @param stopRequested polled before each listing; once true no further listings start
     */
    public SyncReport run(Account account, TriggerSource trigger, BooleanSupplier stopRequested) {
        SyncPreconditionException.check(account);
        String accountId = account.getAccountId();
        MDC.put("accountId", accountId);
        MDC.put("trigger", trigger.name());
        try {
            Instant startedAt = clock.instant();
            LocalDate today = LocalDate.now(clock.withZone(properties.getScheduling().getZone()));

            // Planning
            boolean firstRun = account.syncState().isFirstRun();
            SyncWindow window = windowPlanner.plan(firstRun, today);
            log.info("Sync start: account={} trigger={} window={} firstRun={}", accountId, trigger, window, firstRun);

            // Enumerating
            List<ListingRef> listings = enumerate(account, window);

            // PerListing
            List<ListingResult> results = properties.getSync().getListingParallelism() > 1 && listings.size() > 1
                    ? runParallel(account, listings, window, today, stopRequested)
                    : runSequential(account, listings, window, today, stopRequested);
            boolean aborted = results.size() < listings.size();

            // Finalizing
            Instant completedAt = clock.instant();
            boolean marked = false;
            if (aborted) {
                log.warn("Sync stopped after {}/{} listings; last_sync_at left unchanged", results.size(), listings.size());
            } else if (properties.getSync().isDryRun()) {
                log.info("[DRY RUN] Skipping last_sync_at update");
            } else {
                accountProvider.markSynced(accountId, completedAt);
                marked = true;
            }

            SyncReport report = report(account, trigger, window, firstRun, startedAt, completedAt,
                    listings.size(), results, aborted, marked);
            log.info("Sync done: account={} listings={} ok={} failed={} rows={} aborted={}",
                    accountId, report.getListingsTotal(), report.getListingsOk(),
                    report.getListingsFailed().size(), report.rowsWritten(), aborted);
            return report;
        } finally {
            MDC.remove("accountId");
            MDC.remove("trigger");
        }
    }

    // ── Phases ───────────────────────────────────────────────────────────────

    private List<ListingRef> enumerate(Account account, SyncWindow window) {
        List<ListingRef> listings;
        try {
            listings = listingClient.listListings(account, window);
        } catch (UpstreamException e) {
            log.error("Listing enumeration failed for {}: {}", account.getAccountId(), e.getMessage());
            throw new ListingEnumerationException(account.getAccountId(), e);
        }
        List<ListingRef> sorted = new ArrayList<>(listings);
        sorted.sort(Comparator.comparing(ListingRef::listingId));
        log.info("Enumerated {} listings", sorted.size());
        return sorted;
    }

    private List<ListingResult> runSequential(Account account, List<ListingRef> listings, SyncWindow window,
                                              LocalDate today, BooleanSupplier stopRequested) {
        List<ListingResult> results = new ArrayList<>(listings.size());
        for (ListingRef listing : listings) {
            if (stopRequested.getAsBoolean()) break;
            results.add(runListing(account, listing, window, today));
        }
        return results;
    }

    /**
     * Up to listing-parallelism listings at once on a pool owned by this run.
     * Results come back in listing order; listings skipped because of a stop
     * request are left out.
     */
    private List<ListingResult> runParallel(Account account, List<ListingRef> listings, SyncWindow window,
                                            LocalDate today, BooleanSupplier stopRequested) {
        int threads = Math.min(properties.getSync().getListingParallelism(), listings.size());
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<ListingResult>> futures = new ArrayList<>(listings.size());
            for (ListingRef listing : listings) {
                futures.add(pool.submit(() -> {
                    if (stopRequested.getAsBoolean()) return null;
                    if (mdc != null) MDC.setContextMap(mdc);
                    try {
                        return runListing(account, listing, window, today);
                    } finally {
                        MDC.clear();
                    }
                }));
            }

            List<ListingResult> results = new ArrayList<>(listings.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    ListingResult result = futures.get(i).get();
                    if (result != null) results.add(result);
                } catch (InterruptedException e) {
                    // Treated as a stop: unfinished listings are left out so the run counts as aborted.
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while awaiting listings; cancelling {} remaining", futures.size() - i);
                    futures.subList(i, futures.size()).forEach(f -> f.cancel(true));
                    break;
                } catch (ExecutionException e) {
                    results.add(ListingResult.failed(listings.get(i),
                            "unexpected: " + e.getCause().getMessage(), Map.of()));
                }
            }
            return results;
        } finally {
            pool.shutdown();
        }
    }

    private ListingResult runListing(Account account, ListingRef listing, SyncWindow window, LocalDate today) {
        try {
            return listingSyncUnit.run(account, listing, window, today);
        } catch (RuntimeException e) {
            log.warn("Listing {} failed unexpectedly: {}", listing.listingId(), e.getMessage(), e);
            return ListingResult.failed(listing, "unexpected: " + e.getMessage(), Map.of());
        }
    }

    private SyncReport report(Account account, TriggerSource trigger, SyncWindow window, boolean firstRun,
                              Instant startedAt, Instant completedAt, int total,
                              List<ListingResult> results, boolean aborted, boolean marked) {
        List<SyncReport.ListingFailure> failures = results.stream()
                .filter(r -> !r.ok())
                .map(r -> new SyncReport.ListingFailure(r.listing().listingId(), r.reason()))
                .toList();
        return SyncReport.builder()
                .accountId(account.getAccountId())
                .trigger(trigger)
                .window(window)
                .firstRun(firstRun)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .listingsTotal(total)
                .listingsOk((int) results.stream().filter(ListingResult::ok).count())
                .listingsFailed(failures)
                .results(List.copyOf(results))
                .aborted(aborted)
                .markedSynced(marked)
                .build();
    }
}
