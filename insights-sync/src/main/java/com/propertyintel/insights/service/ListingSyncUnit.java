package com.propertyintel.insights.service;

import com.propertyintel.insights.client.MetricsClient;
import com.propertyintel.insights.config.InsightsSyncProperties;
import com.propertyintel.insights.model.Account;
import com.propertyintel.insights.model.ListingRef;
import com.propertyintel.insights.model.ListingResult;
import com.propertyintel.insights.model.MetricKind;
import com.propertyintel.insights.model.MetricRequest;
import com.propertyintel.insights.model.NormalizedMetricRow;
import com.propertyintel.insights.model.QueryKind;
import com.propertyintel.insights.model.RawMetricDocument;
import com.propertyintel.insights.model.SyncWindow;
import com.propertyintel.insights.output.MetricWriteException;
import com.propertyintel.insights.output.MetricsStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Syncs one listing: fetch everything, then normalise and write.
 *
 * Nothing is written until every chunk of every query kind has been fetched, so a
 * listing is either written from a complete set of responses or not at all. A
 * write failure stops the remaining kinds for that listing; kinds already written
 * stay written and are reported. No state is shared between calls.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ListingSyncUnit {

    private final MetricsClient metricsClient;
    private final MetricsNormalizer normalizer;
    private final MetricsStore store;
    private final InsightsSyncProperties properties;

    /**
     * @param scrapeDate ingestion day stamped on every row; shared by all listings of a run
     */
    public ListingResult run(Account account, ListingRef listing, SyncWindow window, LocalDate scrapeDate) {
        log.info("Listing {} ({}): syncing {}", listing.listingId(), listing.listingName(), window);
        Map<MetricKind, Integer> written = new EnumMap<>(MetricKind.class);

        List<RawMetricDocument> documents;
        try {
            documents = fetchAll(account, listing, window, scrapeDate);
        } catch (RuntimeException e) {
            log.warn("Listing {} failed during fetch: {}", listing.listingId(), e.getMessage());
            return ListingResult.failed(listing, "fetch: " + e.getMessage(), written);
        }

        Map<MetricKind, List<NormalizedMetricRow>> normalized = new EnumMap<>(MetricKind.class);
        try {
            for (MetricKind kind : MetricKind.values()) {
                List<NormalizedMetricRow> rows = new ArrayList<>();
                for (NormalizedMetricRow row : normalizer.normalize(documents, kind)) {
                    rows.add(row.stamp(account.getAccountId(), scrapeDate));
                }
                normalized.put(kind, rows);
            }
        } catch (RuntimeException e) {
            log.warn("Listing {} failed during normalisation: {}", listing.listingId(), e.getMessage());
            return ListingResult.failed(listing, "normalize: " + e.getMessage(), written);
        }

        if (properties.getSync().isDryRun()) {
            normalized.forEach((kind, rows) -> log.info("[DRY RUN] Listing {}: would write {} rows to {}",
                    listing.listingId(), rows.size(), kind.table()));
            return ListingResult.ok(listing, written);
        }

        for (Map.Entry<MetricKind, List<NormalizedMetricRow>> entry : normalized.entrySet()) {
            try {
                written.put(entry.getKey(), store.upsert(entry.getKey(), entry.getValue()));
            } catch (MetricWriteException e) {
                log.warn("Listing {} failed writing {}: {}", listing.listingId(), entry.getKey().table(), e.getMessage());
                return ListingResult.failed(listing, "write: " + e.getMessage(), written);
            }
        }

        log.info("Listing {} done: {}", listing.listingId(), written);
        return ListingResult.ok(listing, written);
    }

    private List<RawMetricDocument> fetchAll(Account account, ListingRef listing, SyncWindow window, LocalDate scrapeDate) {
        List<RawMetricDocument> documents = new ArrayList<>();
        for (QueryKind kind : QueryKind.values()) {
            for (SyncWindow.DateRange range : window.chunks(kind.chunkDays())) {
                for (MetricRequest request : kind.metricRequests()) {
                    documents.add(metricsClient.fetch(account, listing, kind, request, range, scrapeDate));
                }
            }
        }
        log.debug("Listing {}: fetched {} responses", listing.listingId(), documents.size());
        return documents;
    }
}
