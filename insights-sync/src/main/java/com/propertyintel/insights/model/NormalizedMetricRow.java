package com.propertyintel.insights.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wide metric row for one (listing, period).
 *
 * Natural key: account_id + listing_id + period_start + scrape_date.
 *  - account_id and scrape_date are null as produced by the normaliser;
 *    the listing sync stamps them before the write
 *  - scrape_date is the ingestion day, so the same period observed on
 *    different days is kept as separate "as of" rows
 *  - a null metric value means "not reported", never zero
 */
@Value
@Builder(toBuilder = true)
public class NormalizedMetricRow {

    String accountId;
    String listingId;
    String listingName;
    LocalDate periodStart;
    LocalDate periodEnd;
    LocalDate scrapeDate;

    @Builder.Default
    Map<String, Double> metrics = Map.of();

    public NormalizedMetricRow stamp(String accountId, LocalDate scrapeDate) {
        return toBuilder().accountId(accountId).scrapeDate(scrapeDate).build();
    }

    public Double metric(String column) {
        return metrics.get(column);
    }

    public static Map<String, Double> columnsOf(MetricKind kind, Map<String, Double> values) {
        Map<String, Double> wide = new LinkedHashMap<>();
        for (String column : kind.columns()) {
            wide.put(column, values.get(column));
        }
        return Collections.unmodifiableMap(wide);
    }
}
