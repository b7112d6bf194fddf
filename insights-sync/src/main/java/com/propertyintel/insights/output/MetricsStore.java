package com.propertyintel.insights.output;

import com.propertyintel.insights.model.MetricKind;
import com.propertyintel.insights.model.NormalizedMetricRow;

import java.util.List;

/**
 * Idempotent write path for normalized rows.
 *
 * One call writes one listing's rows of one kind atomically. A collision on
 * (account_id, listing_id, period_start, scrape_date) overwrites every non-key
 * column. Empty input is a no-op returning 0.
 *
 * @throws MetricWriteException when any row is malformed or the database rejects the batch;
 *                              nothing from the batch is written in that case
 */
public interface MetricsStore {

    int upsert(MetricKind kind, List<NormalizedMetricRow> rows);
}
