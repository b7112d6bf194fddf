package com.propertyintel.insights.client;

import com.propertyintel.insights.model.Account;
import com.propertyintel.insights.model.ListingRef;
import com.propertyintel.insights.model.MetricRequest;
import com.propertyintel.insights.model.QueryKind;
import com.propertyintel.insights.model.RawMetricDocument;
import com.propertyintel.insights.model.SyncWindow;

import java.time.LocalDate;

/**
 * Fetches one raw metrics response for a listing, query kind, metric request and date chunk.
 */
public interface MetricsClient {

    RawMetricDocument fetch(Account account, ListingRef listing, QueryKind kind,
                            MetricRequest request, SyncWindow.DateRange range, LocalDate scrapeDay);
}
