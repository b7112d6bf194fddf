package com.propertyintel.insights.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One upstream response for (listing, query kind, metric request, chunk).
 * Held in memory only while its listing is being processed.
 */
public record RawMetricDocument(
        QueryKind queryKind,
        ListingRef listing,
        MetricRequest request,
        SyncWindow.DateRange range,
        JsonNode body) {
}
