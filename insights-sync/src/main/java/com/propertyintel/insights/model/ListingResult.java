package com.propertyintel.insights.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Outcome of syncing a single listing.
 */
public record ListingResult(ListingRef listing, boolean ok, String reason, Map<MetricKind, Integer> rowsWritten) {

    public static ListingResult ok(ListingRef listing, Map<MetricKind, Integer> rowsWritten) {
        return new ListingResult(listing, true, null, copy(rowsWritten));
    }

    public static ListingResult failed(ListingRef listing, String reason, Map<MetricKind, Integer> rowsWritten) {
        return new ListingResult(listing, false, reason, copy(rowsWritten));
    }

    private static Map<MetricKind, Integer> copy(Map<MetricKind, Integer> rowsWritten) {
        return rowsWritten.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(rowsWritten));
    }

    public int totalRows() {
        return rowsWritten.values().stream().mapToInt(Integer::intValue).sum();
    }
}
