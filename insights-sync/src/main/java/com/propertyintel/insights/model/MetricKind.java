package com.propertyintel.insights.model;

import java.util.List;
import java.util.Locale;

/**
 * Persisted record kinds. Each maps to one table with a fixed set of numeric columns.
 */
public enum MetricKind {

    DAILY("listing_daily_metrics", QueryKind.CHART_QUERY, List.of(
            "conversion_rate_your_value",
            "conversion_rate_similar_value",
            "p3_impressions_your_value",
            "p3_impressions_similar_value")),

    WEEKLY_SUMMARY("listing_weekly_summary", QueryKind.CHART_QUERY, List.of(
            "conversion_rate_value",
            "conversion_rate_value_change",
            "p2_impressions_first_page_rate_value",
            "search_conversion_rate_value",
            "listing_conversion_rate_value",
            "p3_impressions_value",
            "p3_impressions_value_change",
            "p2_impressions_value")),

    WEEKLY_VISIBILITY("listing_weekly_visibility", QueryKind.LIST_OF_METRICS_QUERY, List.of(
            "conversion_rate_value",
            "p2_impressions_first_page_rate_value",
            "search_conversion_rate_value",
            "listing_conversion_rate_value",
            "p3_impressions_value",
            "p2_impressions_value"));

    private final String table;
    private final QueryKind source;
    private final List<String> columns;

    MetricKind(String table, QueryKind source, List<String> columns) {
        this.table = table;
        this.source = source;
        this.columns = columns;
    }

    public String table() { return table; }
    public QueryKind source() { return source; }
    public List<String> columns() { return columns; }

    /** Lower-case name used on the export API, e.g. "weekly_summary". */
    public String apiName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MetricKind fromApiName(String name) {
        for (MetricKind kind : values()) {
            if (kind.apiName().equalsIgnoreCase(name)) return kind;
        }
        throw new IllegalArgumentException("Unknown metric_type: " + name);
    }
}
