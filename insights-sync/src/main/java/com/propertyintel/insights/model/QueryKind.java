package com.propertyintel.insights.model;

import java.util.List;

/**
 * Upstream GraphQL persisted queries polled per listing.
 *
 * Chunk sizes follow what the dashboard itself requests: the chart view
 * pages in 28-day blocks, the metric list in single weeks.
 */
public enum QueryKind {

    CHART_QUERY(
            "ChartQuery",
            "aa6e318cc066bbf19511b86acdce32fc59219d8596448b861d794491f46631c5",
            "web-performance-dash-chart",
            28,
            true),

    LIST_OF_METRICS_QUERY(
            "ListOfMetricsQuery",
            "b22a5ded5e6c6d168f1d224b78f34182e7366e5cc65203ec04f1e718286a09e1",
            "web-performance-dash-metrics",
            7,
            false);

    /** Metric requests issued for every query kind. */
    public static final List<MetricRequest> METRIC_REQUESTS = List.of(
            new MetricRequest("CONVERSION", "conversion_rate"),
            new MetricRequest("CONVERSION", "p3_impressions"));

    private final String operationName;
    private final String sha256Hash;
    private final String clientName;
    private final int chunkDays;
    private final boolean marketComparison;

    QueryKind(String operationName, String sha256Hash, String clientName, int chunkDays, boolean marketComparison) {
        this.operationName = operationName;
        this.sha256Hash = sha256Hash;
        this.clientName = clientName;
        this.chunkDays = chunkDays;
        this.marketComparison = marketComparison;
    }

    public String operationName() { return operationName; }
    public String sha256Hash() { return sha256Hash; }
    public String clientName() { return clientName; }
    public int chunkDays() { return chunkDays; }
    public boolean marketComparison() { return marketComparison; }

    public List<MetricRequest> metricRequests() {
        return METRIC_REQUESTS;
    }
}
