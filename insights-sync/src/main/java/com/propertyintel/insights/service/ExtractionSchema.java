package com.propertyintel.insights.service;

import com.propertyintel.insights.model.MetricKind;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative mapping from a record kind to where its observations live in the
 * first response component.
 *
 * A selector path is a dot-separated list of field names, where a trailing
 * {@code [*]} fans out over an array. Each matched node yields one observation
 * per entry of {@code valueFields}: the column is the metric name plus the suffix.
 * Adding a record kind means adding a row here, not new normaliser code.
 */
public record ExtractionSchema(MetricKind kind, PeriodSource period, List<Selector> selectors) {

    /** Where the period of an observation comes from. */
    public enum PeriodSource {
        /** A {@code ds} date on the matched node; the period is that single day. */
        DATA_POINT_DAY,
        /** The requested chunk; the period is the chunk start to end. */
        REQUEST_RANGE
    }

    /** How the metric name of a matched node is derived. */
    public enum NameSource {
        /** {@code metricName} field of the matched node. */
        METRIC_NAME_FIELD,
        /**
         * Requested group value plus the series of the enclosing chart:
         * "your" when the chart label mentions it, else "similar".
         */
        GROUP_AND_SERIES
    }

    public record Selector(String path, NameSource name, Map<String, String> valueFields) {

        public List<String> segments() {
            return List.of(path.split("\\."));
        }
    }

    private static final Map<MetricKind, ExtractionSchema> SCHEMAS = new EnumMap<>(MetricKind.class);

    static {
        register(new ExtractionSchema(MetricKind.DAILY, PeriodSource.DATA_POINT_DAY, List.of(
                new Selector("metricLineCharts[*].dataPoints[*]", NameSource.GROUP_AND_SERIES,
                        Map.of("value", "_value")))));

        Map<String, String> primaryFields = new LinkedHashMap<>();
        primaryFields.put("value", "_value");
        primaryFields.put("valueChange", "_value_change");
        register(new ExtractionSchema(MetricKind.WEEKLY_SUMMARY, PeriodSource.REQUEST_RANGE, List.of(
                new Selector("primaryMetric", NameSource.METRIC_NAME_FIELD, primaryFields),
                new Selector("secondaryMetrics[*]", NameSource.METRIC_NAME_FIELD, Map.of("value", "_value")))));

        register(new ExtractionSchema(MetricKind.WEEKLY_VISIBILITY, PeriodSource.REQUEST_RANGE, List.of(
                new Selector("metrics[*]", NameSource.METRIC_NAME_FIELD, Map.of("value", "_value")))));
    }

    private static void register(ExtractionSchema schema) {
        SCHEMAS.put(schema.kind(), schema);
    }

    public static ExtractionSchema forKind(MetricKind kind) {
        ExtractionSchema schema = SCHEMAS.get(kind);
        if (schema == null) {
            throw new IllegalArgumentException("No extraction schema for " + kind);
        }
        return schema;
    }
}
