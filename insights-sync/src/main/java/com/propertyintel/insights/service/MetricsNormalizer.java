package com.propertyintel.insights.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.propertyintel.insights.client.ResponseComponents;
import com.propertyintel.insights.model.ListingRef;
import com.propertyintel.insights.model.MetricKind;
import com.propertyintel.insights.model.NormalizedMetricRow;
import com.propertyintel.insights.model.RawMetricDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Pivots raw upstream responses into wide rows, one per (listing, period).
 *
 * Extraction follows {@link ExtractionSchema}; this class only knows how to walk
 * a selector path, coerce a number and merge observations. Rows carry no
 * account id or scrape date; the listing sync stamps those.
 *
 * Merge rules:
 *  - a column never observed stays null
 *  - when a column is observed twice for the same row the larger value wins,
 *    so the result does not depend on input order
 *  - names outside the kind's column list are ignored
 */
@Component
@Slf4j
public class MetricsNormalizer {

    /** Normalize every document whose query kind feeds {@code kind}; others are skipped. */
    public List<NormalizedMetricRow> normalize(List<RawMetricDocument> documents, MetricKind kind) {
        Map<RowKey, RowAccumulator> rows = new TreeMap<>();
        for (RawMetricDocument document : documents) {
            if (document.queryKind() != kind.source()) {
                continue;
            }
            collect(document, kind, rows);
        }
        List<NormalizedMetricRow> out = new ArrayList<>(rows.size());
        rows.values().forEach(acc -> out.add(acc.toRow(kind)));
        return out;
    }

    public List<NormalizedMetricRow> normalize(RawMetricDocument document, MetricKind kind) {
        return normalize(List.of(document), kind);
    }

    // ── Extraction ───────────────────────────────────────────────────────────

    private void collect(RawMetricDocument document, MetricKind kind, Map<RowKey, RowAccumulator> rows) {
        ExtractionSchema schema = ExtractionSchema.forKind(kind);
        JsonNode component = ResponseComponents.firstComponent(document.body());
        if (component.isMissingNode()) {
            log.debug("No component in {} response for listing {} ({})",
                    document.queryKind(), document.listing().listingId(), document.range());
            return;
        }
        Set<String> columns = Set.copyOf(kind.columns());

        for (ExtractionSchema.Selector selector : schema.selectors()) {
            List<Match> matches = new ArrayList<>();
            walk(component, selector.segments(), 0, new ArrayList<>(), matches);

            for (Match match : matches) {
                Period period = periodOf(schema.period(), match.node(), document);
                if (period == null) continue;

                String metricName = metricName(selector.name(), match, document);
                if (metricName == null || metricName.isBlank()) {
                    log.debug("Skipping {} node without metric name", kind);
                    continue;
                }

                RowAccumulator acc = rows.computeIfAbsent(
                        new RowKey(document.listing().listingId(), period.start()),
                        k -> new RowAccumulator(document.listing(), period.start()));
                acc.extendPeriod(period.end());

                selector.valueFields().forEach((field, suffix) -> {
                    String column = metricName + suffix;
                    if (!columns.contains(column)) {
                        log.debug("Ignoring {} column {} not in {}", kind, column, kind.table());
                        return;
                    }
                    acc.observe(column, coerce(match.node().get(field), column));
                });
            }
        }
    }

    /** Depth-first walk of a selector path; {@code trail} holds the array elements passed through. */
    private void walk(JsonNode node, List<String> segments, int depth, List<JsonNode> trail, List<Match> out) {
        if (depth == segments.size()) {
            out.add(new Match(node, List.copyOf(trail)));
            return;
        }
        String segment = segments.get(depth);
        boolean fanOut = segment.endsWith("[*]");
        String field = fanOut ? segment.substring(0, segment.length() - 3) : segment;
        JsonNode child = node.path(field);

        if (fanOut) {
            if (!child.isArray()) return;
            for (JsonNode element : child) {
                trail.add(element);
                walk(element, segments, depth + 1, trail, out);
                trail.remove(trail.size() - 1);
            }
        } else if (child.isObject()) {
            walk(child, segments, depth + 1, trail, out);
        }
    }

    private Period periodOf(ExtractionSchema.PeriodSource source, JsonNode node, RawMetricDocument document) {
        if (source == ExtractionSchema.PeriodSource.REQUEST_RANGE) {
            return new Period(document.range().start(), document.range().end());
        }
        String ds = node.path("ds").asText(null);
        if (ds == null) {
            log.warn("Data point without ds for listing {}, skipping", document.listing().listingId());
            return null;
        }
        try {
            LocalDate day = LocalDate.parse(ds);
            return new Period(day, day);
        } catch (DateTimeParseException e) {
            log.warn("Unparseable ds '{}' for listing {}, skipping", ds, document.listing().listingId());
            return null;
        }
    }

    private String metricName(ExtractionSchema.NameSource source, Match match, RawMetricDocument document) {
        if (source == ExtractionSchema.NameSource.METRIC_NAME_FIELD) {
            return match.node().path("metricName").asText(null);
        }
        // enclosing chart is the first array element on the path
        String label = match.trail().isEmpty() ? "" : match.trail().get(0).path("label").asText("");
        String series = label.toLowerCase(Locale.ROOT).contains("your") ? "your" : "similar";
        return document.request().groupValue() + "_" + series;
    }

    /**
     * Accepts {doubleValue}/{longValue} wrappers, plain numbers and numeric strings.
     * Anything else nulls the field with a warning.
     */
    static Double coerce(JsonNode value, String column) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        JsonNode raw = value;
        if (value.isObject()) {
            JsonNode dbl = value.get("doubleValue");
            raw = (dbl != null && !dbl.isNull()) ? dbl : value.get("longValue");
            if (raw == null || raw.isNull()) return null;
        }
        if (raw.isNumber()) {
            return finite(raw.asDouble(), raw, column);
        }
        if (raw.isTextual()) {
            try {
                return finite(Double.parseDouble(raw.asText().trim()), raw, column);
            } catch (NumberFormatException e) {
                log.warn("Could not coerce {}='{}' to a number, storing null", column, raw.asText());
                return null;
            }
        }
        log.warn("Unexpected value type for {}: {}, storing null", column, raw.getNodeType());
        return null;
    }

    private static Double finite(double d, JsonNode raw, String column) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            log.warn("Non-finite value for {}: {}, storing null", column, raw);
            return null;
        }
        return d;
    }

    // ── Internal types ───────────────────────────────────────────────────────

    private record Match(JsonNode node, List<JsonNode> trail) {
    }

    private record Period(LocalDate start, LocalDate end) {
    }

    private record RowKey(String listingId, LocalDate periodStart) implements Comparable<RowKey> {
        private static final Comparator<RowKey> ORDER =
                Comparator.comparing(RowKey::listingId).thenComparing(RowKey::periodStart);

        @Override
        public int compareTo(RowKey other) {
            return ORDER.compare(this, other);
        }
    }

    private static final class RowAccumulator {
        private final ListingRef listing;
        private final LocalDate periodStart;
        private LocalDate periodEnd;
        private final Map<String, Double> values = new HashMap<>();

        RowAccumulator(ListingRef listing, LocalDate periodStart) {
            this.listing = listing;
            this.periodStart = periodStart;
        }

        void extendPeriod(LocalDate end) {
            if (periodEnd == null || end.isAfter(periodEnd)) periodEnd = end;
        }

        void observe(String column, Double value) {
            if (value == null) return;
            values.merge(column, value, Math::max);
        }

        NormalizedMetricRow toRow(MetricKind kind) {
            return NormalizedMetricRow.builder()
                    .listingId(listing.listingId())
                    .listingName(listing.listingName())
                    .periodStart(periodStart)
                    .periodEnd(periodEnd)
                    .metrics(NormalizedMetricRow.columnsOf(kind, values))
                    .build();
        }
    }
}
