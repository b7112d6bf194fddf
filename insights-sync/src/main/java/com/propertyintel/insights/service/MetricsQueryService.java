package com.propertyintel.insights.service;

import com.propertyintel.insights.model.MetricKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Date;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads stored metric rows back out for export.
 *
 * Filters on scrape_date in [start, end), newest scrape first, then listing and period.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsQueryService {

    private static final Comparator<Map<String, Object>> EXPORT_ORDER = Comparator
            .comparing((Map<String, Object> r) -> (LocalDate) r.get("scrape_date"), Comparator.reverseOrder())
            .thenComparing(r -> (String) r.get("listing_id"))
            .thenComparing(r -> (LocalDate) r.get("period_start"));

    private final JdbcTemplate jdbcTemplate;
    private final AccountProvider accountProvider;

    /**
     * @param kinds        one kind, or every kind for an "all" export
     * @param tagWithKind  add a leading metric_type column
     */
    public List<Map<String, Object>> export(String accountId, List<MetricKind> kinds,
                                            LocalDate start, LocalDate end, boolean tagWithKind) {
        if (accountProvider.get(accountId).isEmpty()) {
            throw new SyncPreconditionException(accountId, SyncPreconditionException.Reason.NOT_FOUND);
        }
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("end_date must be after start_date");
        }

        List<Map<String, Object>> out = new ArrayList<>();
        for (MetricKind kind : kinds) {
            String sql = """
                SELECT listing_id, listing_name, period_start, period_end, scrape_date, %s
                FROM insights.%s
                WHERE account_id = ?
                  AND scrape_date >= ?
                  AND scrape_date < ?
                """.formatted(String.join(", ", kind.columns()), kind.table());

            for (Map<String, Object> row : jdbcTemplate.queryForList(sql, accountId, Date.valueOf(start), Date.valueOf(end))) {
                out.add(toExportRow(kind, row, tagWithKind));
            }
        }
        out.sort(EXPORT_ORDER);
        log.info("Export for {} {} [{}, {}): {} rows", accountId, kinds, start, end, out.size());
        return out;
    }

    /** Header used when an export has no rows. */
    public List<String> headers(List<MetricKind> kinds, boolean tagWithKind) {
        List<String> headers = new ArrayList<>();
        if (tagWithKind) headers.add("metric_type");
        headers.addAll(List.of("listing_id", "listing_name", "period_start", "period_end", "scrape_date"));
        for (MetricKind kind : kinds) {
            kind.columns().stream().filter(c -> !headers.contains(c)).forEach(headers::add);
        }
        return headers;
    }

    private Map<String, Object> toExportRow(MetricKind kind, Map<String, Object> row, boolean tagWithKind) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (tagWithKind) out.put("metric_type", kind.apiName());
        row.forEach((k, v) -> out.put(k, v instanceof Date d ? d.toLocalDate() : v));
        return out;
    }
}
