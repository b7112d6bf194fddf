package com.propertyintel.insights.output;

import com.propertyintel.insights.model.MetricKind;
import com.propertyintel.insights.model.NormalizedMetricRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Date;
import java.sql.Types;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * PostgreSQL upsert of wide metric rows.
 *
 * Every row of a call is checked before anything is sent, then the whole batch
 * goes out in one transaction. Tables and the unique constraints the
 * ON CONFLICT clause relies on are created by Flyway.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JdbcMetricsStore implements MetricsStore {

    private static final int BATCH_SIZE = 1000;
    private static final List<String> FIXED_COLUMNS =
            List.of("account_id", "listing_id", "listing_name", "period_start", "period_end", "scrape_date");
    private static final Map<MetricKind, String> STATEMENTS = new EnumMap<>(MetricKind.class);

    static {
        for (MetricKind kind : MetricKind.values()) {
            STATEMENTS.put(kind, upsertSql(kind));
        }
    }

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    @Override
    public int upsert(MetricKind kind, List<NormalizedMetricRow> rows) {
        if (rows == null || rows.isEmpty()) return 0;

        validate(kind, rows);
        String sql = STATEMENTS.get(kind);
        List<Object[]> args = new ArrayList<>(rows.size());
        for (NormalizedMetricRow row : rows) {
            args.add(toArgs(kind, row));
        }
        int[] types = argTypes(kind);

        try {
            transactionTemplate.executeWithoutResult(status -> {
                for (int i = 0; i < args.size(); i += BATCH_SIZE) {
                    jdbcTemplate.batchUpdate(sql, args.subList(i, Math.min(i + BATCH_SIZE, args.size())), types);
                }
            });
        } catch (DataAccessException e) {
            log.error("Upsert of {} rows into {} failed: {}", rows.size(), kind.table(), e.getMessage(), e);
            throw new MetricWriteException(kind, "batch of " + rows.size() + " rows rejected", e);
        }

        log.debug("Upserted {} rows into {}", rows.size(), kind.table());
        return rows.size();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void validate(MetricKind kind, List<NormalizedMetricRow> rows) {
        for (int i = 0; i < rows.size(); i++) {
            NormalizedMetricRow r = rows.get(i);
            if (r == null) {
                throw new MetricWriteException(kind, "row " + i + " is null");
            }
            if (r.getAccountId() == null || r.getListingId() == null
                    || r.getPeriodStart() == null || r.getScrapeDate() == null) {
                throw new MetricWriteException(kind, "row " + i + " has an incomplete key: " + r);
            }
            if (r.getPeriodEnd() != null && r.getPeriodEnd().isBefore(r.getPeriodStart())) {
                throw new MetricWriteException(kind, "row " + i + " ends before it starts: " + r);
            }
            for (String column : r.getMetrics().keySet()) {
                if (!kind.columns().contains(column)) {
                    throw new MetricWriteException(kind, "row " + i + " has unknown column " + column);
                }
            }
        }
    }

    private static Object[] toArgs(MetricKind kind, NormalizedMetricRow r) {
        Object[] args = new Object[FIXED_COLUMNS.size() + kind.columns().size()];
        int i = 0;
        args[i++] = r.getAccountId();
        args[i++] = r.getListingId();
        args[i++] = r.getListingName();
        args[i++] = Date.valueOf(r.getPeriodStart());
        args[i++] = Date.valueOf(r.getPeriodEnd() != null ? r.getPeriodEnd() : r.getPeriodStart());
        args[i++] = Date.valueOf(r.getScrapeDate());
        for (String column : kind.columns()) {
            args[i++] = r.metric(column);
        }
        return args;
    }

    private static int[] argTypes(MetricKind kind) {
        int[] types = new int[FIXED_COLUMNS.size() + kind.columns().size()];
        types[0] = Types.VARCHAR;
        types[1] = Types.VARCHAR;
        types[2] = Types.VARCHAR;
        types[3] = Types.DATE;
        types[4] = Types.DATE;
        types[5] = Types.DATE;
        for (int i = FIXED_COLUMNS.size(); i < types.length; i++) {
            types[i] = Types.DOUBLE;
        }
        return types;
    }

    static String upsertSql(MetricKind kind) {
        List<String> all = new ArrayList<>(FIXED_COLUMNS);
        all.addAll(kind.columns());

        List<String> updatable = new ArrayList<>();
        updatable.add("listing_name");
        updatable.add("period_end");
        updatable.addAll(kind.columns());

        return "INSERT INTO insights." + kind.table()
                + " (" + String.join(", ", all) + ")"
                + " VALUES (" + all.stream().map(c -> "?").collect(Collectors.joining(", ")) + ")"
                + " ON CONFLICT (account_id, listing_id, period_start, scrape_date) DO UPDATE SET "
                + updatable.stream().map(c -> c + " = EXCLUDED." + c).collect(Collectors.joining(", "))
                + ", updated_at = now()";
    }
}
