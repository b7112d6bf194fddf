package com.propertyintel.insights.output;

import com.propertyintel.insights.model.MetricKind;
import com.propertyintel.insights.model.NormalizedMetricRow;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class JdbcMetricsStoreTest {

    private final JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);
    private final PlatformTransactionManager txManager = mock(PlatformTransactionManager.class);
    private final JdbcMetricsStore store = new JdbcMetricsStore(jdbcTemplate, new TransactionTemplate(txManager));

    @Test
    void emptyInputIsANoOp() {
        assertThat(store.upsert(MetricKind.DAILY, List.of())).isZero();
        verifyNoInteractions(jdbcTemplate, txManager);
    }

    @Test
    void writesWholeBatchInOneTransaction() {
        int written = store.upsert(MetricKind.DAILY, List.of(row("900001"), row("900002")));

        assertThat(written).isEqualTo(2);
        verify(jdbcTemplate).batchUpdate(anyString(), anyList(), any(int[].class));
        verify(txManager).commit(any());
    }

    @Test
    void malformedRowFailsTheBatchBeforeAnyWrite() {
        NormalizedMetricRow noScrapeDate = row("900002").toBuilder().scrapeDate(null).build();

        assertThatThrownBy(() -> store.upsert(MetricKind.DAILY, List.of(row("900001"), noScrapeDate)))
                .isInstanceOf(MetricWriteException.class)
                .hasMessageContaining("row 1");
        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    void unknownColumnFailsTheBatch() {
        NormalizedMetricRow bad = row("900001").toBuilder().metrics(Map.of("bogus_value", 1.0)).build();

        assertThatThrownBy(() -> store.upsert(MetricKind.DAILY, List.of(bad)))
                .isInstanceOf(MetricWriteException.class)
                .hasMessageContaining("bogus_value");
        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    void databaseRejectionSurfacesAsWriteFailure() {
        when(jdbcTemplate.batchUpdate(anyString(), anyList(), any(int[].class)))
                .thenThrow(new DataIntegrityViolationException("fk violation"));

        assertThatThrownBy(() -> store.upsert(MetricKind.DAILY, List.of(row("900001"))))
                .isInstanceOf(MetricWriteException.class)
                .extracting("kind").isEqualTo(MetricKind.DAILY);
        verify(txManager).rollback(any());
    }

    @Test
    void conflictClauseOverwritesEveryNonKeyColumn() {
        String sql = JdbcMetricsStore.upsertSql(MetricKind.WEEKLY_SUMMARY);

        assertThat(sql).startsWith("INSERT INTO insights.listing_weekly_summary")
                .contains("ON CONFLICT (account_id, listing_id, period_start, scrape_date) DO UPDATE SET")
                .contains("listing_name = EXCLUDED.listing_name")
                .contains("period_end = EXCLUDED.period_end")
                .endsWith("updated_at = now()");
        for (String column : MetricKind.WEEKLY_SUMMARY.columns()) {
            assertThat(sql).contains(column + " = EXCLUDED." + column);
        }
        assertThat(sql).doesNotContain("account_id = EXCLUDED").doesNotContain("scrape_date = EXCLUDED");
    }

    @Test
    void concurrentWritersUseTheStatementForTheirOwnKind() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(6);
        try {
            List<Future<Integer>> writes = new ArrayList<>();
            for (int i = 0; i < 30; i++) {
                MetricKind kind = MetricKind.values()[i % MetricKind.values().length];
                writes.add(pool.submit(() -> store.upsert(kind,
                        List.of(row("900001").toBuilder().metrics(Map.of()).build()))));
            }
            for (Future<Integer> write : writes) {
                assertThat(write.get(5, TimeUnit.SECONDS)).isEqualTo(1);
            }
        } finally {
            pool.shutdownNow();
        }

        for (MetricKind kind : MetricKind.values()) {
            verify(jdbcTemplate, times(10)).batchUpdate(eq(JdbcMetricsStore.upsertSql(kind)), anyList(), any(int[].class));
        }
    }

    private static NormalizedMetricRow row(String listingId) {
        return NormalizedMetricRow.builder()
                .accountId("acct-1")
                .listingId(listingId)
                .listingName("Listing " + listingId)
                .periodStart(LocalDate.of(2025, 11, 2))
                .periodEnd(LocalDate.of(2025, 11, 2))
                .scrapeDate(LocalDate.of(2025, 11, 10))
                .metrics(NormalizedMetricRow.columnsOf(MetricKind.DAILY, Map.of("conversion_rate_your_value", 0.012)))
                .build();
    }
}
