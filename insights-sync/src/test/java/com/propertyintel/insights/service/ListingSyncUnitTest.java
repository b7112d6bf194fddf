package com.propertyintel.insights.service;

import com.propertyintel.insights.Fixtures;
import com.propertyintel.insights.client.MetricsClient;
import com.propertyintel.insights.client.exception.UpstreamTransportException;
import com.propertyintel.insights.config.InsightsSyncProperties;
import com.propertyintel.insights.model.Account;
import com.propertyintel.insights.model.ListingRef;
import com.propertyintel.insights.model.ListingResult;
import com.propertyintel.insights.model.MetricKind;
import com.propertyintel.insights.model.MetricRequest;
import com.propertyintel.insights.model.NormalizedMetricRow;
import com.propertyintel.insights.model.QueryKind;
import com.propertyintel.insights.model.RawMetricDocument;
import com.propertyintel.insights.model.SyncWindow;
import com.propertyintel.insights.output.MetricWriteException;
import com.propertyintel.insights.output.MetricsStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SuppressWarnings("unchecked")
class ListingSyncUnitTest {

    private static final LocalDate SCRAPE_DATE = LocalDate.of(2025, 11, 10);
    // 49 days: two chart chunks and seven list chunks
    private static final SyncWindow WINDOW = new SyncWindow(LocalDate.of(2025, 11, 2), LocalDate.of(2025, 12, 20));
    private static final ListingRef LISTING = new ListingRef("900001", "Harbour loft");

    private final MetricsClient metricsClient = mock(MetricsClient.class);
    private final MetricsStore store = mock(MetricsStore.class);
    private final InsightsSyncProperties properties = Fixtures.properties();
    private final Account account = Fixtures.account("acct-1", null);

    private ListingSyncUnit unit;

    @BeforeEach
    void setUp() {
        unit = new ListingSyncUnit(metricsClient, new MetricsNormalizer(), store, properties);
        when(metricsClient.fetch(any(), any(), any(), any(), any(), any())).thenAnswer(inv -> {
            QueryKind kind = inv.getArgument(2);
            String fixture = kind == QueryKind.CHART_QUERY ? "chart_query.json" : "list_of_metrics.json";
            return new RawMetricDocument(kind, inv.getArgument(1), inv.getArgument(3), inv.getArgument(4),
                    Fixtures.json(fixture));
        });
        when(store.upsert(any(), anyList())).thenAnswer(inv -> ((List<?>) inv.getArgument(1)).size());
    }

    @Test
    void fetchesEveryChunkOfEveryQueryKindThenWritesEachKind() {
        ListingResult result = unit.run(account, LISTING, WINDOW, SCRAPE_DATE);

        assertThat(result.ok()).isTrue();
        verify(metricsClient, times(4)).fetch(any(), any(), eq(QueryKind.CHART_QUERY), any(), any(), any());
        verify(metricsClient, times(14)).fetch(any(), any(), eq(QueryKind.LIST_OF_METRICS_QUERY), any(), any(), any());
        verify(metricsClient).fetch(account, LISTING, QueryKind.CHART_QUERY,
                new MetricRequest("CONVERSION", "p3_impressions"),
                new SyncWindow.DateRange(LocalDate.of(2025, 11, 30), LocalDate.of(2025, 12, 20)), SCRAPE_DATE);

        assertThat(result.rowsWritten()).containsEntry(MetricKind.DAILY, 3)
                .containsEntry(MetricKind.WEEKLY_SUMMARY, 2)
                .containsEntry(MetricKind.WEEKLY_VISIBILITY, 7);
    }

    @Test
    void stampsAccountAndScrapeDateOnEveryRow() {
        unit.run(account, LISTING, WINDOW, SCRAPE_DATE);

        ArgumentCaptor<List<NormalizedMetricRow>> rows = ArgumentCaptor.forClass(List.class);
        verify(store).upsert(eq(MetricKind.WEEKLY_VISIBILITY), rows.capture());
        assertThat(rows.getValue()).allSatisfy(r -> {
            assertThat(r.getAccountId()).isEqualTo("acct-1");
            assertThat(r.getScrapeDate()).isEqualTo(SCRAPE_DATE);
        });
    }

    @Test
    void anyFetchFailureFailsTheListingWithoutWriting() {
        when(metricsClient.fetch(any(), any(), eq(QueryKind.LIST_OF_METRICS_QUERY), any(), any(), any()))
                .thenThrow(new UpstreamTransportException("503 after retries"));

        ListingResult result = unit.run(account, LISTING, WINDOW, SCRAPE_DATE);

        assertThat(result.ok()).isFalse();
        assertThat(result.reason()).contains("503 after retries");
        assertThat(result.rowsWritten()).isEmpty();
        verify(store, never()).upsert(any(), anyList());
    }

    @Test
    void writeFailureStopsRemainingKindsAndReportsWhatLanded() {
        when(store.upsert(eq(MetricKind.WEEKLY_SUMMARY), anyList()))
                .thenThrow(new MetricWriteException(MetricKind.WEEKLY_SUMMARY, "rejected"));

        ListingResult result = unit.run(account, LISTING, WINDOW, SCRAPE_DATE);

        assertThat(result.ok()).isFalse();
        assertThat(result.reason()).startsWith("write:");
        assertThat(result.rowsWritten()).containsOnlyKeys(MetricKind.DAILY);
        verify(store, never()).upsert(eq(MetricKind.WEEKLY_VISIBILITY), anyList());
    }

    @Test
    void dryRunFetchesButNeverWrites() {
        properties.getSync().setDryRun(true);

        ListingResult result = unit.run(account, LISTING, WINDOW, SCRAPE_DATE);

        assertThat(result.ok()).isTrue();
        assertThat(result.totalRows()).isZero();
        verify(store, never()).upsert(any(), anyList());
    }
}
