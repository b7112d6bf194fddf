package com.propertyintel.insights.client;

import com.propertyintel.insights.Fixtures;
import com.propertyintel.insights.client.exception.UpstreamTransportException;
import com.propertyintel.insights.model.Account;
import com.propertyintel.insights.model.ListingRef;
import com.propertyintel.insights.model.SyncWindow;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class InsightsListingClientTest {

    private static final SyncWindow WINDOW = new SyncWindow(LocalDate.of(2025, 11, 2), LocalDate.of(2025, 12, 20));

    private final InsightsApiClient apiClient = mock(InsightsApiClient.class);
    private final InsightsListingClient client = new InsightsListingClient(apiClient, new InsightsPayloadBuilder());
    private final Account account = Fixtures.account("acct-1", null);

    @Test
    void readsListingsFromTableRowsSkippingRowsWithoutId() {
        when(apiClient.post(eq("/api/v3/ListingsSectionQuery/" + InsightsPayloadBuilder.LISTINGS_SHA256),
                anyMap(), any(), anyString()))
                .thenReturn(Fixtures.json("listings.json"));

        List<ListingRef> listings = client.listListings(account, WINDOW);

        assertThat(listings).containsExactly(
                new ListingRef("900001", "Harbour loft"),
                new ListingRef("900002", "Garden flat"));
    }

    @Test
    void emptyTableIsAnEmptyResult() {
        when(apiClient.post(anyString(), anyMap(), any(), anyString())).thenReturn(Fixtures.MAPPER.createObjectNode());

        assertThat(client.listListings(account, WINDOW)).isEmpty();
    }

    @Test
    void transportFailurePropagates() {
        when(apiClient.post(anyString(), anyMap(), any(), anyString()))
                .thenThrow(new UpstreamTransportException("timeout"));

        assertThatThrownBy(() -> client.listListings(account, WINDOW))
                .isInstanceOf(UpstreamTransportException.class);
    }
}
