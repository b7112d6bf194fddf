package com.propertyintel.insights.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.propertyintel.insights.model.Account;
import com.propertyintel.insights.model.ListingRef;
import com.propertyintel.insights.model.MetricRequest;
import com.propertyintel.insights.model.QueryKind;
import com.propertyintel.insights.model.RawMetricDocument;
import com.propertyintel.insights.model.SyncWindow;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

@Service
@RequiredArgsConstructor
public class InsightsMetricsClient implements MetricsClient {

    private final InsightsApiClient apiClient;
    private final InsightsPayloadBuilder payloadBuilder;

    @Override
    public RawMetricDocument fetch(Account account, ListingRef listing, QueryKind kind,
                                   MetricRequest request, SyncWindow.DateRange range, LocalDate scrapeDay) {
        String context = String.join("|", kind.operationName(), listing.listingId(),
                request.groupValue(), range.toString(), range.days() + "d");
        JsonNode body = apiClient.post(
                payloadBuilder.path(kind.operationName(), kind.sha256Hash()),
                payloadBuilder.metric(kind, listing.listingId(), request, range, scrapeDay),
                account.getCredentials(),
                context);
        return new RawMetricDocument(kind, listing, request, range, body);
    }
}
