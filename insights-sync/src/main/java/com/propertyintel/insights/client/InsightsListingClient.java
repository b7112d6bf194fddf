package com.propertyintel.insights.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.propertyintel.insights.model.Account;
import com.propertyintel.insights.model.ListingRef;
import com.propertyintel.insights.model.SyncWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class InsightsListingClient implements ListingClient {

    private final InsightsApiClient apiClient;
    private final InsightsPayloadBuilder payloadBuilder;

    /**
     * The listings table is not date-scoped upstream, so the window only shows up in logs.
     */
    @Override
    public List<ListingRef> listListings(Account account, SyncWindow window) {
        String path = payloadBuilder.path(InsightsPayloadBuilder.LISTINGS_OPERATION, InsightsPayloadBuilder.LISTINGS_SHA256);
        JsonNode response = apiClient.post(path, payloadBuilder.listings(), account.getCredentials(),
                InsightsPayloadBuilder.LISTINGS_OPERATION + "|" + account.getAccountId() + "|" + window);

        JsonNode rows = ResponseComponents.firstComponent(response).path("tableRows");
        List<ListingRef> listings = new ArrayList<>();
        for (JsonNode row : rows) {
            String id = row.path("id").asText(null);
            if (id == null || id.isBlank()) {
                log.debug("Skipping listing row without id: {}", row);
                continue;
            }
            listings.add(new ListingRef(id, row.path("internalName").asText(null)));
        }
        log.info("Found {} listings for account {}", listings.size(), account.getAccountId());
        return listings;
    }
}
