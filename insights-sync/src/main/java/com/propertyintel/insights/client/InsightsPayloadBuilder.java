package com.propertyintel.insights.client;

import com.propertyintel.insights.model.MetricRequest;
import com.propertyintel.insights.model.QueryKind;
import com.propertyintel.insights.model.SyncWindow;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds GraphQL persisted-query bodies in the shape the performance dashboard sends.
 */
@Component
public class InsightsPayloadBuilder {

    static final String LISTINGS_OPERATION = "ListingsSectionQuery";
    static final String LISTINGS_SHA256 = "7a646c07b45ad35335b2cde4842e5c5bf69ccebde508b2ba60276832bfb1816b";

    /** The dashboard shifts relative day offsets by three days from the scrape day. */
    static final int UI_DAY_OFFSET = 3;

    public Map<String, Object> listings() {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("metricType", "CONVERSION");
        arguments.put("groupBys", List.of("RATING_CATEGORY"));
        arguments.put("groupByValues", List.of("occupancy_rate"));
        return envelope(LISTINGS_OPERATION, LISTINGS_SHA256, "web-performance-dash-listings", arguments);
    }

    public Map<String, Object> metric(QueryKind kind, String listingId, MetricRequest request,
                                      SyncWindow.DateRange range, LocalDate scrapeDay) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("relativeDsStart", relativeOffset(range.start(), scrapeDay));
        arguments.put("relativeDsEnd", relativeOffset(range.end(), scrapeDay));
        arguments.put("filters", Map.of("listingIds", List.of(listingId)));
        arguments.put("metricType", request.metricType());
        arguments.put("groupBys", List.of("RATING_CATEGORY"));
        arguments.put("groupByValues", List.of(request.groupValue()));
        if (kind.marketComparison()) {
            arguments.put("metricComparisonType", "MARKET");
        }
        return envelope(kind.operationName(), kind.sha256Hash(), kind.clientName(), arguments);
    }

    public String path(String operationName, String sha256Hash) {
        return "/api/v3/" + operationName + "/" + sha256Hash;
    }

    static long relativeOffset(LocalDate date, LocalDate scrapeDay) {
        return ChronoUnit.DAYS.between(scrapeDay, date) + UI_DAY_OFFSET;
    }

    private Map<String, Object> envelope(String operation, String sha256, String clientName, Map<String, Object> arguments) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("clientName", clientName);
        request.put("arguments", arguments);
        request.put("useStubbedData", false);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("operationName", operation);
        payload.put("locale", "en");
        payload.put("currency", "USD");
        payload.put("variables", Map.of("request", request));
        payload.put("extensions", Map.of("persistedQuery", Map.of("version", 1, "sha256Hash", sha256)));
        return payload;
    }
}
