package com.propertyintel.insights.model;

import java.util.Objects;

/** Listing as enumerated from the upstream dashboard. Not persisted on its own. */
public record ListingRef(String listingId, String listingName) {

    public ListingRef {
        Objects.requireNonNull(listingId, "listingId");
    }
}
