package com.propertyintel.insights.client;

import com.propertyintel.insights.model.Account;
import com.propertyintel.insights.model.ListingRef;
import com.propertyintel.insights.model.SyncWindow;

import java.util.List;

/**
 * Enumerates the listings an account owns upstream.
 * An empty list is a valid answer; failures surface as
 * {@link com.propertyintel.insights.client.exception.UpstreamException}.
 */
public interface ListingClient {

    List<ListingRef> listListings(Account account, SyncWindow window);
}
