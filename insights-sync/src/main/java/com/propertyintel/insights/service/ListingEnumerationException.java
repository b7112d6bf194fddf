package com.propertyintel.insights.service;

import lombok.Getter;

/** Listing enumeration failed, so the run has nothing to iterate. */
@Getter
public class ListingEnumerationException extends RuntimeException {

    private final String accountId;

    public ListingEnumerationException(String accountId, Throwable cause) {
        super("Could not enumerate listings for account " + accountId + ": " + cause.getMessage(), cause);
        this.accountId = accountId;
    }
}
