package com.propertyintel.insights.model;

import lombok.Builder;
import lombok.Value;

/**
 * Opaque credential bundle captured from an authenticated dashboard session.
 * Owned by the account CRUD layer; the sync only reads it to build request headers.
 */
@Value
@Builder
public class AccountCredentials {

    String cookie;
    String clientVersion;
    String userAgent;

    public boolean isComplete() {
        return notBlank(cookie) && notBlank(clientVersion) && notBlank(userAgent);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }

    @Override
    public String toString() {
        // never log the session cookie
        return "AccountCredentials(clientVersion=" + clientVersion + ", cookie=" + (cookie == null ? "null" : "***") + ")";
    }
}
