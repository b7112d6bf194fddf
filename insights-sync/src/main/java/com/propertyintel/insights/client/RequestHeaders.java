package com.propertyintel.insights.client;

import com.propertyintel.insights.model.AccountCredentials;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.security.SecureRandom;
import java.util.List;

/**
 * Headers the dashboard sends with each GraphQL call, rebuilt per request so
 * every call gets a fresh trace id.
 */
final class RequestHeaders {

    private static final String TRACE_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int TRACE_ID_LENGTH = 30;
    private static final SecureRandom RANDOM = new SecureRandom();

    private RequestHeaders() {
    }

    static HttpHeaders build(AccountCredentials credentials, String apiKey) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(HttpHeaders.COOKIE, credentials.getCookie());
        headers.set(HttpHeaders.USER_AGENT, credentials.getUserAgent());
        headers.set("X-Client-Version", credentials.getClientVersion());
        headers.set("X-Airbnb-API-Key", apiKey);
        headers.set("X-Airbnb-GraphQL-Platform", "web");
        headers.set("X-Airbnb-GraphQL-Platform-Client", "minimalist-niobe");
        headers.set("X-CSRF-Without-Token", "1");
        headers.set("X-Client-Request-Id", traceId());
        return headers;
    }

    static String traceId() {
        StringBuilder sb = new StringBuilder(TRACE_ID_LENGTH);
        for (int i = 0; i < TRACE_ID_LENGTH; i++) {
            sb.append(TRACE_ALPHABET.charAt(RANDOM.nextInt(TRACE_ALPHABET.length())));
        }
        return sb.toString();
    }
}
