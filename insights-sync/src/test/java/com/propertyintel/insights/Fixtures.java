package com.propertyintel.insights;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.insights.config.InsightsSyncProperties;
import com.propertyintel.insights.model.Account;
import com.propertyintel.insights.model.AccountCredentials;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Instant;

public final class Fixtures {

    public static final ObjectMapper MAPPER = new ObjectMapper();

    private Fixtures() {
    }

    public static JsonNode json(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) throw new IllegalArgumentException("No fixture " + name);
            return MAPPER.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String text(String name) {
        return json(name).toString();
    }

    public static Account account(String accountId, Instant lastSyncAt) {
        return Account.builder()
                .accountId(accountId)
                .active(true)
                .lastSyncAt(lastSyncAt)
                .credentials(AccountCredentials.builder()
                        .cookie("_aat=abc; _airbed_session_id=xyz")
                        .clientVersion("b1c2d3")
                        .userAgent("Mozilla/5.0")
                        .build())
                .build();
    }

    /** Defaults with no upstream pause. */
    public static InsightsSyncProperties properties() {
        InsightsSyncProperties properties = new InsightsSyncProperties();
        properties.getApi().setRateLimitDelayMs(0);
        return properties;
    }
}
