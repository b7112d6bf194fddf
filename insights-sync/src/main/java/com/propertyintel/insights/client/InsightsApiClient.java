package com.propertyintel.insights.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.insights.client.exception.UpstreamAuthException;
import com.propertyintel.insights.client.exception.UpstreamResponseException;
import com.propertyintel.insights.client.exception.UpstreamTransportException;
import com.propertyintel.insights.config.InsightsSyncProperties;
import com.propertyintel.insights.model.AccountCredentials;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Thin transport over the insights GraphQL endpoint.
 *
 * Rate limiting: the dashboard is not a public API, so every successful call is
 * followed by a pause of rate-limit-delay-ms. Transport failures (connection,
 * timeout, 429, 5xx) surface as {@link UpstreamTransportException} and are retried
 * by Resilience4j with exponential backoff; auth failures are never retried.
 */
@Service
@Slf4j
public class InsightsApiClient {

    private static final long THROTTLED_BACKOFF_MS = 5000;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final InsightsSyncProperties properties;

    public InsightsApiClient(@Qualifier("insightsRestTemplate") RestTemplate restTemplate,
                             ObjectMapper objectMapper,
                             InsightsSyncProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * POST one persisted query and return the parsed body.
     *
     * @param path        e.g. "/api/v3/ChartQuery/{sha}"
     * @param payload     request body, serialised as JSON
     * @param credentials the account's session bundle
     * @param context     short description for logs, e.g. "ChartQuery|123|conversion_rate|2025-05-18_to_2025-06-14|28d"
     */
    @Retry(name = "insightsApi")
    public JsonNode post(String path, Map<String, Object> payload, AccountCredentials credentials, String context) {
        log.debug("Calling insights API: {}", context);
        HttpEntity<Map<String, Object>> request =
                new HttpEntity<>(payload, RequestHeaders.build(credentials, properties.getApi().getApiKey()));
        String body;
        try {
            ResponseEntity<String> response = restTemplate.exchange(path, HttpMethod.POST, request, String.class);
            body = response.getBody();

        } catch (HttpClientErrorException.Unauthorized | HttpClientErrorException.Forbidden e) {
            log.error("[AUTH_FAILURE] {} returned {}", context, e.getStatusCode().value());
            throw new UpstreamAuthException("Upstream rejected credentials (" + e.getStatusCode().value() + ")", e);

        } catch (HttpClientErrorException.TooManyRequests e) {
            log.warn("Rate limited (429) on {}, backing off", context);
            sleepMs(THROTTLED_BACKOFF_MS);
            throw new UpstreamTransportException("Rate limited on " + context, e);

        } catch (HttpServerErrorException e) {
            log.warn("Upstream {} on {}", e.getStatusCode().value(), context);
            throw new UpstreamTransportException("Upstream " + e.getStatusCode().value() + " on " + context, e);

        } catch (ResourceAccessException e) {
            log.warn("Transport failure on {}: {}", context, e.getMessage());
            throw new UpstreamTransportException("Transport failure on " + context, e);

        } catch (HttpClientErrorException e) {
            log.error("Upstream {} on {}: {}", e.getStatusCode().value(), context, e.getMessage());
            throw new UpstreamResponseException("Upstream " + e.getStatusCode().value() + " on " + context, e);
        }

        JsonNode json = parse(body, context);
        ResponseComponents.checkAuthentication(json);
        applyRateLimit();
        return json;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private JsonNode parse(String body, String context) {
        if (body == null || body.isBlank()) {
            throw new UpstreamResponseException("Empty body from " + context);
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new UpstreamResponseException("Unparseable body from " + context, e);
        }
    }

    private void applyRateLimit() {
        sleepMs(properties.getApi().getRateLimitDelayMs());
    }

    private void sleepMs(long ms) {
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
