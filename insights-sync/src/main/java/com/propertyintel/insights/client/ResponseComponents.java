package com.propertyintel.insights.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.propertyintel.insights.client.exception.UpstreamAuthException;
import lombok.extern.slf4j.Slf4j;

/**
 * Navigates the standard performance response envelope:
 * data → porygon → getPerformanceComponents → components[0].
 */
@Slf4j
public final class ResponseComponents {

    private static final String AUTH_ERROR_TYPE = "authentication_required";
    private static final String DEFAULT_AUTH_MESSAGE = "Please login to continue (credentials expired)";

    private ResponseComponents() {
    }

    /**
     * First component of the response, or a missing node when the response carries none.
     *
     * @throws UpstreamAuthException when the response signals expired credentials
     */
    public static JsonNode firstComponent(JsonNode response) {
        checkAuthentication(response);
        JsonNode component = response.path("data").path("porygon")
                .path("getPerformanceComponents").path("components").path(0);
        return component.isObject() ? component : MissingNode.getInstance();
    }

    /**
     * Auth failures come back as HTTP 200: either an error with
     * extensions.errorType = authentication_required, or getPerformanceComponents
     * present but explicitly null.
     */
    public static void checkAuthentication(JsonNode response) {
        boolean authError = false;
        String message = DEFAULT_AUTH_MESSAGE;

        JsonNode errors = response.path("errors");
        for (JsonNode error : errors) {
            if (AUTH_ERROR_TYPE.equals(error.path("extensions").path("errorType").asText(null))) {
                authError = true;
            }
        }
        if (errors.size() > 0 && errors.get(0).hasNonNull("message")) {
            message = errors.get(0).get("message").asText();
        }

        JsonNode porygon = response.path("data").path("porygon");
        if (!authError && porygon.has("getPerformanceComponents") && porygon.get("getPerformanceComponents").isNull()) {
            authError = true;
        }

        if (authError) {
            log.error("[AUTH_FAILURE] {}", message);
            throw new UpstreamAuthException("Upstream authentication failed: " + message);
        }
    }
}
