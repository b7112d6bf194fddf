package com.propertyintel.insights.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.propertyintel.insights.Fixtures;
import com.propertyintel.insights.client.exception.UpstreamAuthException;
import com.propertyintel.insights.client.exception.UpstreamResponseException;
import com.propertyintel.insights.client.exception.UpstreamTransportException;
import com.propertyintel.insights.config.InsightsSyncProperties;
import com.propertyintel.insights.model.AccountCredentials;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class InsightsApiClientTest {

    private static final String PATH = "/api/v3/ChartQuery/abc";
    private static final String URL = "https://insights.test" + PATH;
    private static final AccountCredentials CREDENTIALS = AccountCredentials.builder()
            .cookie("_aat=abc").clientVersion("b1c2d3").userAgent("Mozilla/5.0").build();

    private MockRestServiceServer server;
    private InsightsApiClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplateBuilder().rootUri("https://insights.test").build();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        InsightsSyncProperties properties = Fixtures.properties();
        properties.getApi().setApiKey("test-key");
        client = new InsightsApiClient(restTemplate, Fixtures.MAPPER, properties);
    }

    @Test
    void postsPayloadWithSessionHeaders() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Cookie", "_aat=abc"))
                .andExpect(header("X-Client-Version", "b1c2d3"))
                .andExpect(header("X-Airbnb-API-Key", "test-key"))
                .andExpect(jsonPath("$.operationName").value("ChartQuery"))
                .andRespond(withSuccess(Fixtures.text("chart_query.json"), MediaType.APPLICATION_JSON));

        JsonNode body = client.post(PATH, Map.of("operationName", "ChartQuery"), CREDENTIALS, "test");

        assertThat(body.at("/data/porygon/getPerformanceComponents/components/0/primaryMetric/metricName").asText())
                .isEqualTo("conversion_rate");
        server.verify();
    }

    @Test
    void unauthorizedIsAnAuthFailure() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThatThrownBy(() -> client.post(PATH, Map.of(), CREDENTIALS, "test"))
                .isInstanceOf(UpstreamAuthException.class);
    }

    @Test
    void forbiddenIsAnAuthFailure() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.FORBIDDEN));

        assertThatThrownBy(() -> client.post(PATH, Map.of(), CREDENTIALS, "test"))
                .isInstanceOf(UpstreamAuthException.class);
    }

    @Test
    void serverErrorIsRetryableTransportFailure() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        assertThatThrownBy(() -> client.post(PATH, Map.of(), CREDENTIALS, "test"))
                .isInstanceOf(UpstreamTransportException.class);
    }

    @Test
    void authErrorInsideSuccessfulResponseIsAnAuthFailure() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess(Fixtures.text("auth_error.json"), MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.post(PATH, Map.of(), CREDENTIALS, "test"))
                .isInstanceOf(UpstreamAuthException.class);
    }

    @Test
    void unparseableBodyIsAResponseFailure() {
        server.expect(requestTo(URL)).andRespond(withSuccess("<html>maintenance</html>", MediaType.TEXT_HTML));

        assertThatThrownBy(() -> client.post(PATH, Map.of(), CREDENTIALS, "test"))
                .isInstanceOf(UpstreamResponseException.class);
    }

    @Test
    void everyCallGetsAFreshTraceId() {
        String a = RequestHeaders.traceId();
        String b = RequestHeaders.traceId();

        assertThat(a).hasSize(30).matches("[a-z0-9]+");
        assertThat(a).isNotEqualTo(b);
        assertThat(RequestHeaders.build(CREDENTIALS, "k").getFirst("X-Client-Request-Id")).hasSize(30);
    }
}
