package com.propertyintel.insights.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate insightsRestTemplate(RestTemplateBuilder builder, InsightsSyncProperties properties) {
        InsightsSyncProperties.Api api = properties.getApi();
        return builder
                .rootUri(api.getBaseUrl())
                .setConnectTimeout(api.getConnectTimeout())
                .setReadTimeout(api.getReadTimeout())
                .build();
    }
}
