package com.propertyintel.insights.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(InsightsSyncProperties properties) {
        return Clock.system(properties.getScheduling().getZone());
    }
}
