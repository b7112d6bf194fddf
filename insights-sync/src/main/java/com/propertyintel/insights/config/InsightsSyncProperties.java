package com.propertyintel.insights.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.ZoneId;

@Component
@ConfigurationProperties(prefix = "insights-sync")
@Validated
@Data
public class InsightsSyncProperties {

    @Valid
    private Api api = new Api();
    @Valid
    private Window window = new Window();
    @Valid
    private Scheduling scheduling = new Scheduling();
    @Valid
    private Sync sync = new Sync();

    @Data
    public static class Api {
        @NotBlank
        private String baseUrl = "https://www.airbnb.com";
        private String apiKey = "";
        @Min(0)
        private long rateLimitDelayMs = 5000;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Window {
        @NotNull
        private DayOfWeek weekStart = DayOfWeek.SUNDAY;
        @Min(1)
        private int lookbackWeeks = 25;
        @Min(0)
        private int incrementalLookbackWeeks = 1;
        @Min(0)
        private int lookaheadWeeks = 5;
        private int maxLookbackDays = 180;     // upstream rejects older offsets
        private int maxLookaheadDays = 182;    // upstream rejects later offsets
    }

    @Data
    public static class Scheduling {
        @NotBlank
        private String cron = "0 0 5 * * *";
        @NotNull
        private ZoneId zone = ZoneId.of("UTC");
        private boolean runOnStartup = true;
        private Duration shutdownGrace = Duration.ofMinutes(5);
    }

    @Data
    public static class Sync {
        @Min(1)
        private int accountParallelism = 8;
        @Min(1)
        private int listingParallelism = 1;
        private boolean dryRun = false;
    }
}
