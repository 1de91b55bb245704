package com.infra.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "correlation")
public class CorrelationConfig {

    // Active incidents older than this are not joined by new insights.
    private int windowMinutes = 5;

    private SmartGrouping smartGrouping = new SmartGrouping();

    private IncidentSummary incidentSummary = new IncidentSummary();

    @Data
    public static class SmartGrouping {
        private boolean enabled = false;
        private double similarityThreshold = 0.3;
    }

    @Data
    public static class IncidentSummary {
        private boolean enabled = false;
        private long cacheTtlSeconds = 600;
    }
}
