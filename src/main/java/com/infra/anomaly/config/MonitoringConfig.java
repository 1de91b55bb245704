package com.infra.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "monitoring")
public class MonitoringConfig {
    private boolean enabled = true;
    private int cycleIntervalSeconds = 60;
    private int sampleMaxAgeMinutes = 5;        // older latest-samples belong to stopped containers
}
