package com.infra.anomaly.config;

import com.infra.anomaly.model.AnomalyDetectionResult;
import com.infra.anomaly.model.CorrelationResult;
import com.infra.anomaly.model.IncidentInsert;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger lastCycleAnomalies;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.lastCycleAnomalies = registry.gauge("monitoring.last_cycle.anomalies", new AtomicInteger(0));
    }

    public void recordDetection(AnomalyDetectionResult result) {
        Counter.builder("anomaly.detection.count")
                .tag("method", result.getMethod().getTag())
                .tag("anomalous", String.valueOf(result.isAnomalous()))
                .register(registry)
                .increment();
    }

    public void recordIncidentCreated(IncidentInsert incident) {
        Counter.builder("incident.created.count")
                .tag("correlation_type", incident.getCorrelationType().getTag())
                .tag("confidence", incident.getCorrelationConfidence().name().toLowerCase())
                .register(registry)
                .increment();
    }

    public void recordCorrelation(CorrelationResult result) {
        Counter.builder("correlation.insights.count")
                .tag("outcome", "grouped")
                .register(registry)
                .increment(result.getInsightsGrouped());
        Counter.builder("correlation.insights.count")
                .tag("outcome", "ungrouped")
                .register(registry)
                .increment(result.getInsightsUngrouped());
    }

    public void recordPersistenceFailure() {
        Counter.builder("incident.persistence.failure.count")
                .register(registry)
                .increment();
    }

    public void recordEnrichmentFailure(String stage) {
        Counter.builder("enrichment.failure.count")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    public void updateLastCycleAnomalies(int count) {
        lastCycleAnomalies.set(count);
    }
}
