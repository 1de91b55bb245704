package com.infra.anomaly.service;

import com.infra.anomaly.config.AnomalyDetectionConfig;
import com.infra.anomaly.config.CorrelationConfig;
import com.infra.anomaly.config.MetricsConfig;
import com.infra.anomaly.config.MonitoringConfig;
import com.infra.anomaly.correlation.IncidentCorrelator;
import com.infra.anomaly.correlation.SimilarityClusterer;
import com.infra.anomaly.engine.AnomalyDetector;
import com.infra.anomaly.model.AnomalyDetectionResult;
import com.infra.anomaly.model.CorrelationResult;
import com.infra.anomaly.model.DetectionMethod;
import com.infra.anomaly.model.Insight;
import com.infra.anomaly.model.MetricSample;
import com.infra.anomaly.model.MonitoringCycleReport;
import com.infra.anomaly.repository.InsightRepository;
import com.infra.anomaly.repository.MetricSampleRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * One monitoring cycle.
 *
 * Flow:
 * 1. Load the latest sample of every recently reporting container+metric
 * 2. Run anomaly detection on each configured metric type
 * 3. Drop verdicts for container+metric pairs still cooling down
 * 4. Turn the remaining anomalous verdicts into insights and persist them
 * 5. Add insights produced elsewhere in the cycle, order earliest first
 * 6. Correlate the batch into incidents
 */
@Service
public class MonitoringCycleService {

    private static final Logger log = LoggerFactory.getLogger(MonitoringCycleService.class);

    private final MetricSampleRepository metricSampleRepository;
    private final InsightRepository insightRepository;
    private final AnomalyDetector anomalyDetector;
    private final AnomalyInsightFactory insightFactory;
    private final AnomalyCooldownTracker cooldownTracker;
    private final IncidentCorrelator incidentCorrelator;
    private final SimilarityClusterer similarityClusterer;
    private final AnomalyDetectionConfig detectionConfig;
    private final CorrelationConfig correlationConfig;
    private final MonitoringConfig monitoringConfig;
    private final MetricsConfig metricsConfig;

    public MonitoringCycleService(MetricSampleRepository metricSampleRepository,
                                  InsightRepository insightRepository,
                                  AnomalyDetector anomalyDetector,
                                  AnomalyInsightFactory insightFactory,
                                  AnomalyCooldownTracker cooldownTracker,
                                  IncidentCorrelator incidentCorrelator,
                                  SimilarityClusterer similarityClusterer,
                                  AnomalyDetectionConfig detectionConfig,
                                  CorrelationConfig correlationConfig,
                                  MonitoringConfig monitoringConfig,
                                  MetricsConfig metricsConfig) {
        this.metricSampleRepository = metricSampleRepository;
        this.insightRepository = insightRepository;
        this.anomalyDetector = anomalyDetector;
        this.insightFactory = insightFactory;
        this.cooldownTracker = cooldownTracker;
        this.incidentCorrelator = incidentCorrelator;
        this.similarityClusterer = similarityClusterer;
        this.detectionConfig = detectionConfig;
        this.correlationConfig = correlationConfig;
        this.monitoringConfig = monitoringConfig;
        this.metricsConfig = metricsConfig;
    }

    @Scheduled(fixedRateString = "${monitoring.cycle-interval-seconds:60}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "30")
    // runCycle is called on this, not through the proxy, so the scheduled path is observed here.
    @Observed(name = "monitoring.cycle.scheduled", contextualName = "scheduled-monitoring-cycle")
    public void scheduledCycle() {
        if (!monitoringConfig.isEnabled()) {
            return;
        }
        try {
            runCycle(List.of());
        } catch (Exception e) {
            log.error("Monitoring cycle failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Run a cycle now.
     *
     * @param externalInsights insights already produced this cycle by other detectors
     *                         (security, AI analysis); they are correlated alongside anomalies
     */
    @Observed(name = "monitoring.cycle", contextualName = "run-monitoring-cycle")
    public MonitoringCycleReport runCycle(List<Insight> externalInsights) {
        long startedAt = System.currentTimeMillis();
        long since = startedAt - monitoringConfig.getSampleMaxAgeMinutes() * 60_000L;
        DetectionMethod requestedMethod = detectionConfig.requestedMethod();
        List<MetricSample> samples = metricSampleRepository.findLatestSamples(since);

        List<Insight> anomalyInsights = new ArrayList<>();
        int evaluated = 0;
        int skipped = 0;
        int suppressed = 0;

        for (MetricSample sample : samples) {
            if (!detectionConfig.getMetricTypes().contains(sample.getMetricType())) continue;
            evaluated++;

            AnomalyDetectionResult result;
            try {
                result = anomalyDetector.detect(sample.getContainerId(), sample.getContainerName(),
                        sample.getMetricType(), sample.getValue(), requestedMethod);
            } catch (Exception e) {
                log.error("Detection failed for container {} metric {}: {}",
                        sample.getContainerId(), sample.getMetricType(), e.getMessage(), e);
                continue;
            }

            if (result == null) {
                skipped++;
                log.debug("Insufficient samples for container {} metric {}",
                        sample.getContainerId(), sample.getMetricType());
                continue;
            }

            metricsConfig.recordDetection(result);
            if (!result.isAnomalous()) continue;

            if (!cooldownTracker.tryFlag(sample.getContainerId(), sample.getMetricType())) {
                suppressed++;
                log.debug("Anomaly suppressed by cooldown for container {} metric {}",
                        sample.getContainerId(), sample.getMetricType());
                continue;
            }

            log.warn("Anomaly detected for container={} metric={}: value={}, mean={}, z={}, method={}, threshold={}",
                    result.getContainerName(), result.getMetricType(), result.getCurrentValue(),
                    String.format("%.2f", result.getMean()), result.getZScore(),
                    result.getMethod().getTag(), result.getThreshold());

            Insight insight = insightFactory.fromDetection(result, sample, System.currentTimeMillis());
            try {
                insightRepository.save(insight);
                anomalyInsights.add(insight);
            } catch (Exception e) {
                // Correlating an unsaved insight would leave incidents pointing at nothing.
                log.warn("Failed to store insight {}: {}", insight.getId(), e.getMessage());
            }
        }

        List<Insight> batch = new ArrayList<>(externalInsights);
        batch.addAll(anomalyInsights);
        batch.sort(Comparator.comparingLong(Insight::getCreatedAt));

        CorrelationResult correlation = CorrelationResult.empty();
        try {
            correlation = incidentCorrelator.correlate(
                    batch, correlationConfig.getWindowMinutes(), similarityClusterer);
            if (correlation.getIncidentsCreated() > 0) {
                log.info("Alert correlation completed: incidentsCreated={}, insightsGrouped={}",
                        correlation.getIncidentsCreated(), correlation.getInsightsGrouped());
            }
        } catch (Exception e) {
            log.warn("Alert correlation failed: {}", e.getMessage(), e);
        }

        metricsConfig.updateLastCycleAnomalies(anomalyInsights.size());

        MonitoringCycleReport report = MonitoringCycleReport.builder()
                .samplesEvaluated(evaluated)
                .detectionsSkipped(skipped)
                .anomaliesDetected(anomalyInsights.size())
                .anomaliesSuppressed(suppressed)
                .insightsCorrelated(batch.size())
                .correlation(correlation)
                .startedAt(startedAt)
                .durationMs(System.currentTimeMillis() - startedAt)
                .build();

        log.info("Monitoring cycle complete: evaluated={}, skipped={}, anomalies={}, suppressed={}, batch={}, duration={}ms",
                evaluated, skipped, anomalyInsights.size(), suppressed, batch.size(), report.getDurationMs());
        return report;
    }
}
