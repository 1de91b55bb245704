package com.infra.anomaly.correlation;

import com.infra.anomaly.config.CorrelationConfig;
import com.infra.anomaly.config.MetricsConfig;
import com.infra.anomaly.model.CorrelationResult;
import com.infra.anomaly.model.CorrelationType;
import com.infra.anomaly.model.Incident;
import com.infra.anomaly.model.IncidentInsert;
import com.infra.anomaly.model.Insight;
import com.infra.anomaly.model.InsightCluster;
import com.infra.anomaly.repository.IncidentRepository;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Groups a monitoring cycle's anomaly insights into incidents.
 *
 * Flow:
 * 1. Split off non-anomaly insights (always ungrouped)
 * 2. One anomaly: join an active incident for its container, if any
 * 3. Several anomalies: rule-based grouping (dedup / cascade / temporal)
 * 4. Optional semantic pass over the remaining singles
 * 5. Optional narrative summaries for multi-insight groups
 * 6. Persist each group of 2+ as a new incident; singles join an active incident or stay ungrouped
 *
 * Enrichment (similarity, narrative) and persistence failures never abort the
 * run: they fall back to rule-based behavior or count the affected insights as ungrouped.
 */
@Service
public class IncidentCorrelator {

    private static final Logger log = LoggerFactory.getLogger(IncidentCorrelator.class);

    private final IncidentRepository incidentRepository;
    private final CorrelationGrouper grouper;
    private final IncidentFactory incidentFactory;
    private final NarrativeSummaryCache narrativeCache;
    private final Optional<NarrativeSummarizer> narrativeSummarizer;
    private final CorrelationConfig config;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;

    public IncidentCorrelator(IncidentRepository incidentRepository,
                              CorrelationGrouper grouper,
                              IncidentFactory incidentFactory,
                              NarrativeSummaryCache narrativeCache,
                              Optional<NarrativeSummarizer> narrativeSummarizer,
                              CorrelationConfig config,
                              MetricsConfig metricsConfig,
                              Tracer tracer) {
        this.incidentRepository = incidentRepository;
        this.grouper = grouper;
        this.incidentFactory = incidentFactory;
        this.narrativeCache = narrativeCache;
        this.narrativeSummarizer = narrativeSummarizer;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.tracer = tracer;
    }

    public CorrelationResult correlate(List<Insight> insights) {
        return correlate(insights, config.getWindowMinutes(), null);
    }

    public CorrelationResult correlate(List<Insight> insights, int windowMinutes) {
        return correlate(insights, windowMinutes, null);
    }

    /**
     * Correlate one batch.
     *
     * @param insights      the cycle's insights, earliest created first
     * @param windowMinutes how old an active incident may be and still absorb a single insight
     * @param similarity    clusterer for the semantic pass, or null to skip it
     * @return counts; grouped + ungrouped always equals the batch size
     */
    @Observed(name = "incidents.correlate", contextualName = "correlate-insights")
    public CorrelationResult correlate(List<Insight> insights, int windowMinutes, SimilarityClusterer similarity) {
        CorrelationResult result = CorrelationResult.empty();
        if (insights.isEmpty()) return result;

        // Snapshot once so a concurrent settings change cannot split a run.
        boolean smartGrouping = config.getSmartGrouping().isEnabled();
        double similarityThreshold = config.getSmartGrouping().getSimilarityThreshold();
        boolean narrativeEnabled = config.getIncidentSummary().isEnabled();

        List<Insight> anomalies = insights.stream()
                .filter(i -> i.getCategory() != null && i.getCategory().isCorrelatable())
                .collect(Collectors.toList());
        int others = insights.size() - anomalies.size();

        if (anomalies.size() == 1) {
            attachSingle(anomalies.get(0), windowMinutes, result);
        } else if (anomalies.size() > 1) {
            List<InsightGroup> groups = grouper.groupByCorrelation(anomalies);

            if (smartGrouping && similarity != null) {
                applySemanticGrouping(groups, similarity, similarityThreshold);
            }
            if (narrativeEnabled && narrativeSummarizer.isPresent()) {
                applyNarratives(groups, narrativeSummarizer.get());
            }

            for (InsightGroup group : groups) {
                if (group.isSingle()) {
                    attachSingle(group.getInsights().get(0), windowMinutes, result);
                } else {
                    createIncident(group, result);
                }
            }
        }

        result.setInsightsUngrouped(result.getInsightsUngrouped() + others);
        metricsConfig.recordCorrelation(result);
        return result;
    }

    private void attachSingle(Insight insight, int windowMinutes, CorrelationResult result) {
        if (insight.getContainerId() == null) {
            result.setInsightsUngrouped(result.getInsightsUngrouped() + 1);
            return;
        }

        try {
            Incident existing = incidentRepository.getActiveIncidentForContainer(
                    insight.getContainerId(), windowMinutes);
            if (existing != null) {
                incidentRepository.addInsightToIncident(
                        existing.getId(), insight.getId(), insight.getContainerName());
                result.setInsightsGrouped(result.getInsightsGrouped() + 1);
                log.debug("Added insight {} to existing incident {}", insight.getId(), existing.getId());
                return;
            }
        } catch (Exception e) {
            metricsConfig.recordPersistenceFailure();
            log.error("Failed to attach insight {} to an active incident: {}",
                    insight.getId(), e.getMessage(), e);
        }
        result.setInsightsUngrouped(result.getInsightsUngrouped() + 1);
    }

    private void createIncident(InsightGroup group, CorrelationResult result) {
        IncidentInsert incident = incidentFactory.build(group);
        try {
            incidentRepository.insertIncident(incident);
            result.setIncidentsCreated(result.getIncidentsCreated() + 1);
            result.setInsightsGrouped(result.getInsightsGrouped() + group.size());
            metricsConfig.recordIncidentCreated(incident);
            log.info("New incident {} created from {} correlated insights (type={})",
                    incident.getId(), group.size(), group.getCorrelationType().getTag());
        } catch (Exception e) {
            metricsConfig.recordPersistenceFailure();
            log.error("Failed to create incident for group of {}: {}", group.size(), e.getMessage(), e);
            result.setInsightsUngrouped(result.getInsightsUngrouped() + group.size());
        }
    }

    /**
     * Replaces singles that the clusterer puts together with one semantic group
     * per cluster. Clusters that match fewer than two current singles are ignored.
     */
    void applySemanticGrouping(List<InsightGroup> groups, SimilarityClusterer similarity, double threshold) {
        List<Insight> singles = groups.stream()
                .filter(InsightGroup::isSingle)
                .map(g -> g.getInsights().get(0))
                .collect(Collectors.toList());
        if (singles.size() < 2) return;

        List<InsightCluster> clusters;
        Span span = tracer.nextSpan().name("correlation.similarity")
                .tag("candidates", String.valueOf(singles.size()))
                .start();
        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            clusters = similarity.findSimilarInsights(singles, threshold);
        } catch (Exception e) {
            span.error(e);
            metricsConfig.recordEnrichmentFailure("similarity");
            log.warn("Similarity clustering failed, skipping semantic grouping: {}", e.getMessage());
            return;
        } finally {
            span.end();
        }
        if (clusters == null) return;

        for (InsightCluster cluster : clusters) {
            List<InsightGroup> matched = new ArrayList<>();
            for (Insight insight : cluster.getInsights()) {
                groups.stream()
                        .filter(g -> g.isSingle() && !matched.contains(g)
                                && g.getInsights().get(0).getId().equals(insight.getId()))
                        .findFirst()
                        .ifPresent(matched::add);
            }
            if (matched.size() < 2) continue;

            groups.removeIf(g -> matched.stream().anyMatch(m -> m == g));
            List<Insight> members = matched.stream()
                    .map(g -> g.getInsights().get(0))
                    .collect(Collectors.toList());
            groups.add(InsightGroup.rankedBySeverity(members, CorrelationType.SEMANTIC));
        }
    }

    void applyNarratives(List<InsightGroup> groups, NarrativeSummarizer summarizer) {
        boolean available;
        try {
            available = summarizer.isAvailable();
        } catch (Exception e) {
            metricsConfig.recordEnrichmentFailure("narrative");
            log.debug("Narrative availability check failed: {}", e.getMessage());
            return;
        }
        if (!available) return;

        for (InsightGroup group : groups) {
            if (group.isSingle()) continue;

            Optional<String> cached = narrativeCache.get(group.getInsights(), group.getCorrelationType());
            if (cached.isPresent()) {
                group.setNarrativeSummary(cached.get());
                continue;
            }

            Span span = tracer.nextSpan().name("correlation.narrative")
                    .tag("correlation.type", group.getCorrelationType().getTag())
                    .tag("group.size", String.valueOf(group.size()))
                    .start();
            try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
                String narrative = summarizer.generateNarrativeSummary(
                        group.getInsights(), group.getCorrelationType());
                if (narrative != null && !narrative.isBlank()) {
                    group.setNarrativeSummary(narrative);
                    narrativeCache.put(group.getInsights(), group.getCorrelationType(), narrative);
                }
            } catch (Exception e) {
                span.error(e);
                metricsConfig.recordEnrichmentFailure("narrative");
                log.debug("Narrative summary failed, using rule-based summary: {}", e.getMessage());
            } finally {
                span.end();
            }
        }
    }
}
