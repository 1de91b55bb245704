package com.infra.anomaly.correlation;

import com.infra.anomaly.model.CorrelationType;
import com.infra.anomaly.model.Insight;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rule-based grouping of one batch of anomaly insights.
 *
 * Per endpoint:
 *   - fewer than 2 insights: passed through as a temporal group
 *   - 2+ insights for one container: dedup group, root cause = earliest
 *   - remaining single-container insights spanning 2+ metric types: one cascade
 *     group, root cause = most severe then earliest
 *   - anything else stays a temporal single
 *
 * Input must be ordered earliest-created first; dedup root causes and group
 * member order rely on it.
 */
@Component
public class CorrelationGrouper {

    // Couples this pass to the title format of AnomalyInsightFactory; only used
    // when an insight carries no explicit metric type.
    private static final Pattern METRIC_TYPE_IN_TITLE =
            Pattern.compile("anomalous\\s+(\\w+)\\s+usage", Pattern.CASE_INSENSITIVE);

    public List<InsightGroup> groupByCorrelation(List<Insight> insights) {
        Map<Long, List<Insight>> byEndpoint = new LinkedHashMap<>();
        for (Insight insight : insights) {
            byEndpoint.computeIfAbsent(insight.getEndpointId(), k -> new ArrayList<>()).add(insight);
        }

        List<InsightGroup> groups = new ArrayList<>();

        for (List<Insight> endpointInsights : byEndpoint.values()) {
            if (endpointInsights.size() < 2) {
                groups.add(InsightGroup.builder()
                        .insights(endpointInsights)
                        .correlationType(CorrelationType.TEMPORAL)
                        .rootCause(endpointInsights.get(0))
                        .build());
                continue;
            }

            List<InsightGroup> singles = new ArrayList<>();
            for (List<Insight> containerGroup : groupByContainer(endpointInsights)) {
                if (containerGroup.size() >= 2) {
                    groups.add(InsightGroup.builder()
                            .insights(containerGroup)
                            .correlationType(CorrelationType.DEDUP)
                            .rootCause(containerGroup.get(0))
                            .build());
                } else {
                    InsightGroup single = InsightGroup.single(containerGroup.get(0));
                    groups.add(single);
                    singles.add(single);
                }
            }

            if (singles.size() < 2) continue;

            List<Insight> cascadeInsights = singles.stream()
                    .flatMap(s -> s.getInsights().stream())
                    .collect(Collectors.toList());
            Set<String> distinctTypes = cascadeInsights.stream()
                    .map(CorrelationGrouper::extractMetricType)
                    .collect(Collectors.toSet());

            // Same metric spiking on several containers is usually one infrastructure-wide blip,
            // not a cascade. Those stay as singles.
            if (distinctTypes.size() >= 2) {
                groups.removeIf(g -> singles.stream().anyMatch(s -> s == g));
                groups.add(InsightGroup.rankedBySeverity(cascadeInsights, CorrelationType.CASCADE));
            }
        }

        return groups;
    }

    /**
     * Explicit metric type when present, else the word in "anomalous &lt;word&gt; usage",
     * else the raw title.
     */
    static String extractMetricType(Insight insight) {
        if (insight.getMetricType() != null && !insight.getMetricType().isBlank()) {
            return insight.getMetricType().toLowerCase();
        }
        return metricTypeFromTitle(insight.getTitle());
    }

    static String metricTypeFromTitle(String title) {
        if (title == null) return "";
        Matcher matcher = METRIC_TYPE_IN_TITLE.matcher(title);
        return matcher.find() ? matcher.group(1).toLowerCase() : title;
    }

    private static List<List<Insight>> groupByContainer(List<Insight> insights) {
        Map<String, List<Insight>> byContainer = new LinkedHashMap<>();
        for (Insight insight : insights) {
            String key = insight.getContainerId() != null ? insight.getContainerId() : insight.getId();
            byContainer.computeIfAbsent(key, k -> new ArrayList<>()).add(insight);
        }
        return new ArrayList<>(byContainer.values());
    }
}
