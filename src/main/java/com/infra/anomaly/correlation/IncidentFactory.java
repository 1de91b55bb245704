package com.infra.anomaly.correlation;

import com.infra.anomaly.model.CorrelationConfidence;
import com.infra.anomaly.model.CorrelationType;
import com.infra.anomaly.model.IncidentInsert;
import com.infra.anomaly.model.Insight;
import com.infra.anomaly.model.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Turns a correlated group into an incident: severity, affected containers,
 * title, rule-based summary and confidence.
 */
@Component
public class IncidentFactory {

    private static final int MAX_NAMED_CONTAINERS = 3;

    public IncidentInsert build(InsightGroup group) {
        List<Insight> insights = group.getInsights();
        Insight rootCause = group.getRootCause();

        List<String> relatedIds = insights.stream()
                .map(Insight::getId)
                .filter(id -> !id.equals(rootCause.getId()))
                .collect(Collectors.toList());

        String summary = group.getNarrativeSummary() != null
                ? group.getNarrativeSummary()
                : summary(group);

        return IncidentInsert.builder()
                .id(UUID.randomUUID().toString())
                .title(title(group))
                .severity(Severity.highest(insights))
                .rootCauseInsightId(rootCause.getId())
                .relatedInsightIds(relatedIds)
                .affectedContainers(containerNames(insights))
                .endpointId(rootCause.getEndpointId())
                .endpointName(rootCause.getEndpointName())
                .correlationType(group.getCorrelationType())
                .correlationConfidence(confidence(group))
                .insightCount(insights.size())
                .summary(summary)
                .build();
    }

    public String title(InsightGroup group) {
        List<Insight> insights = group.getInsights();
        List<String> containers = containerNames(insights);
        String endpointName = insights.get(0).getEndpointName();

        switch (group.getCorrelationType()) {
            case DEDUP:
                if (containers.size() == 1) {
                    return "Multiple anomalies on \"" + containers.get(0) + "\"";
                }
                break;
            case CASCADE:
                if (containers.size() <= MAX_NAMED_CONTAINERS) {
                    return "Cascade anomaly affecting " + String.join(", ", containers);
                }
                return "Cascade anomaly affecting " + containers.size() + " containers"
                        + (isPresent(endpointName) ? " on " + endpointName : "");
            case SEMANTIC:
                if (containers.size() <= MAX_NAMED_CONTAINERS) {
                    return "Similar anomalies on " + String.join(", ", containers);
                }
                return "Similar anomalies across " + containers.size() + " containers";
            case TEMPORAL:
            default:
                break;
        }

        return "Correlated anomalies on " + (isPresent(endpointName) ? endpointName : "unknown endpoint")
                + " (" + insights.size() + " alerts)";
    }

    /**
     * Rule-based summary. Always available as the fallback for a failed narrative.
     */
    public String summary(InsightGroup group) {
        List<Insight> insights = group.getInsights();
        int count = insights.size();
        List<String> parts = new ArrayList<>();

        switch (group.getCorrelationType()) {
            case CASCADE:
                parts.add("Cascade detected: " + count
                        + " containers showing anomalous behavior simultaneously.");
                parts.add("Likely root cause: " + group.getRootCause().getTitle());
                break;
            case DEDUP:
                parts.add(count + " duplicate anomalies detected for the same container within the correlation window.");
                break;
            case SEMANTIC:
                parts.add(count + " semantically similar anomalies grouped by text similarity analysis.");
                parts.add("Primary alert: " + group.getRootCause().getTitle());
                break;
            case TEMPORAL:
            default:
                parts.add(count + " related anomalies detected within the correlation window.");
                break;
        }

        long critical = insights.stream().filter(i -> i.getSeverity() == Severity.CRITICAL).count();
        long warning = insights.stream().filter(i -> i.getSeverity() == Severity.WARNING).count();
        if (critical > 0 || warning > 0) {
            parts.add("Severity breakdown: " + critical + " critical, " + warning + " warning.");
        }

        return String.join(" ", parts);
    }

    /**
     * dedup is always high, cascade is high from three members up, everything else medium.
     * Nothing currently yields LOW.
     */
    public CorrelationConfidence confidence(InsightGroup group) {
        CorrelationType type = group.getCorrelationType();
        if (type == CorrelationType.DEDUP) {
            return CorrelationConfidence.HIGH;
        }
        if (type == CorrelationType.CASCADE && group.size() >= 3) {
            return CorrelationConfidence.HIGH;
        }
        return CorrelationConfidence.MEDIUM;
    }

    static List<String> containerNames(List<Insight> insights) {
        return insights.stream()
                .map(Insight::getContainerName)
                .filter(Objects::nonNull)
                .filter(name -> !name.isEmpty())
                .distinct()
                .collect(Collectors.toList());
    }

    private static boolean isPresent(String s) {
        return s != null && !s.isEmpty();
    }
}
