package com.infra.anomaly.correlation;

import com.infra.anomaly.model.CorrelationType;
import com.infra.anomaly.model.Insight;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Comparator;
import java.util.List;

/**
 * Working unit of a correlation run. Groups of two or more become incidents;
 * single-insight groups may join an existing incident.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InsightGroup {

    /**
     * Most severe first, then earliest created.
     */
    static final Comparator<Insight> SEVERITY_THEN_EARLIEST =
            Comparator.comparingInt((Insight i) -> i.getSeverity().getRank())
                    .thenComparingLong(Insight::getCreatedAt);

    private List<Insight> insights;
    private CorrelationType correlationType;
    private Insight rootCause;
    private String narrativeSummary;

    public static InsightGroup single(Insight insight) {
        return InsightGroup.builder()
                .insights(List.of(insight))
                .correlationType(CorrelationType.TEMPORAL)
                .rootCause(insight)
                .build();
    }

    public static InsightGroup rankedBySeverity(List<Insight> insights, CorrelationType type) {
        Insight root = insights.stream().sorted(SEVERITY_THEN_EARLIEST).findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Empty insight group"));
        return InsightGroup.builder()
                .insights(insights)
                .correlationType(type)
                .rootCause(root)
                .build();
    }

    public int size() {
        return insights.size();
    }

    public boolean isSingle() {
        return insights.size() < 2;
    }
}
