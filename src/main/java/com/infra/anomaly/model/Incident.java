package com.infra.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Incident {
    private String id;
    private String title;
    private Severity severity;
    private IncidentStatus status;
    private String rootCauseInsightId;
    private List<String> relatedInsightIds;
    private List<String> affectedContainers;
    private Long endpointId;
    private String endpointName;
    private CorrelationType correlationType;
    private CorrelationConfidence correlationConfidence;
    private int insightCount;
    private String summary;
    private long createdAt;
    private long updatedAt;
    private long resolvedAt;            // 0 while active

    /**
     * Root cause first, then related insights.
     */
    public List<String> allInsightIds() {
        List<String> ids = new ArrayList<>();
        if (rootCauseInsightId != null) {
            ids.add(rootCauseInsightId);
        }
        if (relatedInsightIds != null) {
            ids.addAll(relatedInsightIds);
        }
        return ids;
    }
}
