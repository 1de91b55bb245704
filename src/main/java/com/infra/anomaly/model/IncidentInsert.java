package com.infra.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A freshly correlated incident, ready to be written to the incident store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentInsert {
    private String id;
    private String title;
    private Severity severity;
    private String rootCauseInsightId;
    private List<String> relatedInsightIds;     // excludes the root cause
    private List<String> affectedContainers;    // distinct container names
    private Long endpointId;
    private String endpointName;
    private CorrelationType correlationType;
    private CorrelationConfidence correlationConfidence;
    private int insightCount;
    private String summary;
}
