package com.infra.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Insight {
    private String id;
    private Long endpointId;            // null when the producer could not attribute an endpoint
    private String endpointName;
    private String containerId;
    private String containerName;
    private Severity severity;
    private InsightCategory category;
    private String metricType;          // set by the anomaly producer; null for older insights
    private String title;
    private String description;
    private String suggestedAction;
    private long createdAt;             // epoch millis
    private boolean acknowledged;
}
