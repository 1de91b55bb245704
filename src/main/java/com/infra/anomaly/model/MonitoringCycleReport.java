package com.infra.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonitoringCycleReport {
    private int samplesEvaluated;
    private int detectionsSkipped;      // insufficient history
    private int anomaliesDetected;
    private int anomaliesSuppressed;    // still cooling down
    private int insightsCorrelated;
    private CorrelationResult correlation;
    private long startedAt;
    private long durationMs;
}
