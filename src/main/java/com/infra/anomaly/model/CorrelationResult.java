package com.infra.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CorrelationResult {
    private int incidentsCreated;
    private int insightsGrouped;
    private int insightsUngrouped;

    public static CorrelationResult empty() {
        return new CorrelationResult(0, 0, 0);
    }

    public int totalInsights() {
        return insightsGrouped + insightsUngrouped;
    }
}
