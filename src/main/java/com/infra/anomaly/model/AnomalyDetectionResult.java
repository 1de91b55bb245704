package com.infra.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyDetectionResult {
    private String containerId;
    private String containerName;
    private String metricType;
    private double currentValue;
    private double mean;
    private double stdDev;
    private double zScore;              // rounded to 2 decimals
    private boolean anomalous;
    private double threshold;           // threshold actually applied
    private DetectionMethod method;     // method actually applied, after any downgrade
    private long timestamp;
}
