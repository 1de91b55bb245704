package com.infra.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One raw metric reading for a container, as written by the collector.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricSample {
    private String containerId;
    private String containerName;
    private Long endpointId;
    private String endpointName;
    private String metricType;
    private double value;
    private long timestamp;
}
