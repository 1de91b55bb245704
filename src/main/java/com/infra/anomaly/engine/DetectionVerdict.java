package com.infra.anomaly.engine;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionVerdict {
    private boolean anomalous;
    private double threshold;
    private double zScore;
}
