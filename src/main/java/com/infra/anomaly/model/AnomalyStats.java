package com.infra.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Rolling statistics for one container+metric over the configured window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyStats {
    private double mean;
    private double stdDev;
    private long sampleCount;

    /**
     * Coefficient of variation. 0 when the mean is not positive.
     */
    public double coefficientOfVariation() {
        return mean > 0 ? stdDev / mean : 0.0;
    }
}
