package com.infra.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BollingerBands {
    private double upper;
    private double middle;
    private double lower;       // floored at 0, resource metrics are never negative
    private double bandwidth;

    public static BollingerBands of(double mean, double stdDev, double multiplier) {
        double upper = mean + multiplier * stdDev;
        double lower = mean - multiplier * stdDev;
        return BollingerBands.builder()
                .upper(upper)
                .middle(mean)
                .lower(Math.max(0.0, lower))
                .bandwidth(stdDev > 0 ? (upper - lower) / mean : 0.0)
                .build();
    }

    public boolean isOutside(double value) {
        return value > upper || value < lower;
    }
}
