package com.infra.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A set of insights judged similar by a similarity collaborator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InsightCluster {
    private List<Insight> insights;
}
