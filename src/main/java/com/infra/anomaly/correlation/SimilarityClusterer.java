package com.infra.anomaly.correlation;

import com.infra.anomaly.model.Insight;
import com.infra.anomaly.model.InsightCluster;

import java.util.List;

/**
 * Groups insights whose text is similar enough to describe the same problem.
 * Implementations own any timeout; failures surface as ordinary exceptions.
 */
@FunctionalInterface
public interface SimilarityClusterer {

    /**
     * @param insights  candidates, in batch order
     * @param threshold minimum similarity (0..1) for two insights to share a cluster
     * @return clusters of two or more insights; insights in no cluster are omitted
     */
    List<InsightCluster> findSimilarInsights(List<Insight> insights, double threshold);
}
