package com.infra.anomaly.correlation;

import com.infra.anomaly.model.CorrelationType;
import com.infra.anomaly.model.Insight;

import java.util.List;

/**
 * Optional natural-language summary for a correlated group, typically backed
 * by an LLM. Any failure is treated as "no narrative".
 */
public interface NarrativeSummarizer {

    /**
     * Cheap check, called once per correlation run before any summary request.
     */
    boolean isAvailable();

    /**
     * @return the narrative, or null when the model produced nothing usable
     */
    String generateNarrativeSummary(List<Insight> insights, CorrelationType correlationType);
}
