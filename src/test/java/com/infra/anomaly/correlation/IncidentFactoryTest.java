package com.infra.anomaly.correlation;

import com.infra.anomaly.model.CorrelationConfidence;
import com.infra.anomaly.model.CorrelationType;
import com.infra.anomaly.model.IncidentInsert;
import com.infra.anomaly.model.Insight;
import com.infra.anomaly.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.infra.anomaly.testutil.TestDataFactory.BASE_TIME;
import static com.infra.anomaly.testutil.TestDataFactory.createAnomalyInsight;
import static org.assertj.core.api.Assertions.assertThat;

class IncidentFactoryTest {

    private final IncidentFactory factory = new IncidentFactory();

    private static Insight insight(String id, String container, Severity severity) {
        return createAnomalyInsight(id, 1L, "id-" + container, container, "cpu", severity, BASE_TIME);
    }

    private static InsightGroup group(CorrelationType type, Insight... insights) {
        return InsightGroup.rankedBySeverity(List.of(insights), type);
    }

    @Test
    void title_dedupOnOneContainer() {
        InsightGroup group = group(CorrelationType.DEDUP,
                insight("i1", "web-app", Severity.WARNING), insight("i2", "web-app", Severity.WARNING));

        assertThat(factory.title(group)).isEqualTo("Multiple anomalies on \"web-app\"");
    }

    @Test
    void title_dedupWithSeveralNames_fallsBackToGeneric() {
        InsightGroup group = group(CorrelationType.DEDUP,
                insight("i1", "web-app", Severity.WARNING), insight("i2", "web-app-2", Severity.WARNING));

        assertThat(factory.title(group)).isEqualTo("Correlated anomalies on endpoint-1 (2 alerts)");
    }

    @Test
    void title_cascadeNamesUpToThreeContainers() {
        InsightGroup group = group(CorrelationType.CASCADE,
                insight("i1", "web", Severity.WARNING),
                insight("i2", "db", Severity.WARNING),
                insight("i3", "cache", Severity.WARNING));

        assertThat(factory.title(group)).isEqualTo("Cascade anomaly affecting web, db, cache");
    }

    @Test
    void title_cascadeCountsBeyondThreeContainers() {
        InsightGroup group = group(CorrelationType.CASCADE,
                insight("i1", "web", Severity.WARNING),
                insight("i2", "db", Severity.WARNING),
                insight("i3", "cache", Severity.WARNING),
                insight("i4", "queue", Severity.WARNING));

        assertThat(factory.title(group)).isEqualTo("Cascade anomaly affecting 4 containers on endpoint-1");
    }

    @Test
    void title_semantic() {
        InsightGroup small = group(CorrelationType.SEMANTIC,
                insight("i1", "web", Severity.WARNING), insight("i2", "db", Severity.WARNING));
        InsightGroup large = group(CorrelationType.SEMANTIC,
                insight("i1", "a", Severity.WARNING), insight("i2", "b", Severity.WARNING),
                insight("i3", "c", Severity.WARNING), insight("i4", "d", Severity.WARNING));

        assertThat(factory.title(small)).isEqualTo("Similar anomalies on web, db");
        assertThat(factory.title(large)).isEqualTo("Similar anomalies across 4 containers");
    }

    @Test
    void title_temporalWithoutEndpoint() {
        Insight a = createAnomalyInsight("i1", null, "c1", "web", "cpu", Severity.WARNING, BASE_TIME);
        Insight b = createAnomalyInsight("i2", null, "c2", "db", "cpu", Severity.WARNING, BASE_TIME);

        assertThat(factory.title(group(CorrelationType.TEMPORAL, a, b)))
                .isEqualTo("Correlated anomalies on unknown endpoint (2 alerts)");
    }

    @Test
    void summary_cascadeIncludesRootCauseAndBreakdown() {
        Insight critical = insight("i2", "db", Severity.CRITICAL);
        InsightGroup group = group(CorrelationType.CASCADE,
                insight("i1", "web", Severity.WARNING), critical, insight("i3", "cache", Severity.WARNING));

        assertThat(factory.summary(group)).isEqualTo(
                "Cascade detected: 3 containers showing anomalous behavior simultaneously. "
                        + "Likely root cause: " + critical.getTitle()
                        + " Severity breakdown: 1 critical, 2 warning.");
    }

    @Test
    void summary_infoOnlyOmitsBreakdown() {
        InsightGroup group = group(CorrelationType.DEDUP,
                insight("i1", "web", Severity.INFO), insight("i2", "web", Severity.INFO));

        assertThat(factory.summary(group))
                .isEqualTo("2 duplicate anomalies detected for the same container within the correlation window.");
    }

    @Test
    void confidence_rules() {
        Insight a = insight("i1", "web", Severity.WARNING);
        Insight b = insight("i2", "db", Severity.WARNING);
        Insight c = insight("i3", "cache", Severity.WARNING);

        assertThat(factory.confidence(group(CorrelationType.DEDUP, a, b))).isEqualTo(CorrelationConfidence.HIGH);
        assertThat(factory.confidence(group(CorrelationType.CASCADE, a, b, c))).isEqualTo(CorrelationConfidence.HIGH);
        assertThat(factory.confidence(group(CorrelationType.CASCADE, a, b))).isEqualTo(CorrelationConfidence.MEDIUM);
        assertThat(factory.confidence(group(CorrelationType.SEMANTIC, a, b, c))).isEqualTo(CorrelationConfidence.MEDIUM);
        assertThat(factory.confidence(group(CorrelationType.TEMPORAL, a, b))).isEqualTo(CorrelationConfidence.MEDIUM);
    }

    @Test
    void build_separatesRootCauseAndTakesHighestSeverity() {
        Insight warning = insight("i1", "web", Severity.WARNING);
        Insight critical = insight("i2", "db", Severity.CRITICAL);

        IncidentInsert incident = factory.build(group(CorrelationType.CASCADE, warning, critical));

        assertThat(incident.getId()).isNotBlank();
        assertThat(incident.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(incident.getRootCauseInsightId()).isEqualTo("i2");
        assertThat(incident.getRelatedInsightIds()).containsExactly("i1");
        assertThat(incident.getAffectedContainers()).containsExactly("web", "db");
        assertThat(incident.getInsightCount()).isEqualTo(2);
        assertThat(incident.getEndpointId()).isEqualTo(1L);
        assertThat(incident.getSummary()).startsWith("Cascade detected: 2 containers");
    }

    @Test
    void build_prefersNarrativeSummary() {
        InsightGroup group = group(CorrelationType.DEDUP,
                insight("i1", "web", Severity.WARNING), insight("i2", "web", Severity.WARNING));
        group.setNarrativeSummary("Memory pressure on web after deploy.");

        assertThat(factory.build(group).getSummary()).isEqualTo("Memory pressure on web after deploy.");
    }

    @Test
    void containerNames_skipsBlankAndDuplicates() {
        Insight unnamed = insight("i3", "web", Severity.WARNING);
        unnamed.setContainerName("");

        assertThat(IncidentFactory.containerNames(List.of(
                insight("i1", "web", Severity.WARNING), insight("i2", "web", Severity.WARNING), unnamed)))
                .containsExactly("web");
    }
}
