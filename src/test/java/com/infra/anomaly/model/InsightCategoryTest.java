package com.infra.anomaly.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InsightCategoryTest {

    @Test
    void fromTag_foldsPrefixedTags() {
        assertThat(InsightCategory.fromTag("anomaly")).isEqualTo(InsightCategory.ANOMALY);
        assertThat(InsightCategory.fromTag("security:root-user")).isEqualTo(InsightCategory.SECURITY);
        assertThat(InsightCategory.fromTag("ai-analysis")).isEqualTo(InsightCategory.AI_ANALYSIS);
        assertThat(InsightCategory.fromTag("ANOMALY")).isEqualTo(InsightCategory.ANOMALY);
    }

    @Test
    void fromTag_unknownOrBlank_isOther() {
        assertThat(InsightCategory.fromTag("capacity-forecast")).isEqualTo(InsightCategory.OTHER);
        assertThat(InsightCategory.fromTag(null)).isEqualTo(InsightCategory.OTHER);
        assertThat(InsightCategory.fromTag(" ")).isEqualTo(InsightCategory.OTHER);
    }

    @Test
    void onlyAnomalyIsCorrelatable() {
        for (InsightCategory category : InsightCategory.values()) {
            assertThat(category.isCorrelatable()).isEqualTo(category == InsightCategory.ANOMALY);
        }
    }
}
