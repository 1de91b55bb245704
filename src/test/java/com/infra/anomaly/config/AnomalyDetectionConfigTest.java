package com.infra.anomaly.config;

import com.infra.anomaly.model.DetectionMethod;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnomalyDetectionConfigTest {

    private final AnomalyDetectionConfig config = new AnomalyDetectionConfig();

    @Test
    void requestedMethod_autoOrBlankMeansSelectPerSeries() {
        assertThat(config.requestedMethod()).isNull();

        config.setDetectionMethod(" ");
        assertThat(config.requestedMethod()).isNull();

        config.setDetectionMethod("AUTO");
        assertThat(config.requestedMethod()).isNull();
    }

    @Test
    void requestedMethod_parsesTagIgnoringCase() {
        config.setDetectionMethod("Adaptive");

        assertThat(config.requestedMethod()).isEqualTo(DetectionMethod.ADAPTIVE);
    }

    @Test
    void requestedMethod_unknownTag_fails() {
        config.setDetectionMethod("median");

        assertThatThrownBy(config::requestedMethod)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("median");
    }
}
