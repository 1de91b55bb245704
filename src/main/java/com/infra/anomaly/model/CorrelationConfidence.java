package com.infra.anomaly.model;

public enum CorrelationConfidence {
    HIGH,
    MEDIUM,
    LOW
}
