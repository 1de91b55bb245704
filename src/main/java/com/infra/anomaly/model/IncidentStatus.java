package com.infra.anomaly.model;

public enum IncidentStatus {
    ACTIVE,
    RESOLVED
}
