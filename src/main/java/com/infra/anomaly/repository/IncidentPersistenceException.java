package com.infra.anomaly.repository;

/**
 * Thrown when the incident store rejects a write.
 */
public class IncidentPersistenceException extends RuntimeException {

    public IncidentPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
