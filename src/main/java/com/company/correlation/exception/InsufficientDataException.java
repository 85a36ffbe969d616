package com.company.correlation.exception;

public class InsufficientDataException extends RuntimeException {
    public InsufficientDataException(String entityId) {
        super("No KPI samples for entity: " + entityId);
    }
}
