package com.company.correlation.domain.enums;

/**
 * Perceived severity of a fault-management alarm event.
 */
public enum AlarmSeverity {
    CRITICAL,
    MAJOR,
    MINOR,
    WARNING,
    CLEARED;

    public boolean isCleared() {
        return this == CLEARED;
    }

    public static AlarmSeverity fromString(String severity) {
        if (severity == null) {
            return WARNING;
        }
        try {
            return AlarmSeverity.valueOf(severity.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            // INDETERMINATE and vendor-specific values
            return WARNING;
        }
    }
}
