package com.company.correlation.domain.enums;

import java.time.Instant;

public enum TemporalRelation {
    BEFORE,
    DURING,
    AFTER;

    /**
     * Position of an instant relative to the closed interval [start, end].
     */
    public static TemporalRelation of(Instant timestamp, Instant start, Instant end) {
        if (timestamp.isBefore(start)) return BEFORE;
        if (timestamp.isAfter(end)) return AFTER;
        return DURING;
    }
}
