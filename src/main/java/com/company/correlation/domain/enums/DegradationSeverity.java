package com.company.correlation.domain.enums;

import com.company.correlation.domain.SeverityCutPoints;

public enum DegradationSeverity {
    WARNING("Warning - slight dip below baseline"),
    MINOR("Minor degradation - requires attention"),
    MAJOR("Major degradation - urgent attention needed"),
    CRITICAL("Critical degradation - immediate action required");

    private final String description;

    DegradationSeverity(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Classify a deviation percentage. Cut points are strict lower bounds,
     * so a deviation sitting exactly on a cut point falls to the lower tier.
     */
    public static DegradationSeverity classify(double deviationPct, SeverityCutPoints cutPoints) {
        if (deviationPct > cutPoints.getCritical()) return CRITICAL;
        if (deviationPct > cutPoints.getMajor()) return MAJOR;
        if (deviationPct > cutPoints.getMinor()) return MINOR;
        return WARNING;
    }
}
