package com.company.correlation.domain.enums;

public enum SkipReason {
    INSUFFICIENT_DATA("No KPI samples available for entity"),
    PROCESSING_ERROR("Unexpected failure while processing entity");

    private final String description;

    SkipReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
