package com.company.correlation.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class EntityThresholds {
    double median;
    double medianPercentage;
    double dynamicThreshold;
    double staticThreshold;
    /** The lower of the two bars; denominator for deviation. */
    double baseline;

    /**
     * A value is degraded only when it is under both bars.
     */
    public boolean isDegraded(double value) {
        return value < dynamicThreshold && value < staticThreshold;
    }
}
