package com.company.correlation.domain;

import com.company.correlation.domain.enums.SkipReason;
import lombok.Builder;
import lombok.Value;

/**
 * Per-entity distribution and the thresholds actually applied to it.
 * Distribution and threshold fields are null for skipped entities.
 */
@Value
@Builder
public class EntityStatistics {
    String entityId;
    Integer sampleCount;
    Double mean;
    Double median;
    Double stdDev;
    Double min;
    Double max;
    Double p5;
    Double p10;
    Double p25;
    Double p75;
    Double p90;
    Double p95;
    Double medianPercentage;
    Double dynamicThreshold;
    Double staticThreshold;
    Double baseline;
    Integer degradationCount;
    SkipReason skipReason;

    public boolean isSkipped() {
        return skipReason != null;
    }
}
