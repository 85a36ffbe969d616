package com.company.correlation.domain;

import lombok.Value;

/**
 * Effective threshold configuration for one entity after per-entity
 * overrides have been merged over the global defaults.
 */
@Value
public class ThresholdConfig {
    double medianPercentage;
    double staticThreshold;
}
