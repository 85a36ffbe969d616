package com.company.correlation.domain;

import lombok.Value;

import java.util.List;

@Value
public class CorrelationResult {
    DegradationPeriod degradation;
    List<ConsolidatedAlarm> consolidatedAlarms;

    /**
     * False is the "no FM correlation found" outcome, which is a valid result.
     */
    public boolean hasCorrelation() {
        return !consolidatedAlarms.isEmpty();
    }
}
