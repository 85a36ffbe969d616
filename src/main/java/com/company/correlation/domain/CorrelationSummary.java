package com.company.correlation.domain;

import com.company.correlation.domain.enums.DegradationSeverity;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class CorrelationSummary {
    int totalDegradations;
    int affectedEntities;
    int totalConsolidatedAlarms;
    int degradationsWithAlarms;
    int degradationsWithoutAlarms;
    Map<DegradationSeverity, Integer> degradationsBySeverity;
    int unresolvedAlarmEvents;
    int skippedEntities;

    public static CorrelationSummary empty() {
        return CorrelationSummary.builder()
                .degradationsBySeverity(Map.of())
                .build();
    }
}
