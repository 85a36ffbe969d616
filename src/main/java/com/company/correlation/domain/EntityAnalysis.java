package com.company.correlation.domain;

import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of threshold calculation and segmentation for one entity.
 */
@Value
public class EntityAnalysis {
    String entityId;
    EntityStatistics statistics;
    List<DegradationPeriod> periods;
    SkippedEntity skipped;

    public static EntityAnalysis detected(EntityStatistics statistics, List<DegradationPeriod> periods) {
        return new EntityAnalysis(statistics.getEntityId(), statistics, List.copyOf(periods), null);
    }

    public static EntityAnalysis skipped(SkippedEntity skipped) {
        EntityStatistics statistics = EntityStatistics.builder()
                .entityId(skipped.getEntityId())
                .sampleCount(0)
                .degradationCount(0)
                .skipReason(skipped.getReason())
                .build();
        return new EntityAnalysis(skipped.getEntityId(), statistics, List.of(), skipped);
    }

    public Optional<SkippedEntity> getSkipped() {
        return Optional.ofNullable(skipped);
    }
}
