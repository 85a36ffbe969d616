package com.company.correlation.domain;

import lombok.Value;

import java.util.List;

/**
 * Everything one pipeline run hands to downstream collaborators: the
 * correlation results, per-entity statistics, and the entities that could
 * not be processed (kept apart from "no alarms found").
 */
@Value
public class CorrelationReport {
    List<CorrelationResult> results;
    List<EntityStatistics> statistics;
    List<SkippedEntity> skippedEntities;
    CorrelationSummary summary;
}
