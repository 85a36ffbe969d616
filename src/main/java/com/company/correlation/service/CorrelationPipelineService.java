package com.company.correlation.service;

import com.company.correlation.config.CorrelationSettings;
import com.company.correlation.domain.*;
import com.company.correlation.domain.enums.DegradationSeverity;
import com.company.correlation.domain.enums.SkipReason;
import com.company.correlation.event.CorrelationCompletedEvent;
import com.company.correlation.exception.InsufficientDataException;
import com.company.correlation.util.StatisticsUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Runs detection and correlation over one snapshot of KPI samples and alarm
 * events. Entities are isolated from each other: one entity failing is
 * recorded as skipped and never stops the rest of the run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CorrelationPipelineService {

    private static final Comparator<KpiSample> BY_TIMESTAMP = Comparator.comparing(KpiSample::getTimestamp);

    private final EntityIdentityResolver identityResolver;
    private final ThresholdCalculator thresholdCalculator;
    private final DegradationSegmenter segmenter;
    private final CorrelationAssembler assembler;
    private final CorrelationSettings settings;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;

    public CorrelationReport run(List<KpiSample> samples, List<AlarmEvent> alarms) {
        return run(samples, alarms, Set.of());
    }

    /**
     * @param expectedEntities entities to report on even when the sample
     *                         stream has nothing for them; those end up skipped
     */
    public CorrelationReport run(List<KpiSample> samples, List<AlarmEvent> alarms,
                                 Collection<String> expectedEntities) {
        Instant startTime = Instant.now();
        log.info("Starting correlation run: {} KPI samples, {} alarm events", samples.size(), alarms.size());

        SortedMap<String, List<KpiSample>> samplesByEntity = groupByEntity(samples, expectedEntities);

        List<EntityAnalysis> analyses = detectAll(samplesByEntity);

        List<DegradationPeriod> periods = analyses.stream()
                .flatMap(analysis -> analysis.getPeriods().stream())
                .collect(Collectors.toList());
        List<SkippedEntity> skipped = analyses.stream()
                .map(EntityAnalysis::getSkipped)
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
        List<EntityStatistics> statistics = analyses.stream()
                .map(EntityAnalysis::getStatistics)
                .collect(Collectors.toList());

        List<AlarmEvent> canonicalized = alarms.stream()
                .map(identityResolver::canonicalize)
                .collect(Collectors.toList());
        int unresolved = (int) canonicalized.stream()
                .filter(alarm -> alarm.getCanonicalEntityId().isEmpty())
                .count();

        List<CorrelationResult> results = assembler.assemble(
                periods, canonicalized, settings.getTimeBefore(), settings.getTimeAfter());

        CorrelationSummary summary = summarize(results, unresolved, skipped.size());
        CorrelationReport report = new CorrelationReport(
                List.copyOf(results), List.copyOf(statistics), List.copyOf(skipped), summary);

        recordMetrics(summary, Duration.between(startTime, Instant.now()));
        eventPublisher.publishEvent(new CorrelationCompletedEvent(report));

        return report;
    }

    private SortedMap<String, List<KpiSample>> groupByEntity(List<KpiSample> samples,
                                                             Collection<String> expectedEntities) {
        SortedMap<String, List<KpiSample>> byEntity = new TreeMap<>();
        for (KpiSample sample : samples) {
            String entityId = identityResolver.normalizeEntityId(sample.getEntityId());
            byEntity.computeIfAbsent(entityId, k -> new ArrayList<>()).add(sample.withEntityId(entityId));
        }
        // stable sort keeps input order for equal timestamps
        byEntity.values().forEach(list -> list.sort(BY_TIMESTAMP));

        for (String expected : expectedEntities) {
            byEntity.putIfAbsent(identityResolver.normalizeEntityId(expected), List.of());
        }
        for (String configured : settings.getEntityThresholds().keySet()) {
            byEntity.putIfAbsent(configured, List.of());
        }
        return byEntity;
    }

    private List<EntityAnalysis> detectAll(SortedMap<String, List<KpiSample>> samplesByEntity) {
        List<Map.Entry<String, List<KpiSample>>> entries = new ArrayList<>(samplesByEntity.entrySet());
        return (settings.isParallel() ? entries.parallelStream() : entries.stream())
                .map(entry -> analyzeEntity(entry.getKey(), entry.getValue()))
                .collect(Collectors.toList());
    }

    private EntityAnalysis analyzeEntity(String entityId, List<KpiSample> samples) {
        try {
            ThresholdConfig config = settings.thresholdConfigFor(entityId);
            EntityThresholds thresholds = thresholdCalculator.calculate(entityId, samples, config);
            List<DegradationPeriod> periods = segmenter.segment(samples, thresholds, settings.getMinDuration());

            log.debug("Entity {}: {} degradation periods", entityId, periods.size());
            return EntityAnalysis.detected(describe(entityId, samples, thresholds, periods.size()), periods);

        } catch (InsufficientDataException e) {
            log.warn("Skipping entity {}: {}", entityId, e.getMessage());
            return EntityAnalysis.skipped(new SkippedEntity(entityId, SkipReason.INSUFFICIENT_DATA, e.getMessage()));

        } catch (RuntimeException e) {
            log.error("Failed to analyze entity {}", entityId, e);
            return EntityAnalysis.skipped(new SkippedEntity(entityId, SkipReason.PROCESSING_ERROR, e.getMessage()));
        }
    }

    private EntityStatistics describe(String entityId, List<KpiSample> samples,
                                      EntityThresholds thresholds, int degradationCount) {
        List<Double> values = samples.stream().map(KpiSample::getValue).collect(Collectors.toList());
        double stdDev = StatisticsUtils.stdDev(values);

        return EntityStatistics.builder()
                .entityId(entityId)
                .sampleCount(values.size())
                .mean(StatisticsUtils.mean(values))
                .median(thresholds.getMedian())
                .stdDev(Double.isNaN(stdDev) ? null : stdDev)
                .min(Collections.min(values))
                .max(Collections.max(values))
                .p5(StatisticsUtils.percentile(values, 5))
                .p10(StatisticsUtils.percentile(values, 10))
                .p25(StatisticsUtils.percentile(values, 25))
                .p75(StatisticsUtils.percentile(values, 75))
                .p90(StatisticsUtils.percentile(values, 90))
                .p95(StatisticsUtils.percentile(values, 95))
                .medianPercentage(thresholds.getMedianPercentage())
                .dynamicThreshold(thresholds.getDynamicThreshold())
                .staticThreshold(thresholds.getStaticThreshold())
                .baseline(thresholds.getBaseline())
                .degradationCount(degradationCount)
                .build();
    }

    private CorrelationSummary summarize(List<CorrelationResult> results, int unresolved, int skippedCount) {
        Map<DegradationSeverity, Integer> bySeverity = new EnumMap<>(DegradationSeverity.class);
        for (CorrelationResult result : results) {
            bySeverity.merge(result.getDegradation().getSeverity(), 1, Integer::sum);
        }
        int withAlarms = (int) results.stream().filter(CorrelationResult::hasCorrelation).count();

        return CorrelationSummary.builder()
                .totalDegradations(results.size())
                .affectedEntities((int) results.stream()
                        .map(result -> result.getDegradation().getEntityId())
                        .distinct()
                        .count())
                .totalConsolidatedAlarms(results.stream()
                        .mapToInt(result -> result.getConsolidatedAlarms().size())
                        .sum())
                .degradationsWithAlarms(withAlarms)
                .degradationsWithoutAlarms(results.size() - withAlarms)
                .degradationsBySeverity(Collections.unmodifiableMap(bySeverity))
                .unresolvedAlarmEvents(unresolved)
                .skippedEntities(skippedCount)
                .build();
    }

    private void recordMetrics(CorrelationSummary summary, Duration executionTime) {
        meterRegistry.counter("correlation.runs").increment();
        meterRegistry.timer("correlation.run.duration").record(executionTime);

        summary.getDegradationsBySeverity().forEach((severity, count) ->
                meterRegistry.counter("correlation.degradations.detected",
                        "severity", severity.name()
                ).increment(count));

        meterRegistry.counter("correlation.entities.skipped").increment(summary.getSkippedEntities());
        meterRegistry.counter("correlation.alarms.unresolved").increment(summary.getUnresolvedAlarmEvents());
    }
}
