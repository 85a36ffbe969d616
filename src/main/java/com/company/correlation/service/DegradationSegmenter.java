package com.company.correlation.service;

import com.company.correlation.config.CorrelationSettings;
import com.company.correlation.domain.DegradationPeriod;
import com.company.correlation.domain.EntityThresholds;
import com.company.correlation.domain.KpiSample;
import com.company.correlation.domain.enums.DegradationSeverity;
import com.company.correlation.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Groups maximal runs of degraded samples into degradation periods.
 * Runs are positional in the sorted sequence: only a non-degraded sample
 * or the end of the data closes a run, however large the time gap.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DegradationSegmenter {

    private final CorrelationSettings settings;

    /**
     * @param samples one entity's samples, ascending by timestamp
     */
    public List<DegradationPeriod> segment(List<KpiSample> samples, EntityThresholds thresholds,
                                           Duration minDuration) {
        List<DegradationPeriod> periods = new ArrayList<>();
        if (samples.isEmpty()) {
            return periods;
        }

        List<Instant> timestamps = samples.stream()
                .map(KpiSample::getTimestamp)
                .collect(Collectors.toList());
        Optional<Duration> medianInterval = TimeUtils.medianInterval(timestamps);

        int i = 0;
        int n = samples.size();
        while (i < n) {
            if (!thresholds.isDegraded(samples.get(i).getValue())) {
                i++;
                continue;
            }
            int runStart = i;
            while (i < n && thresholds.isDegraded(samples.get(i).getValue())) {
                i++;
            }
            List<KpiSample> run = samples.subList(runStart, i);
            Duration duration = runDuration(run, i < n ? samples.get(i) : null, medianInterval);

            if (duration.compareTo(minDuration) < 0) {
                log.debug("Entity {}: dropping {}-reading run at {} ({} < {})",
                        run.get(0).getEntityId(), run.size(), run.get(0).getTimestamp(),
                        duration, minDuration);
                continue;
            }
            periods.add(toPeriod(run, thresholds, duration));
        }

        return periods;
    }

    private Duration runDuration(List<KpiSample> run, KpiSample next, Optional<Duration> medianInterval) {
        if (run.size() == 1) {
            if (next == null) {
                return settings.getDefaultReadingDuration();
            }
            return Duration.between(run.get(0).getTimestamp(), next.getTimestamp());
        }
        Duration span = Duration.between(earliest(run), latest(run));
        return span.plus(medianInterval.orElse(settings.getDefaultReadingDuration()));
    }

    private DegradationPeriod toPeriod(List<KpiSample> run, EntityThresholds thresholds, Duration duration) {
        double minValue = run.stream().mapToDouble(KpiSample::getValue).min().orElseThrow();
        double baseline = thresholds.getBaseline();
        double deviationPct = baseline > 0
                ? Math.max(0.0, (baseline - minValue) / baseline * 100.0)
                : 0.0;

        return DegradationPeriod.builder()
                .entityId(run.get(0).getEntityId())
                .start(earliest(run))
                .end(latest(run))
                .minValue(minValue)
                .baseline(baseline)
                .deviationPct(deviationPct)
                .duration(duration)
                .severity(DegradationSeverity.classify(deviationPct, settings.getSeverityCutPoints()))
                .readingsCount(run.size())
                .build();
    }

    private static Instant earliest(List<KpiSample> run) {
        return run.stream().map(KpiSample::getTimestamp).min(Instant::compareTo).orElseThrow();
    }

    private static Instant latest(List<KpiSample> run) {
        return run.stream().map(KpiSample::getTimestamp).max(Instant::compareTo).orElseThrow();
    }
}
