package com.company.correlation.service;

import com.company.correlation.config.CorrelationSettings;
import com.company.correlation.domain.AlarmEvent;
import com.company.correlation.domain.ConsolidatedAlarm;
import com.company.correlation.domain.CorrelationResult;
import com.company.correlation.domain.DegradationPeriod;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Service
@RequiredArgsConstructor
public class CorrelationAssembler {

    private final AlarmWindowMatcher windowMatcher;
    private final AlarmConsolidator consolidator;
    private final CorrelationSettings settings;

    /**
     * One result per period, in period order. A period with nothing in its
     * window still gets a result, with an empty alarm list.
     *
     * @param canonicalizedAlarms alarms already passed through the identity resolver
     */
    public List<CorrelationResult> assemble(List<DegradationPeriod> periods, List<AlarmEvent> canonicalizedAlarms,
                                            Duration timeBefore, Duration timeAfter) {
        Map<String, List<AlarmEvent>> alarmsByEntity = canonicalizedAlarms.stream()
                .filter(alarm -> alarm.getCanonicalEntityId().isPresent())
                .collect(Collectors.groupingBy(alarm -> alarm.getCanonicalEntityId().get()));

        Stream<DegradationPeriod> stream = settings.isParallel() ? periods.parallelStream() : periods.stream();

        return stream
                .map(period -> {
                    List<AlarmEvent> candidates = alarmsByEntity.getOrDefault(period.getEntityId(), List.of());
                    List<AlarmEvent> matched = windowMatcher.match(period, candidates, timeBefore, timeAfter);
                    List<ConsolidatedAlarm> consolidated = consolidator.consolidate(period, matched);
                    return new CorrelationResult(period, consolidated);
                })
                .collect(Collectors.toList());
    }
}
