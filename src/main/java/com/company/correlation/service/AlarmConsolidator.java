package com.company.correlation.service;

import com.company.correlation.domain.AlarmEvent;
import com.company.correlation.domain.ConsolidatedAlarm;
import com.company.correlation.domain.DegradationPeriod;
import com.company.correlation.domain.StatusEvent;
import com.company.correlation.domain.enums.TemporalRelation;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Collapses raise / severity-change / clear rows into one lifecycle record
 * per alarm id, so repeated status updates are not counted as separate alarms.
 */
@Service
public class AlarmConsolidator {

    private static final Comparator<ConsolidatedAlarm> OUTPUT_ORDER =
            Comparator.comparing(ConsolidatedAlarm::getEarliestTimestamp)
                    .thenComparing(ConsolidatedAlarm::getAlarmId);

    public List<ConsolidatedAlarm> consolidate(DegradationPeriod period, List<AlarmEvent> matchedAlarms) {
        Map<String, List<AlarmEvent>> byAlarmId = matchedAlarms.stream()
                .collect(Collectors.groupingBy(AlarmEvent::getAlarmId, LinkedHashMap::new, Collectors.toList()));

        List<ConsolidatedAlarm> consolidated = new ArrayList<>(byAlarmId.size());
        byAlarmId.forEach((alarmId, events) -> consolidated.add(toLifecycle(period, alarmId, events)));
        consolidated.sort(OUTPUT_ORDER);
        return List.copyOf(consolidated);
    }

    private ConsolidatedAlarm toLifecycle(DegradationPeriod period, String alarmId, List<AlarmEvent> events) {
        // List.sort is stable: equal timestamps keep their input order
        List<AlarmEvent> ordered = new ArrayList<>(events);
        ordered.sort(Comparator.comparing(AlarmEvent::getTimestamp));

        List<StatusEvent> timeline = ordered.stream()
                .map(StatusEvent::of)
                .collect(Collectors.toUnmodifiableList());

        AlarmEvent first = ordered.get(0);
        StatusEvent last = timeline.get(timeline.size() - 1);

        return ConsolidatedAlarm.builder()
                .alarmId(alarmId)
                .entityId(period.getEntityId())
                .statusTimeline(timeline)
                .earliestTimestamp(first.getTimestamp())
                .temporalRelation(TemporalRelation.of(first.getTimestamp(), period.getStart(), period.getEnd()))
                .timeOffset(Duration.between(period.getStart(), first.getTimestamp()))
                .type(first.getType())
                .problem(first.getProblem())
                .cause(first.getCause())
                .latestSeverity(last.getSeverity())
                .clearedAtEnd(last.isCleared())
                .build();
    }
}
