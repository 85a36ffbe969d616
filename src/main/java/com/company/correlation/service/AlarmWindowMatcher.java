package com.company.correlation.service;

import com.company.correlation.domain.AlarmEvent;
import com.company.correlation.domain.DegradationPeriod;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@Service
public class AlarmWindowMatcher {

    /**
     * Alarm events on the period's entity whose timestamp lies in
     * [start - timeBefore, end + timeAfter], bounds included. Input order is kept.
     */
    public List<AlarmEvent> match(DegradationPeriod period, List<AlarmEvent> alarms,
                                  Duration timeBefore, Duration timeAfter) {
        Instant windowStart = period.getStart().minus(timeBefore);
        Instant windowEnd = period.getEnd().plus(timeAfter);

        return alarms.stream()
                .filter(alarm -> alarm.getCanonicalEntityId()
                        .map(period.getEntityId()::equals)
                        .orElse(false))
                .filter(alarm -> !alarm.getTimestamp().isBefore(windowStart)
                        && !alarm.getTimestamp().isAfter(windowEnd))
                .collect(Collectors.toList());
    }
}
