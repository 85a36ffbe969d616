package com.company.correlation.domain;

import com.company.correlation.domain.enums.AlarmSeverity;
import lombok.Value;

import java.time.Instant;

@Value
public class StatusEvent {
    Instant timestamp;
    AlarmSeverity severity;
    boolean cleared;

    public static StatusEvent of(AlarmEvent event) {
        return new StatusEvent(event.getTimestamp(), event.getSeverity(), event.getSeverity().isCleared());
    }
}
