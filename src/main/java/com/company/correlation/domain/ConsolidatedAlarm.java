package com.company.correlation.domain;

import com.company.correlation.domain.enums.AlarmSeverity;
import com.company.correlation.domain.enums.TemporalRelation;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * One alarm's lifecycle inside a single degradation's window. The same
 * alarm id may appear under several degradations, each with its own
 * window-filtered timeline.
 */
@Value
@Builder
public class ConsolidatedAlarm {
    String alarmId;
    String entityId;
    List<StatusEvent> statusTimeline;
    Instant earliestTimestamp;
    TemporalRelation temporalRelation;
    /** Signed: negative when the alarm started before the degradation. */
    Duration timeOffset;
    String type;
    String problem;
    String cause;
    AlarmSeverity latestSeverity;
    boolean clearedAtEnd;

    public int getEventCount() {
        return statusTimeline.size();
    }
}
