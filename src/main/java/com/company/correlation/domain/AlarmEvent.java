package com.company.correlation.domain;

import com.company.correlation.domain.enums.AlarmSeverity;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.Optional;

/**
 * A single fault-management event row: raise, severity change or clear.
 * Several events share an alarm id over the lifetime of one alarm.
 */
@Value
@Builder(toBuilder = true)
public class AlarmEvent {
    String alarmId;
    String rawObjectPath;
    @With
    String canonicalEntityId;
    Instant timestamp;
    AlarmSeverity severity;
    String type;
    String problem;
    String cause;

    /**
     * Empty until the identity resolver has run, and empty afterwards for
     * paths carrying no MRBTS/BSC token. Such events never correlate.
     */
    public Optional<String> getCanonicalEntityId() {
        return Optional.ofNullable(canonicalEntityId);
    }
}
