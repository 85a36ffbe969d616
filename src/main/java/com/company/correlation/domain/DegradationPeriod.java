package com.company.correlation.domain;

import com.company.correlation.domain.enums.DegradationSeverity;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

@Value
@Builder
public class DegradationPeriod {
    String entityId;
    Instant start;
    Instant end;
    double minValue;
    double baseline;
    double deviationPct;
    Duration duration;
    DegradationSeverity severity;
    int readingsCount;
}
