package com.company.correlation.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

@Value
@Builder
@AllArgsConstructor(staticName = "of")
public class KpiSample {
    @With
    String entityId;
    Instant timestamp;
    double value;
}
