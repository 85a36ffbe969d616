package com.company.correlation.event;

import com.company.correlation.domain.CorrelationReport;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class CorrelationCompletedEvent {
    private final CorrelationReport report;
}
