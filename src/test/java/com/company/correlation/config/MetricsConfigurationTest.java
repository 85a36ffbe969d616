package com.company.correlation.config;

import com.company.correlation.domain.CorrelationReport;
import com.company.correlation.domain.CorrelationSummary;
import com.company.correlation.event.CorrelationCompletedEvent;
import com.company.correlation.service.CorrelationReportListener;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsConfigurationTest {

    @Test
    void gaugesFollowLastReportedRun() {
        CorrelationReportListener listener = new CorrelationReportListener();
        MeterRegistry registry = new SimpleMeterRegistry();
        new MetricsConfiguration(listener).correlationMetrics().bindTo(registry);

        assertThat(registry.get("correlation.last.degradations").gauge().value()).isZero();

        CorrelationSummary summary = CorrelationSummary.builder()
                .totalDegradations(4)
                .degradationsWithoutAlarms(1)
                .skippedEntities(2)
                .degradationsBySeverity(Map.of())
                .build();
        listener.onCorrelationCompleted(new CorrelationCompletedEvent(
                new CorrelationReport(List.of(), List.of(), List.of(), summary)));

        assertThat(registry.get("correlation.last.degradations").gauge().value()).isEqualTo(4.0);
        assertThat(registry.get("correlation.last.uncorrelated_degradations").gauge().value()).isEqualTo(1.0);
        assertThat(registry.get("correlation.last.skipped_entities").gauge().value()).isEqualTo(2.0);
    }
}
