package com.company.correlation.config;

import com.company.correlation.service.CorrelationReportListener;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Gauges over the most recent correlation run
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final CorrelationReportListener reportListener;

    @Bean
    public MeterBinder correlationMetrics() {
        return (reg) -> {
            Gauge.builder("correlation.last.degradations", reportListener,
                            listener -> listener.getLastSummary().getTotalDegradations())
                    .description("Degradation periods found by the last correlation run")
                    .register(reg);

            Gauge.builder("correlation.last.uncorrelated_degradations", reportListener,
                            listener -> listener.getLastSummary().getDegradationsWithoutAlarms())
                    .description("Degradations of the last run with no alarm in their window")
                    .register(reg);

            Gauge.builder("correlation.last.skipped_entities", reportListener,
                            listener -> listener.getLastSummary().getSkippedEntities())
                    .description("Entities skipped by the last run")
                    .register(reg);

            log.info("Correlation metrics registered");
        };
    }
}
