package com.company.correlation.service;

import com.company.correlation.domain.CorrelationReport;
import com.company.correlation.domain.CorrelationResult;
import com.company.correlation.domain.CorrelationSummary;
import com.company.correlation.domain.DegradationPeriod;
import com.company.correlation.domain.SkippedEntity;
import com.company.correlation.event.CorrelationCompletedEvent;
import com.company.correlation.util.TimeUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

@Component
@Slf4j
public class CorrelationReportListener {

    private final AtomicReference<CorrelationSummary> lastSummary =
            new AtomicReference<>(CorrelationSummary.empty());

    @EventListener
    public void onCorrelationCompleted(CorrelationCompletedEvent event) {
        CorrelationReport report = event.getReport();
        CorrelationSummary summary = report.getSummary();
        lastSummary.set(summary);

        log.info("Correlation run completed: {} degradations on {} entities, {} with alarms, {} without, "
                        + "{} unresolved alarm events, {} skipped entities",
                summary.getTotalDegradations(), summary.getAffectedEntities(),
                summary.getDegradationsWithAlarms(), summary.getDegradationsWithoutAlarms(),
                summary.getUnresolvedAlarmEvents(), summary.getSkippedEntities());

        for (SkippedEntity skipped : report.getSkippedEntities()) {
            log.info("Entity {} not analyzed: {} ({})",
                    skipped.getEntityId(), skipped.getReason().getDescription(), skipped.getDetail());
        }

        if (!log.isDebugEnabled()) {
            return;
        }
        for (CorrelationResult result : report.getResults()) {
            DegradationPeriod period = result.getDegradation();
            log.debug("Degradation {} {}..{} ({}) {} [{}] min={} deviation={}%: {}",
                    period.getEntityId(),
                    period.getStart(),
                    period.getEnd(),
                    TimeUtils.formatDuration(period.getDuration()),
                    period.getSeverity(),
                    period.getSeverity().getDescription(),
                    period.getMinValue(),
                    String.format("%.2f", period.getDeviationPct()),
                    result.hasCorrelation()
                            ? result.getConsolidatedAlarms().size() + " correlated alarms"
                            : "no FM correlation found");
        }
    }

    public CorrelationSummary getLastSummary() {
        return lastSummary.get();
    }
}
