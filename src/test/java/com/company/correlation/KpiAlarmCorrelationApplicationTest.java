package com.company.correlation;

import com.company.correlation.domain.AlarmEvent;
import com.company.correlation.domain.CorrelationReport;
import com.company.correlation.domain.enums.AlarmSeverity;
import com.company.correlation.service.CorrelationPipelineService;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static com.company.correlation.CorrelationTestData.alarm;
import static com.company.correlation.CorrelationTestData.hourly;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "correlation.time-before=45m")
class KpiAlarmCorrelationApplicationTest {

    @Autowired
    private CorrelationPipelineService pipelineService;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    void runsPipelineThroughApplicationContext() {
        List<AlarmEvent> alarms = List.of(
                alarm("A1", "PLMN-PLMN/MRBTS-1900/EQM_R-4", "10:20", AlarmSeverity.CRITICAL));

        CorrelationReport report = pipelineService.run(
                hourly("MRBTS-1900", "10:00", 99.0, 98.5, 80.0, 79.0, 98.0), alarms);

        assertThat(report.getResults()).hasSize(1);
        // 12:00 start with 45 minutes before reaches 11:15 only
        assertThat(report.getResults().get(0).getConsolidatedAlarms()).isEmpty();
        assertThat(meterRegistry.get("correlation.last.degradations").gauge().value()).isEqualTo(1.0);
        assertThat(meterRegistry.get("correlation.last.uncorrelated_degradations").gauge().value())
                .isEqualTo(1.0);
    }
}
