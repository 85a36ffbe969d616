package com.company.correlation.service;

import com.company.correlation.config.CorrelationSettings;
import com.company.correlation.domain.DegradationPeriod;
import com.company.correlation.domain.EntityThresholds;
import com.company.correlation.domain.KpiSample;
import com.company.correlation.domain.enums.DegradationSeverity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.company.correlation.CorrelationTestData.at;
import static com.company.correlation.CorrelationTestData.hourly;
import static com.company.correlation.CorrelationTestData.referenceThresholds;
import static com.company.correlation.CorrelationTestData.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DegradationSegmenterTest {

    private static final Duration MIN_DURATION = Duration.ofMinutes(5);

    private final DegradationSegmenter segmenter = new DegradationSegmenter(CorrelationSettings.defaults());

    @Test
    void contiguousDegradedReadingsFormOnePeriod() {
        List<KpiSample> samples = hourly("1900", "10:00", 98.5, 87.0, 86.0, 87.5, 96.0);

        List<DegradationPeriod> periods = segmenter.segment(samples, referenceThresholds(), MIN_DURATION);

        assertThat(periods).hasSize(1);
        DegradationPeriod period = periods.get(0);
        assertThat(period.getEntityId()).isEqualTo("1900");
        assertThat(period.getStart()).isEqualTo(at("11:00"));
        assertThat(period.getEnd()).isEqualTo(at("13:00"));
        assertThat(period.getMinValue()).isEqualTo(86.0);
        assertThat(period.getBaseline()).isCloseTo(88.65, within(1e-9));
        assertThat(period.getDeviationPct()).isCloseTo(2.99, within(0.01));
        assertThat(period.getSeverity()).isEqualTo(DegradationSeverity.WARNING);
        assertThat(period.getReadingsCount()).isEqualTo(3);
        assertThat(period.getDuration()).isEqualTo(Duration.ofHours(3));
    }

    @Test
    void healthyReadingSplitsRuns() {
        List<KpiSample> samples = hourly("1900", "10:00", 80.0, 98.0, 80.0, 81.0);

        List<DegradationPeriod> periods = segmenter.segment(samples, referenceThresholds(), MIN_DURATION);

        assertThat(periods).extracting(DegradationPeriod::getStart)
                .containsExactly(at("10:00"), at("12:00"));
    }

    @Test
    void timeGapDoesNotSplitRun() {
        List<KpiSample> samples = new ArrayList<>(hourly("1900", "08:00", 98.0, 98.0, 80.0));
        samples.addAll(hourly("1900", "15:00", 82.0, 98.0));

        List<DegradationPeriod> periods = segmenter.segment(samples, referenceThresholds(), MIN_DURATION);

        assertThat(periods).hasSize(1);
        assertThat(periods.get(0).getStart()).isEqualTo(at("10:00"));
        assertThat(periods.get(0).getEnd()).isEqualTo(at("15:00"));
        // 5h span plus the median sampling interval of 1h
        assertThat(periods.get(0).getDuration()).isEqualTo(Duration.ofHours(6));
    }

    @Test
    void noDegradedReadingsYieldsNoPeriods() {
        List<KpiSample> samples = hourly("1900", "10:00", 98.0, 97.5, 99.0);

        assertThat(segmenter.segment(samples, referenceThresholds(), MIN_DURATION)).isEmpty();
        assertThat(segmenter.segment(List.of(), referenceThresholds(), MIN_DURATION)).isEmpty();
    }

    @Nested
    @DisplayName("Single reading duration")
    class SingleReadingDuration {

        @Test
        @DisplayName("should last until the next reading")
        void lastsUntilNextReading() {
            List<KpiSample> samples = List.of(
                    KpiSample.of("1900", at("10:00"), 98.0),
                    KpiSample.of("1900", at("10:20"), 80.0),
                    KpiSample.of("1900", at("11:00"), 98.0));

            List<DegradationPeriod> periods = segmenter.segment(samples, referenceThresholds(), MIN_DURATION);

            assertThat(periods).hasSize(1);
            assertThat(periods.get(0).getDuration()).isEqualTo(Duration.ofMinutes(40));
            assertThat(periods.get(0).getStart()).isEqualTo(periods.get(0).getEnd());
        }

        @Test
        @DisplayName("should default to one hour for the last reading")
        void defaultsForLastReading() {
            List<KpiSample> samples = hourly("1900", "10:00", 98.0, 98.0, 80.0);

            List<DegradationPeriod> periods = segmenter.segment(samples, referenceThresholds(), MIN_DURATION);

            assertThat(periods).hasSize(1);
            assertThat(periods.get(0).getDuration()).isEqualTo(Duration.ofHours(1));
        }

        @Test
        @DisplayName("should be dropped when shorter than the minimum duration")
        void droppedBelowMinimumDuration() {
            List<KpiSample> samples = series("1900", at("10:00"), Duration.ofMinutes(2), 98.0, 80.0, 98.0);

            assertThat(segmenter.segment(samples, referenceThresholds(), MIN_DURATION)).isEmpty();
            assertThat(segmenter.segment(samples, referenceThresholds(), Duration.ofMinutes(2))).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Severity")
    class Severity {

        private final EntityThresholds flatHundred = EntityThresholds.builder()
                .median(100.0)
                .medianPercentage(100.0)
                .dynamicThreshold(100.0)
                .staticThreshold(100.0)
                .baseline(100.0)
                .build();

        @Test
        @DisplayName("should stay MAJOR at exactly 50% deviation")
        void exactBoundaryFallsToLowerTier() {
            List<DegradationPeriod> periods = segmenter.segment(
                    hourly("1900", "10:00", 100.0, 50.0), flatHundred, MIN_DURATION);

            assertThat(periods.get(0).getDeviationPct()).isEqualTo(50.0);
            assertThat(periods.get(0).getSeverity()).isEqualTo(DegradationSeverity.MAJOR);
        }

        @Test
        @DisplayName("should become CRITICAL just past 50% deviation")
        void pastBoundaryIsCritical() {
            List<DegradationPeriod> periods = segmenter.segment(
                    hourly("1900", "10:00", 100.0, 49.99), flatHundred, MIN_DURATION);

            assertThat(periods.get(0).getSeverity()).isEqualTo(DegradationSeverity.CRITICAL);
        }
    }
}
