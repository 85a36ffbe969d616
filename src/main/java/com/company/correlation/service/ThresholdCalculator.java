package com.company.correlation.service;

import com.company.correlation.domain.EntityThresholds;
import com.company.correlation.domain.KpiSample;
import com.company.correlation.domain.ThresholdConfig;
import com.company.correlation.exception.InsufficientDataException;
import com.company.correlation.util.StatisticsUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

@Service
@Slf4j
public class ThresholdCalculator {

    /**
     * Dynamic bar is the entity median scaled by the configured percentage;
     * static bar is taken as configured. The baseline is the lower of the two.
     */
    public EntityThresholds calculate(String entityId, List<KpiSample> samples, ThresholdConfig config) {
        if (samples == null || samples.isEmpty()) {
            throw new InsufficientDataException(entityId);
        }

        List<Double> values = samples.stream()
                .map(KpiSample::getValue)
                .collect(Collectors.toList());

        double median = StatisticsUtils.median(values);
        double dynamic = median * (config.getMedianPercentage() / 100.0);
        double staticThreshold = config.getStaticThreshold();

        EntityThresholds thresholds = EntityThresholds.builder()
                .median(median)
                .medianPercentage(config.getMedianPercentage())
                .dynamicThreshold(dynamic)
                .staticThreshold(staticThreshold)
                .baseline(Math.min(dynamic, staticThreshold))
                .build();

        log.debug("Entity {}: median={} dynamic={} static={} ({} samples)",
                entityId, median, dynamic, staticThreshold, samples.size());

        return thresholds;
    }
}
