package com.company.correlation.config;

import com.company.correlation.domain.SeverityCutPoints;
import com.company.correlation.domain.ThresholdConfig;
import com.company.correlation.exception.InvalidConfigurationException;
import com.company.correlation.service.EntityIdentityResolver;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * Validated, immutable snapshot of {@link CorrelationProperties}. Built once
 * at startup and shared by every unit of work.
 */
@Value
@Builder(toBuilder = true)
public class CorrelationSettings {
    Duration minDuration;
    Duration defaultReadingDuration;
    Duration timeBefore;
    Duration timeAfter;
    ThresholdConfig defaultThresholds;
    SeverityCutPoints severityCutPoints;
    @Singular("entityThreshold")
    Map<String, ThresholdConfig> entityThresholds;
    boolean parallel;

    public ThresholdConfig thresholdConfigFor(String entityId) {
        return entityThresholds.getOrDefault(entityId, defaultThresholds);
    }

    public static CorrelationSettings defaults() {
        return from(new CorrelationProperties(), new EntityIdentityResolver());
    }

    public static CorrelationSettings from(CorrelationProperties props, EntityIdentityResolver resolver) {
        requireNonNegative("correlation.min-duration", props.getMinDuration());
        requireNonNegative("correlation.default-reading-duration", props.getDefaultReadingDuration());
        requireNonNegative("correlation.time-before", props.getTimeBefore());
        requireNonNegative("correlation.time-after", props.getTimeAfter());
        requirePercentage("correlation.default-median-percentage", props.getDefaultMedianPercentage());

        CorrelationProperties.CutPoints cut = props.getSeverityCutPoints();
        if (cut == null) {
            throw new InvalidConfigurationException("correlation.severity-cut-points", null, "must be set");
        }
        if (cut.getMinor() < 0) {
            throw new InvalidConfigurationException("correlation.severity-cut-points.minor", cut.getMinor(),
                    "must be >= 0");
        }
        if (!(cut.getCritical() > cut.getMajor() && cut.getMajor() > cut.getMinor())) {
            throw new InvalidConfigurationException("correlation.severity-cut-points",
                    String.format("%s/%s/%s", cut.getCritical(), cut.getMajor(), cut.getMinor()),
                    "must be strictly descending (critical > major > minor)");
        }

        ThresholdConfig defaults = new ThresholdConfig(
                props.getDefaultMedianPercentage(), props.getDefaultStaticThreshold());

        CorrelationSettingsBuilder builder = CorrelationSettings.builder()
                .minDuration(props.getMinDuration())
                .defaultReadingDuration(props.getDefaultReadingDuration())
                .timeBefore(props.getTimeBefore())
                .timeAfter(props.getTimeAfter())
                .defaultThresholds(defaults)
                .severityCutPoints(new SeverityCutPoints(cut.getCritical(), cut.getMajor(), cut.getMinor()))
                .parallel(props.isParallel());

        if (props.getEntities() != null) {
            props.getEntities().forEach((rawId, override) -> {
                String entityId = resolver.normalizeEntityId(rawId);
                double percentage = override.getMedianPercentage() != null
                        ? override.getMedianPercentage()
                        : defaults.getMedianPercentage();
                double staticThreshold = override.getStaticThreshold() != null
                        ? override.getStaticThreshold()
                        : defaults.getStaticThreshold();
                requirePercentage("correlation.entities." + rawId + ".median-percentage", percentage);
                builder.entityThreshold(entityId, new ThresholdConfig(percentage, staticThreshold));
            });
        }

        return builder.build();
    }

    private static void requireNonNegative(String key, Duration value) {
        if (value == null || value.isNegative()) {
            throw new InvalidConfigurationException(key, value, "must be a non-negative duration");
        }
    }

    private static void requirePercentage(String key, double value) {
        if (!(value > 0.0 && value <= 100.0)) {
            throw new InvalidConfigurationException(key, value, "must be in (0, 100]");
        }
    }
}
