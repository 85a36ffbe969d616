package com.company.correlation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "correlation")
public class CorrelationProperties {

    /** Degradations shorter than this are dropped. */
    private Duration minDuration = Duration.ofMinutes(5);

    /** Duration credited to a lone degraded reading that is also the entity's last reading. */
    private Duration defaultReadingDuration = Duration.ofHours(1);

    private double defaultMedianPercentage = 90.0;

    private double defaultStaticThreshold = 95.0;

    private Duration timeBefore = Duration.ofMinutes(30);

    private Duration timeAfter = Duration.ofMinutes(30);

    private boolean parallel = false;

    private CutPoints severityCutPoints = new CutPoints();

    /** Keyed by entity id; MRBTS/BSC prefixed keys are normalized to the numeric id. */
    private Map<String, EntityOverride> entities = new LinkedHashMap<>();

    @Data
    public static class CutPoints {
        private double critical = 50.0;
        private double major = 25.0;
        private double minor = 10.0;
    }

    @Data
    public static class EntityOverride {
        private Double medianPercentage;
        private Double staticThreshold;
    }
}
