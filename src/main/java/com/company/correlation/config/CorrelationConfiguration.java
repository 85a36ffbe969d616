package com.company.correlation.config;

import com.company.correlation.service.EntityIdentityResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
@EnableConfigurationProperties(CorrelationProperties.class)
public class CorrelationConfiguration {

    /**
     * Fails context startup on invalid thresholds or durations, before any
     * entity is processed.
     */
    @Bean
    public CorrelationSettings correlationSettings(CorrelationProperties properties,
                                                   EntityIdentityResolver identityResolver) {
        CorrelationSettings settings = CorrelationSettings.from(properties, identityResolver);

        log.info("Correlation settings: median%={} static={} minDuration={} window=-{}/+{} overrides={}",
                settings.getDefaultThresholds().getMedianPercentage(),
                settings.getDefaultThresholds().getStaticThreshold(),
                settings.getMinDuration(),
                settings.getTimeBefore(),
                settings.getTimeAfter(),
                settings.getEntityThresholds().size());

        return settings;
    }
}
