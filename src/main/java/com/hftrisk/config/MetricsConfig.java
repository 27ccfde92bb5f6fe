package com.hftrisk.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Tags every meter with the application name. The customizer runs when the registry is
 * created, before {@link com.hftrisk.observability.RiskMetricsBinder} registers the risk
 * gauges, so those carry the tag too.
 */
@Configuration
public class MetricsConfig {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> applicationTagCustomizer(
            @Value("${spring.application.name:hft-risk-core}") String applicationName) {
        return registry -> registry.config().commonTags("application", applicationName);
    }
}
