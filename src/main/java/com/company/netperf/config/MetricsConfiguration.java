package com.company.netperf.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application-specific metrics
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final NetworkPerfProperties properties;

    @Bean
    public MeterBinder networkPathMetrics(MeterRegistry registry) {
        return (reg) -> {
            Gauge.builder("netperf.paths.configured", properties, p -> p.getPaths().size())
                    .description("Number of network paths measured per collection cycle")
                    .register(reg);

            log.info("Network path metrics registered");
        };
    }
}
