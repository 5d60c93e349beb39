package com.fintech.strategyengine.config;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Metrics configuration: common tags and client-side percentiles for engine timers.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> engineMetricsCustomizer() {
        return registry -> {
            registry.config().commonTags(
                "application", "candle-strategy-engine",
                "environment", getEnvironment()
            );

            registry.config().meterFilter(new MeterFilter() {
                @Override
                public DistributionStatisticConfig configure(Meter.Id id, DistributionStatisticConfig config) {
                    if (id.getType() != Meter.Type.TIMER || !id.getName().startsWith("engine.")) {
                        return config;
                    }
                    return DistributionStatisticConfig.builder()
                        .percentiles(0.5, 0.95, 0.99, 0.999)
                        .percentilePrecision(2)
                        // timer SLOs are in nanoseconds; tick path is microseconds, evaluation milliseconds
                        .serviceLevelObjectives(
                            TimeUnit.MICROSECONDS.toNanos(5),
                            TimeUnit.MICROSECONDS.toNanos(10),
                            TimeUnit.MICROSECONDS.toNanos(50),
                            TimeUnit.MICROSECONDS.toNanos(100),
                            TimeUnit.MICROSECONDS.toNanos(500),
                            TimeUnit.MILLISECONDS.toNanos(1),
                            TimeUnit.MILLISECONDS.toNanos(5),
                            TimeUnit.MILLISECONDS.toNanos(10),
                            TimeUnit.MILLISECONDS.toNanos(50)
                        )
                        .percentilesHistogram(true)
                        .expiry(Duration.ofSeconds(60))
                        .bufferLength(3)
                        .build()
                        .merge(config);
                }
            });
        };
    }

    private String getEnvironment() {
        String env = System.getenv("SPRING_PROFILES_ACTIVE");
        return env != null ? env : "local";
    }
}
