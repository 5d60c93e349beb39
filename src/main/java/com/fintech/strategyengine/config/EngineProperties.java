package com.fintech.strategyengine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * Externalized configuration for the strategy engine.
 * Maps to 'engine.*' properties in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "engine")
public class EngineProperties {

    private Aggregation aggregation = new Aggregation();
    private DisruptorConfig disruptor = new DisruptorConfig();
    private Registry registry = new Registry();
    private Dispatch dispatch = new Dispatch();
    private Backfill backfill = new Backfill();
    private Execution execution = new Execution();
    private Simulation simulation = new Simulation();

    @Data
    public static class Aggregation {
        // Exchange-local offset applied before bucketing (IST is PT5H30M)
        private Duration alignmentOffset = Duration.ZERO;
        private int maxHistory = 5000;
        private int maxPendingTicks = 10_000;
    }

    @Data
    public static class DisruptorConfig {
        private int bufferSize = 8192;
        private String waitStrategy = "BLOCKING";
        private int numConsumers = 2;
    }

    @Data
    public static class Registry {
        private boolean discardHistoryOnRemove = true;
    }

    @Data
    public static class Dispatch {
        private int minHistory = 0;
    }

    @Data
    public static class Backfill {
        private boolean enabled = true;
        private Duration lookback = Duration.ofDays(2);
    }

    @Data
    public static class Execution {
        private long quantity = 1;
        private int workerThreads = 2;
        private int queueCapacity = 1000;
    }

    @Data
    public static class Simulation {
        private boolean enabled = false;
        private List<String> instruments = List.of("3045", "2885", "1594");
        private long updateFrequencyMs = 250L;
    }
}
