package com.fintech.strategyengine.config;

import com.fintech.strategyengine.execution.OrderExecutionGateway;
import com.fintech.strategyengine.execution.PaperOrderExecutionGateway;
import com.fintech.strategyengine.history.EmptyHistoricalDataProvider;
import com.fintech.strategyengine.history.HistoricalDataProvider;
import com.fintech.strategyengine.util.TimeWindowManager;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring configuration for core application beans.
 * Vendor collaborators fall back to offline implementations when none is supplied.
 */
@Configuration
public class ApplicationConfig {

    @Bean
    public TimeWindowManager timeWindowManager(EngineProperties properties) {
        long offsetMs = properties.getAggregation().getAlignmentOffset().toMillis();
        return new TimeWindowManager(offsetMs);
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public HistoricalDataProvider historicalDataProvider() {
        return new EmptyHistoricalDataProvider();
    }

    @Bean
    @ConditionalOnMissingBean
    public OrderExecutionGateway orderExecutionGateway() {
        return new PaperOrderExecutionGateway();
    }
}
