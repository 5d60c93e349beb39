package com.fintech.strategyengine.api;

import com.fintech.strategyengine.domain.StrategyRegistration;

import java.util.Map;

/**
 * A strategy binding as returned by the API.
 */
public record StrategyResponse(
    String instrumentId,
    String timeframe,
    String strategyId,
    Map<String, Object> parameters
) {

    public static StrategyResponse from(StrategyRegistration registration) {
        return new StrategyResponse(
            registration.instrumentId(),
            registration.timeframe().code(),
            registration.strategyId(),
            registration.parameters()
        );
    }
}
