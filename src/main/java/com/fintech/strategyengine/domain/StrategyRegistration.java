package com.fintech.strategyengine.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Binding of a strategy to one (instrument, timeframe) series.
 * Parameters are copied into an unmodifiable map; values may be numbers, strings or booleans.
 */
public record StrategyRegistration(
    SeriesKey key,
    String strategyId,
    Map<String, Object> parameters
) {

    public StrategyRegistration {
        Objects.requireNonNull(key, "Key cannot be null");
        Objects.requireNonNull(strategyId, "Strategy id cannot be null");
        parameters = parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public String instrumentId() {
        return key.instrumentId();
    }

    public Timeframe timeframe() {
        return key.timeframe();
    }
}
