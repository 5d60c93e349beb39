package com.fintech.strategyengine.strategy;

import com.fintech.strategyengine.domain.Candle;
import com.fintech.strategyengine.domain.Signal;

import java.util.List;
import java.util.Map;

/**
 * Capability every strategy implements. Strategies are looked up by {@link #id()} in
 * {@link StrategyCatalog} and must be safe to call from several threads at once.
 */
public interface TradingStrategy {

    /**
     * Identifier used in registrations, e.g. "ChannelBreakout".
     */
    String id();

    /**
     * Evaluates the latest closed candle.
     *
     * @param history Closed candles, oldest first; the last entry is the candle that just closed
     * @param parameters Registration parameters
     * @return the signal for the last candle
     * @throws StrategyException if parameters are invalid or the history is too short
     */
    Signal evaluate(List<Candle> history, Map<String, Object> parameters);
}
