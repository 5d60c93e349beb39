package com.fintech.strategyengine.strategy;

/**
 * Raised by a strategy that cannot produce a signal for the given input.
 */
public class StrategyException extends RuntimeException {

    public StrategyException(String message) {
        super(message);
    }

    /** Missing, non-numeric or out-of-range parameter. */
    public static StrategyException invalidParameter(String strategyId, String name, Object value) {
        return new StrategyException(
            "Strategy " + strategyId + ": invalid parameter '" + name + "' = " + value
        );
    }

    /** Fewer closed candles than the strategy needs. */
    public static StrategyException insufficientHistory(String strategyId, long required, int actual) {
        return new StrategyException(
            "Strategy " + strategyId + " needs " + required + " closed candles, got " + actual
        );
    }
}
