package com.fintech.strategyengine.domain;

/**
 * Immutable last-traded-price update for one instrument.
 *
 * @param instrumentId Instrument token (e.g., "3045")
 * @param price Last traded price
 * @param eventTime Exchange timestamp (Unix epoch millis)
 */
public record Tick(
    String instrumentId,
    double price,
    long eventTime
) {

    /** Validates instrument present, price finite and > 0, timestamp > 0. */
    public boolean isValid() {
        return instrumentId != null
            && !instrumentId.isBlank()
            && Double.isFinite(price)
            && price > 0
            && eventTime > 0;
    }
}
