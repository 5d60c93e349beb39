package com.fintech.strategyengine.domain;

import java.time.Instant;

/**
 * Market order handed to the execution gateway for an actionable signal.
 *
 * @param instrumentId Instrument token
 * @param side BUY or SELL
 * @param quantity Units to trade
 * @param requestedAt When the signal was turned into an order
 */
public record OrderRequest(
    String instrumentId,
    Signal side,
    long quantity,
    Instant requestedAt
) {

    public OrderRequest {
        if (side == null || !side.isActionable()) {
            throw new IllegalArgumentException("Order side must be BUY or SELL, got " + side);
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive, got " + quantity);
        }
    }
}
