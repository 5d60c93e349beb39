package com.fintech.strategyengine.domain;

/**
 * Immutable OHLC candle for one bucket of a series.
 * Compact constructor enforces the OHLC invariants.
 *
 * @param bucketStart Bucket start timestamp (grid-aligned epoch millis)
 * @param open First price in bucket
 * @param high Maximum price (must be >= open, close, low)
 * @param low Minimum price (must be <= open, close, high)
 * @param close Last price in bucket
 */
public record Candle(
    long bucketStart,
    double open,
    double high,
    double low,
    double close
) {

    /**
     * Creates a single-price candle (first tick in bucket).
     *
     * @param bucketStart Bucket start timestamp
     * @param price Initial OHLC value
     * @return Candle with all OHLC = price
     */
    public static Candle of(long bucketStart, double price) {
        return new Candle(bucketStart, price, price, price, price);
    }

    public Candle {
        if (high < low) {
            throw new IllegalArgumentException(
                "High price (" + high + ") cannot be less than low price (" + low + ")"
            );
        }
        if (high < open || high < close) {
            throw new IllegalArgumentException(
                "High price (" + high + ") must be >= open (" + open + ") and close (" + close + ")"
            );
        }
        if (low > open || low > close) {
            throw new IllegalArgumentException(
                "Low price (" + low + ") must be <= open (" + open + ") and close (" + close + ")"
            );
        }
    }
}
