package com.fintech.strategyengine.domain;

import java.util.Objects;

/**
 * Identifies one candle series and its strategy binding: an (instrument, timeframe) pair.
 * Ordered by instrument, then timeframe.
 */
public record SeriesKey(
    String instrumentId,
    Timeframe timeframe
) implements Comparable<SeriesKey> {

    public SeriesKey {
        Objects.requireNonNull(instrumentId, "Instrument cannot be null");
        Objects.requireNonNull(timeframe, "Timeframe cannot be null");
    }

    public static SeriesKey of(String instrumentId, Timeframe timeframe) {
        return new SeriesKey(instrumentId, timeframe);
    }

    @Override
    public int compareTo(SeriesKey other) {
        int instrumentCompare = this.instrumentId.compareTo(other.instrumentId);
        if (instrumentCompare != 0) {
            return instrumentCompare;
        }
        return this.timeframe.compareTo(other.timeframe);
    }

    /** Format: "INSTRUMENT-CODE", e.g. "3045-1m". */
    @Override
    public String toString() {
        return instrumentId + "-" + timeframe.code();
    }
}
