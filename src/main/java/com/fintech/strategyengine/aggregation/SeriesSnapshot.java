package com.fintech.strategyengine.aggregation;

import com.fintech.strategyengine.domain.Candle;
import com.fintech.strategyengine.domain.SeriesKey;

import java.util.List;

/**
 * Point-in-time copy of one series, taken under the series lock.
 *
 * @param key Series identity
 * @param closed Closed candles, oldest first
 * @param forming Candle still forming, or null
 * @param active false while the series is waiting for its backfill seed
 * @param pendingTicks Ticks queued until the seed arrives
 */
public record SeriesSnapshot(
    SeriesKey key,
    List<Candle> closed,
    Candle forming,
    boolean active,
    int pendingTicks
) {
}
