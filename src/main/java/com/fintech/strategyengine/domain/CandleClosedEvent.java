package com.fintech.strategyengine.domain;

import java.util.List;

/**
 * Emitted when a tick opens a new candle on a series: either the forming candle rolled
 * over, or the series had no candle yet.
 *
 * @param key Series the tick belongs to
 * @param closedCandle The candle that just closed, or {@code null} when the tick opened the
 *                     first candle of a series with no closed history
 * @param history Closed candles in bucket order, ending with {@code closedCandle} when there is
 *                one; possibly empty, never includes the candle that is still forming
 */
public record CandleClosedEvent(
    SeriesKey key,
    Candle closedCandle,
    List<Candle> history
) {

    public CandleClosedEvent {
        // no-op for lists that are already immutable copies
        history = List.copyOf(history);
    }
}
