package com.fintech.strategyengine.history;

import com.fintech.strategyengine.domain.Candle;
import com.fintech.strategyengine.domain.Timeframe;

import java.time.Instant;
import java.util.List;

/**
 * Source of historical candles used to seed a series before live ticks apply.
 * Implementations wrap the market data vendor's candle API and may block on network I/O.
 */
public interface HistoricalDataProvider {

    /**
     * Fetches candles for an instrument and timeframe.
     *
     * @param instrumentId Instrument token
     * @param timeframe Candle timeframe
     * @param from Start of range (inclusive)
     * @param to End of range (inclusive)
     * @return candles ordered by bucket start; may include the still-forming bucket
     */
    List<Candle> fetch(String instrumentId, Timeframe timeframe, Instant from, Instant to);
}
