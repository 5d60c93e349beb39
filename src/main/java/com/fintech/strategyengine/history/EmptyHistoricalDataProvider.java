package com.fintech.strategyengine.history;

import com.fintech.strategyengine.domain.Candle;
import com.fintech.strategyengine.domain.Timeframe;

import java.time.Instant;
import java.util.List;

/**
 * Provider used when no vendor integration is configured. Series start empty.
 */
public class EmptyHistoricalDataProvider implements HistoricalDataProvider {

    @Override
    public List<Candle> fetch(String instrumentId, Timeframe timeframe, Instant from, Instant to) {
        return List.of();
    }
}
