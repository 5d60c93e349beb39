package com.fintech.strategyengine.aggregation;

import com.fintech.strategyengine.domain.CandleClosedEvent;

/**
 * Receives rollover events from {@link AggregationEngine}.
 * Called on the ingesting thread while the series lock is held, so implementations
 * must not block on I/O and must not throw.
 */
@FunctionalInterface
public interface CandleClosedListener {

    void onCandleClosed(CandleClosedEvent event);
}
