package com.fintech.strategyengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Candle Strategy Engine
 *
 * Builds OHLC candles from live ticks at several timeframes per instrument and runs the
 * strategy bound to each (instrument, timeframe) whenever a candle closes.
 *
 * Key Features:
 * - LMAX Disruptor tick channel, sharded by instrument
 * - Per-series locking, no global lock on the tick path
 * - One-time history backfill per series before live ticks apply
 * - Explicit strategy catalog, failures isolated per series
 * - Micrometer metrics and Resilience4j circuit breakers on external calls
 *
 * @since 1.0.0
 */
@SpringBootApplication
@EnableScheduling
public class StrategyEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(StrategyEngineApplication.class, args);
    }
}
