package com.fintech.strategyengine.history;

import com.fintech.strategyengine.config.EngineProperties;
import com.fintech.strategyengine.domain.Candle;
import com.fintech.strategyengine.domain.SeriesKey;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Loads the one-time history seed for a new series.
 *
 * Never fails: a provider error, a null result or an open circuit breaker yields an empty
 * list, so registration proceeds with an empty series.
 */
@Service
public class HistoryBackfillService {

    private static final Logger log = LoggerFactory.getLogger(HistoryBackfillService.class);

    private final HistoricalDataProvider provider;
    private final CircuitBreaker circuitBreaker;
    private final Clock clock;
    private final boolean enabled;
    private final Duration lookback;

    private final AtomicLong backfillsCompleted = new AtomicLong(0);
    private final AtomicLong backfillFailures = new AtomicLong(0);

    public HistoryBackfillService(
            HistoricalDataProvider provider,
            CircuitBreakerRegistry circuitBreakerRegistry,
            MeterRegistry meterRegistry,
            EngineProperties properties,
            Clock clock) {
        this.provider = provider;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker("historicalData");
        this.clock = clock;
        this.enabled = properties.getBackfill().isEnabled();
        this.lookback = properties.getBackfill().getLookback();

        meterRegistry.gauge("engine.backfill.completed", backfillsCompleted);
        meterRegistry.gauge("engine.backfill.failures", backfillFailures);
    }

    /**
     * Fetches candles for {@code [now - lookback, now]}.
     *
     * @return candles ordered by bucket start, empty on any failure
     */
    public List<Candle> loadHistory(SeriesKey key) {
        if (!enabled) {
            return List.of();
        }

        Instant to = clock.instant();
        Instant from = to.minus(lookback);
        try {
            List<Candle> candles = circuitBreaker.executeSupplier(
                () -> provider.fetch(key.instrumentId(), key.timeframe(), from, to)
            );
            if (candles == null) {
                log.warn("Historical provider returned null for {}", key);
                backfillFailures.incrementAndGet();
                return List.of();
            }
            backfillsCompleted.incrementAndGet();
            log.info("Backfilled {} candles for {} ({} .. {})", candles.size(), key, from, to);
            return candles;

        } catch (CallNotPermittedException e) {
            backfillFailures.incrementAndGet();
            log.warn("Circuit breaker OPEN - starting {} with empty history", key);
            return List.of();

        } catch (Exception e) {
            backfillFailures.incrementAndGet();
            log.warn("Backfill failed for {}, starting with empty history: {}", key, e.getMessage(), e);
            return List.of();
        }
    }

    public long getBackfillsCompleted() {
        return backfillsCompleted.get();
    }

    public long getBackfillFailures() {
        return backfillFailures.get();
    }
}
