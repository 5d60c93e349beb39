package com.fintech.strategyengine.dispatch;

import com.fintech.strategyengine.aggregation.CandleClosedListener;
import com.fintech.strategyengine.config.EngineProperties;
import com.fintech.strategyengine.domain.CandleClosedEvent;
import com.fintech.strategyengine.domain.SeriesKey;
import com.fintech.strategyengine.domain.Signal;
import com.fintech.strategyengine.domain.StrategyRegistration;
import com.fintech.strategyengine.execution.SignalSink;
import com.fintech.strategyengine.strategy.StrategyCatalog;
import com.fintech.strategyengine.strategy.StrategyException;
import com.fintech.strategyengine.strategy.TradingStrategy;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs the registered strategy whenever a series closes a candle.
 *
 * Each failure (unknown strategy, bad parameters, short history, sink error) is
 * contained to the one event that caused it.
 */
@Component
public class StrategyDispatcher implements CandleClosedListener {

    private static final Logger log = LoggerFactory.getLogger(StrategyDispatcher.class);

    private final StrategyRegistry registry;
    private final StrategyCatalog catalog;
    private final SignalSink signalSink;
    private final MeterRegistry meterRegistry;
    private final Timer evaluationTimer;
    private final int minHistory;

    private final AtomicLong dispatches = new AtomicLong(0);
    private final AtomicLong orphanEvents = new AtomicLong(0);
    private final AtomicLong skippedShortHistory = new AtomicLong(0);
    private final AtomicLong strategyFailures = new AtomicLong(0);
    private final AtomicLong sinkFailures = new AtomicLong(0);

    public StrategyDispatcher(
            StrategyRegistry registry,
            StrategyCatalog catalog,
            SignalSink signalSink,
            MeterRegistry meterRegistry,
            EngineProperties properties) {
        this.registry = registry;
        this.catalog = catalog;
        this.signalSink = signalSink;
        this.meterRegistry = meterRegistry;
        this.minHistory = properties.getDispatch().getMinHistory();
        this.evaluationTimer = meterRegistry.timer("engine.dispatch.evaluation.time");

        meterRegistry.gauge("engine.dispatch.invocations", dispatches);
        meterRegistry.gauge("engine.dispatch.orphan.events", orphanEvents);
        meterRegistry.gauge("engine.dispatch.skipped.short.history", skippedShortHistory);
        meterRegistry.gauge("engine.dispatch.strategy.failures", strategyFailures);
        meterRegistry.gauge("engine.dispatch.sink.failures", sinkFailures);
    }

    @Override
    public void onCandleClosed(CandleClosedEvent event) {
        SeriesKey key = event.key();

        Optional<StrategyRegistration> found = registry.find(key);
        if (found.isEmpty()) {
            // Series outlived its registration
            orphanEvents.incrementAndGet();
            log.debug("No strategy registered for {}, skipping dispatch", key);
            return;
        }
        StrategyRegistration registration = found.get();

        if (event.history().size() < minHistory) {
            skippedShortHistory.incrementAndGet();
            log.debug("Skipping {} on {}: {} closed candles, need {}",
                     registration.strategyId(), key, event.history().size(), minHistory);
            return;
        }

        Signal signal = evaluate(registration, event);
        if (signal == null) {
            return;
        }

        meterRegistry.counter("engine.dispatch.signals", "signal", signal.code()).increment();
        log.info("Strategy {} on {} -> {} (closed={}, history={})",
                 registration.strategyId(), key, signal.code(),
                 event.closedCandle(), event.history().size());

        if (signal.isActionable()) {
            try {
                signalSink.emit(key.instrumentId(), signal);
            } catch (RuntimeException e) {
                sinkFailures.incrementAndGet();
                log.error("Signal sink failed for {} {}", key, signal, e);
            }
        }
    }

    private Signal evaluate(StrategyRegistration registration, CandleClosedEvent event) {
        SeriesKey key = event.key();
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            TradingStrategy strategy = catalog.resolve(registration.strategyId());
            dispatches.incrementAndGet();
            Signal signal = strategy.evaluate(event.history(), registration.parameters());
            if (signal == null) {
                throw new StrategyException("Strategy " + registration.strategyId() + " returned no signal");
            }
            return signal;

        } catch (StrategyCatalog.UnknownStrategyException e) {
            strategyFailures.incrementAndGet();
            log.error("Dispatch failed for {}: {}", key, e.getMessage());
            return null;

        } catch (StrategyException e) {
            strategyFailures.incrementAndGet();
            log.warn("Strategy {} failed on {}: {}", registration.strategyId(), key, e.getMessage());
            return null;

        } catch (RuntimeException e) {
            strategyFailures.incrementAndGet();
            log.error("Strategy {} threw on {}", registration.strategyId(), key, e);
            return null;

        } finally {
            sample.stop(evaluationTimer);
        }
    }

    public long getDispatches() {
        return dispatches.get();
    }

    public long getOrphanEvents() {
        return orphanEvents.get();
    }

    public long getSkippedShortHistory() {
        return skippedShortHistory.get();
    }

    public long getStrategyFailures() {
        return strategyFailures.get();
    }

    public long getSinkFailures() {
        return sinkFailures.get();
    }
}
