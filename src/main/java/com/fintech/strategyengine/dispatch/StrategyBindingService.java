package com.fintech.strategyengine.dispatch;

import com.fintech.strategyengine.aggregation.AggregationEngine;
import com.fintech.strategyengine.config.EngineProperties;
import com.fintech.strategyengine.domain.Candle;
import com.fintech.strategyengine.domain.SeriesKey;
import com.fintech.strategyengine.domain.StrategyRegistration;
import com.fintech.strategyengine.domain.Timeframe;
import com.fintech.strategyengine.history.HistoryBackfillService;
import com.fintech.strategyengine.strategy.StrategyCatalog;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Control plane for strategy bindings: add, remove and remove-all.
 *
 * Responsibilities:
 * - Validating registrations (configuration errors surface synchronously)
 * - Seeding a new series from history before it accepts live ticks
 * - Keeping the registration table and the aggregation engine in step
 *
 * Operations on the same key are serialized; different keys proceed independently.
 * Remove-all excludes every add and remove while it runs.
 */
@Service
public class StrategyBindingService {

    private static final Logger log = LoggerFactory.getLogger(StrategyBindingService.class);

    private final StrategyRegistry registry;
    private final AggregationEngine engine;
    private final HistoryBackfillService backfillService;
    private final StrategyCatalog catalog;
    private final boolean discardHistoryOnRemove;

    // read side: per-key operations, write side: remove-all
    private final ReentrantReadWriteLock controlLock = new ReentrantReadWriteLock();
    private final Map<SeriesKey, ReentrantLock> keyLocks = new ConcurrentHashMap<>();
    private final AtomicLong validationErrors = new AtomicLong(0);

    public StrategyBindingService(
            StrategyRegistry registry,
            AggregationEngine engine,
            HistoryBackfillService backfillService,
            StrategyCatalog catalog,
            MeterRegistry meterRegistry,
            EngineProperties properties) {
        this.registry = registry;
        this.engine = engine;
        this.backfillService = backfillService;
        this.catalog = catalog;
        this.discardHistoryOnRemove = properties.getRegistry().isDiscardHistoryOnRemove();

        meterRegistry.gauge("engine.registry.validation.errors", validationErrors);
        meterRegistry.gauge("engine.registry.registrations", registry, StrategyRegistry::size);
    }

    /**
     * Adds or replaces a strategy binding, parsing the timeframe code first.
     *
     * @throws RegistrationException if any argument is malformed or the timeframe unsupported
     */
    public StrategyRegistration add(String instrumentId, String timeframeCode,
                                    String strategyId, Map<String, Object> parameters) {
        Timeframe timeframe;
        try {
            timeframe = Timeframe.fromCode(timeframeCode);
        } catch (IllegalArgumentException e) {
            validationErrors.incrementAndGet();
            throw new RegistrationException(e.getMessage());
        }
        return add(instrumentId, timeframe, strategyId, parameters);
    }

    /**
     * Adds or replaces a strategy binding.
     * A key without a series is backfilled first; ticks arriving during the backfill are
     * queued and replayed once the seed is installed. A key that already has a series keeps
     * its history and only has its registration replaced.
     *
     * @throws RegistrationException if any argument is malformed
     */
    public StrategyRegistration add(String instrumentId, Timeframe timeframe,
                                    String strategyId, Map<String, Object> parameters) {
        validate(instrumentId, timeframe, strategyId, parameters);

        SeriesKey key = SeriesKey.of(instrumentId.trim(), timeframe);
        StrategyRegistration registration = new StrategyRegistration(key, strategyId.trim(), parameters);
        if (!catalog.contains(registration.strategyId())) {
            log.warn("Strategy '{}' is not in the catalog; dispatches for {} will fail until it is",
                     registration.strategyId(), key);
        }

        ReentrantLock lock = lockFor(key);
        controlLock.readLock().lock();
        lock.lock();
        try {
            if (engine.registerForBackfill(key)) {
                List<Candle> history = backfillService.loadHistory(key);
                registry.put(registration);
                engine.seed(key, history);
                log.info("Strategy '{}' added for {} with parameters {} ({} historical candles)",
                         registration.strategyId(), key, registration.parameters(), history.size());
            } else {
                Optional<StrategyRegistration> previous = registry.put(registration);
                log.info("Strategy '{}' {} for {} on existing series",
                         registration.strategyId(), previous.isPresent() ? "replaced" : "added", key);
            }
            return registration;
        } finally {
            lock.unlock();
            controlLock.readLock().unlock();
        }
    }

    /**
     * Stops the strategy for one key. An evaluation already running completes; no new one
     * starts. Discards the series unless history retention is configured.
     *
     * @return true if a registration existed
     */
    public boolean remove(String instrumentId, Timeframe timeframe) {
        SeriesKey key = SeriesKey.of(instrumentId, timeframe);
        ReentrantLock lock = lockFor(key);
        controlLock.readLock().lock();
        lock.lock();
        try {
            Optional<StrategyRegistration> removed = registry.remove(key);
            if (discardHistoryOnRemove) {
                engine.unregister(key);
            }
            if (removed.isPresent()) {
                log.info("Stopped strategy '{}' for {}", removed.get().strategyId(), key);
            } else {
                log.info("No strategy found for {}", key);
            }
            return removed.isPresent();
        } finally {
            lock.unlock();
            controlLock.readLock().unlock();
        }
    }

    /**
     * Stops every strategy. Once this returns no new evaluation can start.
     * Waits for in-flight adds and removes, including their backfill, to finish first.
     *
     * @return number of registrations removed
     */
    public int removeAll() {
        controlLock.writeLock().lock();
        try {
            int removed = registry.clear();
            if (discardHistoryOnRemove) {
                engine.unregisterAll();
            }
            log.info("Stopped all strategies: count={}", removed);
            return removed;
        } finally {
            controlLock.writeLock().unlock();
        }
    }

    public List<StrategyRegistration> list() {
        return registry.list();
    }

    public Optional<StrategyRegistration> find(String instrumentId, Timeframe timeframe) {
        return registry.find(SeriesKey.of(instrumentId, timeframe));
    }

    private ReentrantLock lockFor(SeriesKey key) {
        return keyLocks.computeIfAbsent(key, k -> new ReentrantLock());
    }

    private void validate(String instrumentId, Timeframe timeframe,
                          String strategyId, Map<String, Object> parameters) {
        if (instrumentId == null || instrumentId.isBlank()) {
            validationErrors.incrementAndGet();
            throw new RegistrationException("Instrument id cannot be null or blank");
        }
        if (timeframe == null) {
            validationErrors.incrementAndGet();
            throw new RegistrationException("Timeframe cannot be null. Must be one of: " + Timeframe.supportedCodes());
        }
        if (strategyId == null || strategyId.isBlank()) {
            validationErrors.incrementAndGet();
            throw new RegistrationException("Strategy id cannot be null or blank");
        }
        if (parameters != null) {
            for (String name : parameters.keySet()) {
                if (name == null || name.isBlank()) {
                    validationErrors.incrementAndGet();
                    throw new RegistrationException("Parameter names cannot be null or blank");
                }
            }
        }
    }

    public long getValidationErrors() {
        return validationErrors.get();
    }

    /**
     * Malformed registration request.
     */
    public static class RegistrationException extends RuntimeException {
        public RegistrationException(String message) {
            super(message);
        }
    }
}
