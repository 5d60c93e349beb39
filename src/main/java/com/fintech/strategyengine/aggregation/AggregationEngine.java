package com.fintech.strategyengine.aggregation;

import com.fintech.strategyengine.config.EngineProperties;
import com.fintech.strategyengine.domain.Candle;
import com.fintech.strategyengine.domain.CandleClosedEvent;
import com.fintech.strategyengine.domain.SeriesKey;
import com.fintech.strategyengine.domain.Tick;
import com.fintech.strategyengine.domain.Timeframe;
import com.fintech.strategyengine.util.TimeWindowManager;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Multi-timeframe OHLC aggregator that owns every candle series.
 * Each tick fans out to all series registered for its instrument. Every series has its own
 * lock, so different (instrument, timeframe) keys never contend with each other.
 */
@Component
public class AggregationEngine {

    private static final Logger log = LoggerFactory.getLogger(AggregationEngine.class);

    private final TimeWindowManager timeWindowManager;
    private final CandleClosedListener listener;
    private final MeterRegistry meterRegistry;
    private final Timer processingTimer;
    private final int maxHistory;
    private final int maxPendingTicks;

    // instrument -> timeframe -> series
    private final Map<String, Map<Timeframe, SeriesSlot>> seriesByInstrument = new ConcurrentHashMap<>();

    private final AtomicLong ticksIngested = new AtomicLong(0);
    private final AtomicLong invalidTicks = new AtomicLong(0);
    private final AtomicLong unroutedTicks = new AtomicLong(0);
    private final AtomicLong lateTicksDropped = new AtomicLong(0);
    private final AtomicLong candlesClosed = new AtomicLong(0);
    private final AtomicLong pendingTicksQueued = new AtomicLong(0);
    private final AtomicLong pendingTicksDropped = new AtomicLong(0);
    private final AtomicLong listenerFailures = new AtomicLong(0);

    public AggregationEngine(
            TimeWindowManager timeWindowManager,
            CandleClosedListener listener,
            MeterRegistry meterRegistry,
            EngineProperties properties) {
        this.timeWindowManager = timeWindowManager;
        this.listener = listener;
        this.meterRegistry = meterRegistry;
        this.maxHistory = properties.getAggregation().getMaxHistory();
        this.maxPendingTicks = properties.getAggregation().getMaxPendingTicks();
        this.processingTimer = meterRegistry.timer("engine.aggregation.tick.processing.time");

        meterRegistry.gauge("engine.aggregation.ticks.ingested", ticksIngested);
        meterRegistry.gauge("engine.aggregation.ticks.invalid", invalidTicks);
        meterRegistry.gauge("engine.aggregation.ticks.unrouted", unroutedTicks);
        meterRegistry.gauge("engine.aggregation.ticks.late.dropped", lateTicksDropped);
        meterRegistry.gauge("engine.aggregation.candles.closed", candlesClosed);
        meterRegistry.gauge("engine.aggregation.pending.queued", pendingTicksQueued);
        meterRegistry.gauge("engine.aggregation.pending.dropped", pendingTicksDropped);
        meterRegistry.gauge("engine.aggregation.listener.failures", listenerFailures);
    }

    /**
     * Ensures an active series exists for the key. Idempotent.
     *
     * @return true if the series was created by this call
     */
    public boolean register(String instrumentId, Timeframe timeframe) {
        return register(SeriesKey.of(instrumentId, timeframe));
    }

    public boolean register(SeriesKey key) {
        return createSlot(key, true);
    }

    /**
     * Creates a series that queues its ticks until {@link #seed} installs the backfill.
     *
     * @return true if the series was created by this call, false if one already existed
     */
    public boolean registerForBackfill(SeriesKey key) {
        return createSlot(key, false);
    }

    private boolean createSlot(SeriesKey key, boolean active) {
        AtomicBoolean created = new AtomicBoolean(false);
        seriesByInstrument.compute(key.instrumentId(), (instrumentId, slots) -> {
            Map<Timeframe, SeriesSlot> target = slots != null ? slots : new ConcurrentHashMap<>();
            target.computeIfAbsent(key.timeframe(), timeframe -> {
                created.set(true);
                return new SeriesSlot(key, new CandleSeries(maxHistory), active);
            });
            return target;
        });
        if (created.get()) {
            log.info("Registered series: key={}, awaitingSeed={}", key, !active);
        }
        return created.get();
    }

    /**
     * Installs backfilled candles, activates the series and replays ticks queued meanwhile.
     * No-op for a series that is already active. Recreates the series if it was cleared
     * while the backfill was in flight.
     *
     * @return number of queued ticks replayed
     */
    public int seed(SeriesKey key, List<Candle> candles) {
        while (true) {
            SeriesSlot slot = findSlot(key);
            if (slot == null) {
                createSlot(key, false);
                continue;
            }
            slot.lock.lock();
            try {
                if (slot.retired) {
                    continue;
                }
                if (slot.active) {
                    log.debug("Series already active, ignoring seed: key={}", key);
                    return 0;
                }
                int accepted = slot.series.seed(candles);
                slot.active = true;

                int replayed = 0;
                Tick pending;
                while ((pending = slot.pending.pollFirst()) != null) {
                    applyTick(slot, pending);
                    replayed++;
                }
                log.info("Seeded series: key={}, candles={}, replayedTicks={}", key, accepted, replayed);
                return replayed;
            } finally {
                slot.lock.unlock();
            }
        }
    }

    /**
     * Removes the series and its candles. Waits for an in-flight rollover dispatch on the
     * same key to finish.
     *
     * @return true if a series existed
     */
    public boolean unregister(String instrumentId, Timeframe timeframe) {
        return unregister(SeriesKey.of(instrumentId, timeframe));
    }

    public boolean unregister(SeriesKey key) {
        AtomicReference<SeriesSlot> removed = new AtomicReference<>();
        seriesByInstrument.computeIfPresent(key.instrumentId(), (instrumentId, slots) -> {
            removed.set(slots.remove(key.timeframe()));
            return slots.isEmpty() ? null : slots;
        });
        SeriesSlot slot = removed.get();
        if (slot == null) {
            return false;
        }
        retire(slot);
        log.info("Unregistered series: key={}", key);
        return true;
    }

    /**
     * Removes every series.
     *
     * @return number of series removed
     */
    public int unregisterAll() {
        int removed = 0;
        for (String instrumentId : new ArrayList<>(seriesByInstrument.keySet())) {
            Map<Timeframe, SeriesSlot> slots = seriesByInstrument.remove(instrumentId);
            if (slots == null) {
                continue;
            }
            for (SeriesSlot slot : slots.values()) {
                retire(slot);
                removed++;
            }
        }
        log.info("Unregistered all series: count={}", removed);
        return removed;
    }

    private void retire(SeriesSlot slot) {
        slot.lock.lock();
        try {
            slot.retired = true;
            if (!slot.pending.isEmpty()) {
                pendingTicksDropped.addAndGet(slot.pending.size());
                log.warn("Discarded {} queued ticks of removed series {}", slot.pending.size(), slot.key);
                slot.pending.clear();
            }
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Main entry: routes a tick to every series registered for its instrument.
     * Safe to call from any thread.
     */
    public void ingest(Tick tick) {
        if (tick == null || !tick.isValid()) {
            invalidTicks.incrementAndGet();
            log.warn("Invalid tick received, skipping: {}", tick);
            return;
        }

        Map<Timeframe, SeriesSlot> slots = seriesByInstrument.get(tick.instrumentId());
        if (slots == null || slots.isEmpty()) {
            unroutedTicks.incrementAndGet();
            log.trace("No series registered for instrument {}", tick.instrumentId());
            return;
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            for (SeriesSlot slot : slots.values()) {
                processForSeries(slot, tick);
            }
            ticksIngested.incrementAndGet();
        } finally {
            sample.stop(processingTimer);
        }
    }

    private void processForSeries(SeriesSlot slot, Tick tick) {
        slot.lock.lock();
        try {
            if (slot.retired) {
                return;
            }
            if (!slot.active) {
                enqueuePending(slot, tick);
                return;
            }
            applyTick(slot, tick);
        } finally {
            slot.lock.unlock();
        }
    }

    private void enqueuePending(SeriesSlot slot, Tick tick) {
        if (slot.pending.size() >= maxPendingTicks) {
            pendingTicksDropped.incrementAndGet();
            log.warn("Pending queue full for {} while awaiting backfill, dropping tick at {}",
                     slot.key, tick.eventTime());
            return;
        }
        slot.pending.addLast(tick);
        pendingTicksQueued.incrementAndGet();
    }

    /**
     * Applies the update-or-roll-over rule. Caller holds the series lock.
     */
    private void applyTick(SeriesSlot slot, Tick tick) {
        SeriesKey key = slot.key;
        CandleSeries series = slot.series;
        long bucket = timeWindowManager.bucketStart(tick.eventTime(), key.timeframe());
        long previousBucket = series.formingBucket();

        switch (series.apply(bucket, tick.price())) {
            case OPENED -> {
                log.debug("Started first candle: key={}, bucket={}", key, bucket);
                publishClosed(closedEvent(key, series));
            }
            case UPDATED -> {
                // hot path, nothing to report
            }
            case ROLLED_OVER -> {
                candlesClosed.incrementAndGet();
                if (log.isDebugEnabled()) {
                    log.debug("Rotated candle: key={}, old_bucket={}, new_bucket={}, empty_buckets={}",
                             key, previousBucket, bucket,
                             timeWindowManager.bucketsBetween(previousBucket, bucket, key.timeframe()) - 1);
                }
                publishClosed(closedEvent(key, series));
            }
            case LATE -> {
                lateTicksDropped.incrementAndGet();
                log.debug("Dropped late tick: key={}, tick_bucket={}, current_bucket={}, price={}",
                         key, bucket, previousBucket, tick.price());
            }
        }
    }

    /**
     * Snapshot of everything closed so far. On the first candle of an empty series the
     * history is empty and there is no closed candle.
     */
    private static CandleClosedEvent closedEvent(SeriesKey key, CandleSeries series) {
        List<Candle> history = series.closedCandles();
        Candle last = history.isEmpty() ? null : history.get(history.size() - 1);
        return new CandleClosedEvent(key, last, history);
    }

    private void publishClosed(CandleClosedEvent event) {
        try {
            listener.onCandleClosed(event);
        } catch (RuntimeException e) {
            listenerFailures.incrementAndGet();
            log.error("Candle-closed listener failed: key={}, closed={}, history={}",
                     event.key(), event.closedCandle(), event.history().size(), e);
        }
    }

    /**
     * Returns a consistent copy of one series.
     */
    public Optional<SeriesSnapshot> snapshot(SeriesKey key) {
        SeriesSlot slot = findSlot(key);
        if (slot == null) {
            return Optional.empty();
        }
        slot.lock.lock();
        try {
            if (slot.retired) {
                return Optional.empty();
            }
            return Optional.of(new SeriesSnapshot(
                key,
                slot.series.closedCandles(),
                slot.series.formingCandle().orElse(null),
                slot.active,
                slot.pending.size()
            ));
        } finally {
            slot.lock.unlock();
        }
    }

    public boolean isRegistered(SeriesKey key) {
        return findSlot(key) != null;
    }

    /** Returns all registered keys in natural order. */
    public List<SeriesKey> registeredKeys() {
        List<SeriesKey> keys = new ArrayList<>();
        seriesByInstrument.values().forEach(slots -> slots.values().forEach(slot -> keys.add(slot.key)));
        keys.sort(null);
        return keys;
    }

    private SeriesSlot findSlot(SeriesKey key) {
        Map<Timeframe, SeriesSlot> slots = seriesByInstrument.get(key.instrumentId());
        return slots == null ? null : slots.get(key.timeframe());
    }

    // Metrics accessors
    public long getTicksIngested() {
        return ticksIngested.get();
    }

    public long getInvalidTicks() {
        return invalidTicks.get();
    }

    public long getUnroutedTicks() {
        return unroutedTicks.get();
    }

    public long getLateTicksDropped() {
        return lateTicksDropped.get();
    }

    public long getCandlesClosed() {
        return candlesClosed.get();
    }

    public long getPendingTicksQueued() {
        return pendingTicksQueued.get();
    }

    public long getPendingTicksDropped() {
        return pendingTicksDropped.get();
    }

    public long getListenerFailures() {
        return listenerFailures.get();
    }

    /**
     * A series with its lock and lifecycle flags. Fields other than {@code key}
     * and {@code lock} are only touched while {@code lock} is held.
     */
    private static final class SeriesSlot {
        final SeriesKey key;
        final ReentrantLock lock = new ReentrantLock();
        final CandleSeries series;
        final ArrayDeque<Tick> pending = new ArrayDeque<>();
        boolean active;
        boolean retired;

        SeriesSlot(SeriesKey key, CandleSeries series, boolean active) {
            this.key = key;
            this.series = series;
            this.active = active;
        }
    }
}
