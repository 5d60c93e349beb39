package com.fintech.strategyengine.ingestion;

import com.fintech.strategyengine.aggregation.AggregationEngine;
import com.fintech.strategyengine.config.EngineProperties;
import com.fintech.strategyengine.domain.Tick;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.EventFactory;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Inbound tick channel built on an LMAX Disruptor ring buffer.
 *
 * Any number of producer threads publish; each consumer thread owns a fixed shard of
 * instruments, so ticks of one instrument are always applied in publish order by the same
 * thread while different instruments are aggregated in parallel.
 */
@Component
public class DisruptorTickPublisher {

    private static final Logger log = LoggerFactory.getLogger(DisruptorTickPublisher.class);

    private final AggregationEngine engine;
    private final EngineProperties properties;

    private final AtomicLong ticksDropped = new AtomicLong(0);

    private Disruptor<TickSlot> disruptor;
    private RingBuffer<TickSlot> ringBuffer;
    private int shards;

    public DisruptorTickPublisher(AggregationEngine engine, EngineProperties properties, MeterRegistry meterRegistry) {
        this.engine = engine;
        this.properties = properties;

        meterRegistry.gauge("engine.ingestion.ringbuffer.ticks.dropped", ticksDropped);
    }

    @PostConstruct
    public void start() {
        EngineProperties.DisruptorConfig config = properties.getDisruptor();
        int bufferSize = config.getBufferSize();
        shards = Math.max(1, config.getNumConsumers());

        EventFactory<TickSlot> eventFactory = TickSlot::new;

        ThreadFactory threadFactory = new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName("tick-consumer-" + counter.incrementAndGet());
                thread.setDaemon(false);
                return thread;
            }
        };

        WaitStrategy waitStrategy = createWaitStrategy(config.getWaitStrategy());

        disruptor = new Disruptor<>(
            eventFactory,
            bufferSize,
            threadFactory,
            ProducerType.MULTI,
            waitStrategy
        );

        // Every handler sees every slot and keeps only its own instruments
        @SuppressWarnings("unchecked")
        EventHandler<TickSlot>[] handlers = new EventHandler[shards];
        for (int i = 0; i < shards; i++) {
            final int shard = i;
            handlers[i] = (slot, sequence, endOfBatch) -> {
                Tick tick = slot.tick;
                if (tick != null && shardOf(tick.instrumentId()) == shard) {
                    engine.ingest(tick);
                }
            };
        }
        disruptor.handleEventsWith(handlers);

        disruptor.setDefaultExceptionHandler(new ExceptionHandler<TickSlot>() {
            @Override
            public void handleEventException(Throwable ex, long sequence, TickSlot slot) {
                log.error("Exception processing tick at sequence {}: {}", sequence, slot.tick, ex);
            }

            @Override
            public void handleOnStartException(Throwable ex) {
                log.error("Exception during Disruptor startup", ex);
            }

            @Override
            public void handleOnShutdownException(Throwable ex) {
                log.error("Exception during Disruptor shutdown", ex);
            }
        });

        ringBuffer = disruptor.start();

        log.info("Tick channel started: bufferSize={}, consumers={}, waitStrategy={}",
                bufferSize, shards, waitStrategy.getClass().getSimpleName());
    }

    /**
     * Publishes a tick, blocking while the ring buffer is full (backpressure).
     */
    public void publish(Tick tick) {
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).tick = tick;
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    /**
     * Publishes without blocking.
     *
     * @return false if the ring buffer was full and the tick was dropped
     */
    public boolean tryPublish(Tick tick) {
        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            ticksDropped.incrementAndGet();
            return false;
        }
        try {
            ringBuffer.get(sequence).tick = tick;
        } finally {
            ringBuffer.publish(sequence);
        }
        return true;
    }

    int shardOf(String instrumentId) {
        return Math.floorMod(instrumentId == null ? 0 : instrumentId.hashCode(), shards);
    }

    @PreDestroy
    public void shutdown() {
        if (disruptor != null) {
            log.info("Shutting down tick channel...");
            disruptor.shutdown();
            log.info("Tick channel shutdown complete");
        }
    }

    private WaitStrategy createWaitStrategy(String strategy) {
        return switch (strategy.toUpperCase()) {
            case "BLOCKING" -> new BlockingWaitStrategy();
            case "SLEEPING" -> new SleepingWaitStrategy();
            case "YIELDING" -> new YieldingWaitStrategy();
            case "BUSY_SPIN" -> new BusySpinWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy: {}, using BLOCKING", strategy);
                yield new BlockingWaitStrategy();
            }
        };
    }

    /**
     * Pre-allocated ring buffer entry.
     */
    private static class TickSlot {
        Tick tick;
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public long getBufferSize() {
        return ringBuffer.getBufferSize();
    }

    /** Returns total ticks dropped due to ring buffer full. */
    public long getTicksDropped() {
        return ticksDropped.get();
    }
}
