package com.fintech.strategyengine.api;

import com.fintech.strategyengine.aggregation.AggregationEngine;
import com.fintech.strategyengine.dispatch.StrategyDispatcher;
import com.fintech.strategyengine.dispatch.StrategyRegistry;
import com.fintech.strategyengine.execution.OrderSignalSink;
import com.fintech.strategyengine.history.HistoryBackfillService;
import com.fintech.strategyengine.ingestion.DisruptorTickPublisher;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Human-readable engine counters for ops and debugging.
 * The same values are exported through /actuator/prometheus.
 */
@RestController
@RequestMapping("/api/v1/metrics")
public class MetricsController {

    private final AggregationEngine engine;
    private final StrategyRegistry registry;
    private final StrategyDispatcher dispatcher;
    private final OrderSignalSink signalSink;
    private final HistoryBackfillService backfillService;
    private final DisruptorTickPublisher publisher;

    public MetricsController(
            AggregationEngine engine,
            StrategyRegistry registry,
            StrategyDispatcher dispatcher,
            OrderSignalSink signalSink,
            HistoryBackfillService backfillService,
            DisruptorTickPublisher publisher) {
        this.engine = engine;
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.signalSink = signalSink;
        this.backfillService = backfillService;
        this.publisher = publisher;
    }

    @GetMapping("/engine")
    public Map<String, Object> getEngineMetrics() {
        Map<String, Object> aggregation = new LinkedHashMap<>();
        aggregation.put("series", engine.registeredKeys().size());
        aggregation.put("ticks_ingested", engine.getTicksIngested());
        aggregation.put("ticks_invalid", engine.getInvalidTicks());
        aggregation.put("ticks_unrouted", engine.getUnroutedTicks());
        aggregation.put("ticks_late_dropped", engine.getLateTicksDropped());
        aggregation.put("candles_closed", engine.getCandlesClosed());
        aggregation.put("pending_queued", engine.getPendingTicksQueued());
        aggregation.put("pending_dropped", engine.getPendingTicksDropped());

        Map<String, Object> dispatch = new LinkedHashMap<>();
        dispatch.put("registrations", registry.size());
        dispatch.put("invocations", dispatcher.getDispatches());
        dispatch.put("orphan_events", dispatcher.getOrphanEvents());
        dispatch.put("skipped_short_history", dispatcher.getSkippedShortHistory());
        dispatch.put("strategy_failures", dispatcher.getStrategyFailures());
        dispatch.put("sink_failures", dispatcher.getSinkFailures());

        Map<String, Object> execution = new LinkedHashMap<>();
        execution.put("orders_submitted", signalSink.getOrdersSubmitted());
        execution.put("orders_placed", signalSink.getOrdersPlaced());
        execution.put("orders_failed", signalSink.getOrdersFailed());
        execution.put("orders_rejected", signalSink.getOrdersRejected());
        execution.put("circuit_breaker", signalSink.getCircuitBreakerState());

        Map<String, Object> channel = new LinkedHashMap<>();
        channel.put("buffer_size", publisher.getBufferSize());
        channel.put("remaining_capacity", publisher.getRemainingCapacity());
        channel.put("ticks_dropped", publisher.getTicksDropped());
        channel.put("backfills_completed", backfillService.getBackfillsCompleted());
        channel.put("backfill_failures", backfillService.getBackfillFailures());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("aggregation", aggregation);
        response.put("dispatch", dispatch);
        response.put("execution", execution);
        response.put("ingestion", channel);
        return response;
    }
}
