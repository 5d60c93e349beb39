package com.fintech.strategyengine.execution;

import com.fintech.strategyengine.config.EngineProperties;
import com.fintech.strategyengine.domain.OrderRequest;
import com.fintech.strategyengine.domain.Signal;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns actionable signals into market orders on a bounded worker pool.
 *
 * Order placement goes through the "orderExecution" circuit breaker. Queue overflow,
 * an open breaker and gateway errors are counted and logged; nothing propagates back
 * to the dispatching thread.
 */
@Component
public class OrderSignalSink implements SignalSink {

    private static final Logger log = LoggerFactory.getLogger(OrderSignalSink.class);

    private final OrderExecutionGateway gateway;
    private final CircuitBreaker circuitBreaker;
    private final Clock clock;
    private final long quantity;
    private final ThreadPoolExecutor executor;

    private final AtomicLong ordersSubmitted = new AtomicLong(0);
    private final AtomicLong ordersPlaced = new AtomicLong(0);
    private final AtomicLong ordersFailed = new AtomicLong(0);
    private final AtomicLong ordersRejected = new AtomicLong(0);

    public OrderSignalSink(
            OrderExecutionGateway gateway,
            CircuitBreakerRegistry circuitBreakerRegistry,
            MeterRegistry meterRegistry,
            EngineProperties properties,
            Clock clock) {
        this.gateway = gateway;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker("orderExecution");
        this.clock = clock;

        EngineProperties.Execution execution = properties.getExecution();
        this.quantity = execution.getQuantity();

        ThreadFactory threadFactory = new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName("order-executor-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        };
        this.executor = new ThreadPoolExecutor(
            execution.getWorkerThreads(),
            execution.getWorkerThreads(),
            0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(execution.getQueueCapacity()),
            threadFactory
        );

        meterRegistry.gauge("engine.execution.orders.submitted", ordersSubmitted);
        meterRegistry.gauge("engine.execution.orders.placed", ordersPlaced);
        meterRegistry.gauge("engine.execution.orders.failed", ordersFailed);
        meterRegistry.gauge("engine.execution.orders.rejected", ordersRejected);

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                log.warn("Order circuit breaker state changed: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState())
            );
    }

    @Override
    public void emit(String instrumentId, Signal signal) {
        if (signal == null || !signal.isActionable()) {
            return;
        }

        OrderRequest request = new OrderRequest(instrumentId, signal, quantity, clock.instant());
        try {
            executor.execute(() -> place(request));
            ordersSubmitted.incrementAndGet();
        } catch (RejectedExecutionException e) {
            ordersRejected.incrementAndGet();
            log.warn("Order queue full or closed - dropping {} signal for {}", signal, instrumentId);
        }
    }

    private void place(OrderRequest request) {
        try {
            String orderId = circuitBreaker.executeSupplier(() -> gateway.placeOrder(request));
            ordersPlaced.incrementAndGet();
            log.info("Order placed: id={}, instrument={}, side={}, quantity={}",
                     orderId, request.instrumentId(), request.side(), request.quantity());

        } catch (CallNotPermittedException e) {
            ordersRejected.incrementAndGet();
            log.warn("Circuit breaker OPEN - order skipped: instrument={}, side={}",
                     request.instrumentId(), request.side());

        } catch (Exception e) {
            ordersFailed.incrementAndGet();
            log.error("Order placement failed: instrument={}, side={}",
                      request.instrumentId(), request.side(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down order executor...");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Order executor did not drain in time, {} orders abandoned",
                         executor.shutdownNow().size());
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public String getCircuitBreakerState() {
        return circuitBreaker.getState().name();
    }

    public long getOrdersSubmitted() {
        return ordersSubmitted.get();
    }

    public long getOrdersPlaced() {
        return ordersPlaced.get();
    }

    public long getOrdersFailed() {
        return ordersFailed.get();
    }

    public long getOrdersRejected() {
        return ordersRejected.get();
    }
}
