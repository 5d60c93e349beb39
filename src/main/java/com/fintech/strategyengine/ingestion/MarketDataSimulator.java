package com.fintech.strategyengine.ingestion;

import com.fintech.strategyengine.config.EngineProperties;
import com.fintech.strategyengine.domain.Tick;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Random-walk last-traded-price feed for local runs and demos.
 * Stands in for the vendor websocket; disabled unless engine.simulation.enabled=true.
 */
@Component
@ConditionalOnProperty(name = "engine.simulation.enabled", havingValue = "true")
public class MarketDataSimulator {

    private static final Logger log = LoggerFactory.getLogger(MarketDataSimulator.class);

    private static final double INITIAL_PRICE = 500.0;
    private static final double VOLATILITY = 0.0005;

    private final DisruptorTickPublisher publisher;
    private final EngineProperties properties;
    private final Clock clock;
    private final Map<String, Double> currentPrices = new ConcurrentHashMap<>();
    private final AtomicLong ticksGenerated = new AtomicLong(0);

    public MarketDataSimulator(DisruptorTickPublisher publisher, EngineProperties properties, Clock clock) {
        this.publisher = publisher;
        this.properties = properties;
        this.clock = clock;
        for (String instrument : properties.getSimulation().getInstruments()) {
            currentPrices.put(instrument, INITIAL_PRICE);
            log.info("Simulating instrument {} from {}", instrument, INITIAL_PRICE);
        }
    }

    /**
     * Emits one tick per configured instrument.
     */
    @Scheduled(fixedRateString = "${engine.simulation.update-frequency-ms:250}")
    public void generateTicks() {
        long timestamp = clock.millis();

        for (String instrument : properties.getSimulation().getInstruments()) {
            Tick tick = new Tick(instrument, nextPrice(instrument), timestamp);
            if (!publisher.tryPublish(tick)) {
                log.warn("Failed to publish tick for {} - ring buffer full", instrument);
                continue;
            }
            long generated = ticksGenerated.incrementAndGet();
            if (generated % 10_000 == 0) {
                log.info("Generated {} simulated ticks", generated);
            }
        }
    }

    /**
     * Random walk step, rounded to the 0.05 tick size.
     */
    double nextPrice(String instrument) {
        double current = currentPrices.getOrDefault(instrument, INITIAL_PRICE);
        double maxChange = current * VOLATILITY;
        double next = current + ThreadLocalRandom.current().nextDouble(-maxChange, maxChange);
        next = Math.round(next * 20.0) / 20.0;
        if (next <= 0) {
            next = current;
        }
        currentPrices.put(instrument, next);
        return next;
    }

    public long getTicksGenerated() {
        return ticksGenerated.get();
    }
}
