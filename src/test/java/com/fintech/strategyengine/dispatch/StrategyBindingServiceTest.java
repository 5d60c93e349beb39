package com.fintech.strategyengine.dispatch;

import com.fintech.strategyengine.aggregation.AggregationEngine;
import com.fintech.strategyengine.aggregation.SeriesSnapshot;
import com.fintech.strategyengine.config.EngineProperties;
import com.fintech.strategyengine.domain.Candle;
import com.fintech.strategyengine.domain.CandleClosedEvent;
import com.fintech.strategyengine.domain.SeriesKey;
import com.fintech.strategyengine.domain.StrategyRegistration;
import com.fintech.strategyengine.domain.Tick;
import com.fintech.strategyengine.domain.Timeframe;
import com.fintech.strategyengine.history.HistoryBackfillService;
import com.fintech.strategyengine.strategy.ChannelBreakoutStrategy;
import com.fintech.strategyengine.strategy.StrategyCatalog;
import com.fintech.strategyengine.util.TimeWindowManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link StrategyBindingService} against a real engine and registry.
 * The backfill service is mocked to control the seed.
 */
@DisplayName("StrategyBindingService Tests")
class StrategyBindingServiceTest {

    private static final long MINUTE = 60_000L;
    private static final long BASE = 1_733_529_600_000L;
    private static final SeriesKey KEY = SeriesKey.of("3045", Timeframe.M1);
    private static final Map<String, Object> PARAMS = Map.of("length", 2);

    private StrategyRegistry registry;
    private HistoryBackfillService backfillService;
    private EngineProperties properties;
    private List<CandleClosedEvent> events;
    private AggregationEngine engine;
    private StrategyBindingService service;

    @BeforeEach
    void setUp() {
        registry = new StrategyRegistry();
        backfillService = mock(HistoryBackfillService.class);
        when(backfillService.loadHistory(any())).thenReturn(List.of());
        properties = new EngineProperties();
        events = new CopyOnWriteArrayList<>();
        service = newService();
    }

    private StrategyBindingService newService() {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        engine = new AggregationEngine(new TimeWindowManager(), events::add, meterRegistry, properties);
        StrategyCatalog catalog = new StrategyCatalog(List.of(new ChannelBreakoutStrategy()));
        return new StrategyBindingService(registry, engine, backfillService, catalog, meterRegistry, properties);
    }

    private static List<Candle> history(int count) {
        List<Candle> candles = new ArrayList<>();
        for (int i = count; i > 0; i--) {
            candles.add(Candle.of(BASE - i * MINUTE, 100.0 + i));
        }
        return candles;
    }

    @Test
    @DisplayName("Add should seed the series from history before live ticks")
    void testAddSeedsHistory() {
        when(backfillService.loadHistory(KEY)).thenReturn(history(3));

        StrategyRegistration registration = service.add("3045", "1m", "ChannelBreakout", PARAMS);

        assertThat(registration.key()).isEqualTo(KEY);
        assertThat(registry.find(KEY)).contains(registration);
        SeriesSnapshot snapshot = engine.snapshot(KEY).orElseThrow();
        assertThat(snapshot.active()).isTrue();
        assertThat(snapshot.closed()).hasSize(2);
        assertThat(snapshot.forming().bucketStart()).isEqualTo(BASE - MINUTE);

        engine.ingest(new Tick("3045", 120.0, BASE + 1_000));

        assertThat(events).hasSize(1);
        assertThat(events.get(0).history()).hasSize(3);
    }

    @Test
    @DisplayName("Backfill failure should leave an empty active series")
    void testEmptyBackfill() {
        service.add("3045", Timeframe.M1, "ChannelBreakout", PARAMS);

        SeriesSnapshot snapshot = engine.snapshot(KEY).orElseThrow();
        assertThat(snapshot.active()).isTrue();
        assertThat(snapshot.closed()).isEmpty();
        assertThat(snapshot.forming()).isNull();
    }

    @Test
    @DisplayName("Replacing a registration should keep history and skip backfill")
    void testReplaceKeepsHistory() {
        when(backfillService.loadHistory(KEY)).thenReturn(history(3));
        service.add("3045", Timeframe.M1, "ChannelBreakout", PARAMS);

        StrategyRegistration replaced = service.add("3045", Timeframe.M1, "ChannelBreakout", Map.of("length", 5));

        verify(backfillService, times(1)).loadHistory(KEY);
        assertThat(registry.find(KEY)).contains(replaced);
        assertThat(engine.snapshot(KEY).orElseThrow().closed()).hasSize(2);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Remove then add should start from a fresh backfill")
    void testRemoveThenAdd() {
        when(backfillService.loadHistory(KEY)).thenReturn(history(3));
        service.add("3045", Timeframe.M1, "ChannelBreakout", PARAMS);
        engine.ingest(new Tick("3045", 120.0, BASE + 1_000));

        assertThat(service.remove("3045", Timeframe.M1)).isTrue();
        assertThat(engine.isRegistered(KEY)).isFalse();
        assertThat(registry.find(KEY)).isEmpty();

        when(backfillService.loadHistory(KEY)).thenReturn(List.of());
        service.add("3045", Timeframe.M1, "ChannelBreakout", PARAMS);

        SeriesSnapshot snapshot = engine.snapshot(KEY).orElseThrow();
        assertThat(snapshot.closed()).isEmpty();
        assertThat(snapshot.forming()).isNull();
    }

    @Test
    @DisplayName("Removing an unknown key should report false")
    void testRemoveUnknown() {
        assertThat(service.remove("3045", Timeframe.M5)).isFalse();
    }

    @Test
    @DisplayName("History can be retained across remove when configured")
    void testRetainHistory() {
        properties.getRegistry().setDiscardHistoryOnRemove(false);
        service = newService();
        when(backfillService.loadHistory(KEY)).thenReturn(history(3));
        service.add("3045", Timeframe.M1, "ChannelBreakout", PARAMS);

        service.remove("3045", Timeframe.M1);
        engine.ingest(new Tick("3045", 120.0, BASE + 1_000));

        assertThat(engine.isRegistered(KEY)).isTrue();
        assertThat(registry.find(KEY)).isEmpty();
        assertThat(events).hasSize(1);
    }

    @Test
    @DisplayName("Remove all should clear registrations and series")
    void testRemoveAll() {
        service.add("3045", Timeframe.M1, "ChannelBreakout", PARAMS);
        service.add("3045", Timeframe.M5, "ChannelBreakout", PARAMS);
        service.add("2885", Timeframe.H1, "ChannelBreakout", PARAMS);

        assertThat(service.removeAll()).isEqualTo(3);

        assertThat(service.list()).isEmpty();
        assertThat(engine.registeredKeys()).isEmpty();
    }

    @Test
    @DisplayName("Remove all should wait for an in-flight replace and leave registry and series in step")
    void testRemoveAllDuringReplace() throws Exception {
        AtomicInteger puts = new AtomicInteger();
        AtomicBoolean removeAllBlocked = new AtomicBoolean();
        Thread[] removeAll = new Thread[1];
        registry = new StrategyRegistry() {
            @Override
            public Optional<StrategyRegistration> put(StrategyRegistration registration) {
                if (puts.incrementAndGet() == 2) {
                    removeAll[0] = new Thread(service::removeAll);
                    removeAll[0].start();
                    try {
                        removeAll[0].join(200);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    removeAllBlocked.set(removeAll[0].isAlive());
                }
                return super.put(registration);
            }
        };
        service = newService();

        service.add("3045", Timeframe.M1, "ChannelBreakout", PARAMS);
        service.add("3045", Timeframe.M1, "ChannelBreakout", Map.of("length", 3));
        removeAll[0].join(5_000);

        assertThat(removeAllBlocked).isTrue();
        assertThat(removeAll[0].isAlive()).isFalse();
        assertThat(registry.find(KEY)).isEmpty();
        assertThat(engine.isRegistered(KEY)).isFalse();

        service.add("3045", Timeframe.M1, "ChannelBreakout", PARAMS);
        engine.ingest(new Tick("3045", 100.0, BASE));
        engine.ingest(new Tick("3045", 101.0, BASE + MINUTE));

        assertThat(registry.find(KEY)).isPresent();
        assertThat(engine.isRegistered(KEY)).isTrue();
        assertThat(engine.getUnroutedTicks()).isZero();
        assertThat(events).hasSize(2);
    }

    @Test
    @DisplayName("Instrument and strategy ids should be trimmed")
    void testTrim() {
        StrategyRegistration registration = service.add(" 3045 ", "5m", " ChannelBreakout ", PARAMS);

        assertThat(registration.instrumentId()).isEqualTo("3045");
        assertThat(registration.strategyId()).isEqualTo("ChannelBreakout");
        assertThat(service.find("3045", Timeframe.M5)).contains(registration);
    }

    @Test
    @DisplayName("Malformed registrations should fail synchronously")
    void testValidation() {
        assertThatThrownBy(() -> service.add("3045", "2m", "ChannelBreakout", PARAMS))
            .isInstanceOf(StrategyBindingService.RegistrationException.class)
            .hasMessageContaining("Unsupported timeframe");
        assertThatThrownBy(() -> service.add(" ", Timeframe.M1, "ChannelBreakout", PARAMS))
            .isInstanceOf(StrategyBindingService.RegistrationException.class);
        assertThatThrownBy(() -> service.add("3045", (Timeframe) null, "ChannelBreakout", PARAMS))
            .isInstanceOf(StrategyBindingService.RegistrationException.class);
        assertThatThrownBy(() -> service.add("3045", Timeframe.M1, "", PARAMS))
            .isInstanceOf(StrategyBindingService.RegistrationException.class);
        assertThatThrownBy(() -> service.add("3045", Timeframe.M1, "ChannelBreakout", Map.of(" ", 1)))
            .isInstanceOf(StrategyBindingService.RegistrationException.class);

        assertThat(service.getValidationErrors()).isEqualTo(5);
        assertThat(registry.size()).isZero();
        assertThat(engine.registeredKeys()).isEmpty();
        verify(backfillService, never()).loadHistory(any());
    }

    @Test
    @DisplayName("Unknown strategy id should still register")
    void testUnknownStrategyAccepted() {
        StrategyRegistration registration = service.add("3045", Timeframe.M1, "NotYetDeployed", null);

        assertThat(registry.find(KEY)).contains(registration);
        assertThat(registration.parameters()).isEmpty();
    }
}
