package com.fintech.strategyengine.dispatch;

import com.fintech.strategyengine.config.EngineProperties;
import com.fintech.strategyengine.domain.Candle;
import com.fintech.strategyengine.domain.CandleClosedEvent;
import com.fintech.strategyengine.domain.SeriesKey;
import com.fintech.strategyengine.domain.Signal;
import com.fintech.strategyengine.domain.StrategyRegistration;
import com.fintech.strategyengine.domain.Timeframe;
import com.fintech.strategyengine.execution.SignalSink;
import com.fintech.strategyengine.strategy.StrategyCatalog;
import com.fintech.strategyengine.strategy.StrategyException;
import com.fintech.strategyengine.strategy.TradingStrategy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link StrategyDispatcher}.
 * Strategy and sink are mocks; registry and catalog are real.
 */
@DisplayName("StrategyDispatcher Tests")
class StrategyDispatcherTest {

    private static final SeriesKey KEY = SeriesKey.of("3045", Timeframe.M1);
    private static final Map<String, Object> PARAMS = Map.of("length", 2);

    private StrategyRegistry registry;
    private TradingStrategy strategy;
    private SignalSink sink;
    private SimpleMeterRegistry meterRegistry;
    private EngineProperties properties;
    private StrategyDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        registry = new StrategyRegistry();
        strategy = mock(TradingStrategy.class);
        when(strategy.id()).thenReturn("Mocked");
        sink = mock(SignalSink.class);
        meterRegistry = new SimpleMeterRegistry();
        properties = new EngineProperties();
        dispatcher = newDispatcher();
    }

    private StrategyDispatcher newDispatcher() {
        StrategyCatalog catalog = new StrategyCatalog(List.of(strategy));
        return new StrategyDispatcher(registry, catalog, sink, meterRegistry, properties);
    }

    private static CandleClosedEvent event(int closedCandles) {
        List<Candle> history = new ArrayList<>();
        for (int i = 0; i < closedCandles; i++) {
            history.add(Candle.of(i * 60_000L, 100.0 + i));
        }
        Candle last = history.isEmpty() ? null : history.get(history.size() - 1);
        return new CandleClosedEvent(KEY, last, history);
    }

    @Test
    @DisplayName("Actionable signal should reach the sink with the instrument")
    void testBuyForwarded() {
        registry.put(new StrategyRegistration(KEY, "Mocked", PARAMS));
        CandleClosedEvent event = event(3);
        when(strategy.evaluate(event.history(), PARAMS)).thenReturn(Signal.BUY);

        dispatcher.onCandleClosed(event);

        verify(sink).emit("3045", Signal.BUY);
        assertThat(dispatcher.getDispatches()).isEqualTo(1);
        assertThat(meterRegistry.counter("engine.dispatch.signals", "signal", "buy").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Neutral signal should not reach the sink")
    void testNeutralNotForwarded() {
        registry.put(new StrategyRegistration(KEY, "Mocked", PARAMS));
        when(strategy.evaluate(anyList(), anyMap())).thenReturn(Signal.NEUTRAL);

        dispatcher.onCandleClosed(event(3));

        verify(sink, never()).emit(anyString(), any());
        assertThat(meterRegistry.counter("engine.dispatch.signals", "signal", "neutral").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Event without a registration should be a counted no-op")
    void testOrphan() {
        dispatcher.onCandleClosed(event(3));

        verify(strategy, never()).evaluate(anyList(), anyMap());
        assertThat(dispatcher.getOrphanEvents()).isEqualTo(1);
    }

    @Test
    @DisplayName("Unknown strategy id should be contained and counted")
    void testUnknownStrategy() {
        registry.put(new StrategyRegistration(KEY, "DoesNotExist", PARAMS));

        dispatcher.onCandleClosed(event(3));

        assertThat(dispatcher.getStrategyFailures()).isEqualTo(1);
        verify(sink, never()).emit(anyString(), any());
    }

    @Test
    @DisplayName("Strategy errors should be contained and counted")
    void testStrategyFailure() {
        registry.put(new StrategyRegistration(KEY, "Mocked", PARAMS));
        when(strategy.evaluate(anyList(), anyMap()))
            .thenThrow(StrategyException.insufficientHistory("Mocked", 5, 3))
            .thenThrow(new IllegalStateException("bug"))
            .thenReturn(null);

        dispatcher.onCandleClosed(event(3));
        dispatcher.onCandleClosed(event(3));
        dispatcher.onCandleClosed(event(3));

        assertThat(dispatcher.getStrategyFailures()).isEqualTo(3);
        verify(sink, never()).emit(anyString(), any());
    }

    @Test
    @DisplayName("Sink failure should be counted and not propagate")
    void testSinkFailure() {
        registry.put(new StrategyRegistration(KEY, "Mocked", PARAMS));
        when(strategy.evaluate(anyList(), anyMap())).thenReturn(Signal.SELL);
        doThrow(new IllegalStateException("broker down")).when(sink).emit(anyString(), eq(Signal.SELL));

        dispatcher.onCandleClosed(event(3));

        assertThat(dispatcher.getSinkFailures()).isEqualTo(1);
    }

    @Test
    @DisplayName("Events with fewer closed candles than the minimum should be skipped")
    void testMinHistory() {
        properties.getDispatch().setMinHistory(5);
        dispatcher = newDispatcher();
        registry.put(new StrategyRegistration(KEY, "Mocked", PARAMS));
        when(strategy.evaluate(anyList(), anyMap())).thenReturn(Signal.BUY);

        dispatcher.onCandleClosed(event(4));
        dispatcher.onCandleClosed(event(5));

        assertThat(dispatcher.getSkippedShortHistory()).isEqualTo(1);
        verify(sink).emit("3045", Signal.BUY);
    }

    @Test
    @DisplayName("Opening event of an empty series should reach the strategy with empty history")
    void testEmptyHistoryEvent() {
        registry.put(new StrategyRegistration(KEY, "Mocked", PARAMS));
        when(strategy.evaluate(anyList(), anyMap())).thenReturn(Signal.SELL);

        dispatcher.onCandleClosed(event(0));

        verify(strategy).evaluate(List.of(), PARAMS);
        verify(sink).emit("3045", Signal.SELL);
    }

    @Test
    @DisplayName("Opening event should be skipped when a minimum history is configured")
    void testEmptyHistorySkipped() {
        properties.getDispatch().setMinHistory(1);
        dispatcher = newDispatcher();
        registry.put(new StrategyRegistration(KEY, "Mocked", PARAMS));

        dispatcher.onCandleClosed(event(0));

        assertThat(dispatcher.getSkippedShortHistory()).isEqualTo(1);
        verify(strategy, never()).evaluate(anyList(), anyMap());
    }

    @Test
    @DisplayName("Replaced registration should be used for the next dispatch")
    void testReplacedParameters() {
        Map<String, Object> replaced = Map.of("length", 7);
        registry.put(new StrategyRegistration(KEY, "Mocked", PARAMS));
        registry.put(new StrategyRegistration(KEY, "Mocked", replaced));
        when(strategy.evaluate(anyList(), anyMap())).thenReturn(Signal.NEUTRAL);

        dispatcher.onCandleClosed(event(3));

        verify(strategy).evaluate(anyList(), eq(replaced));
    }
}
