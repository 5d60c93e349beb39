package com.fintech.strategyengine.strategy;

import com.fintech.strategyengine.domain.Candle;
import com.fintech.strategyengine.domain.Signal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ChannelBreakoutStrategy Tests")
class ChannelBreakoutStrategyTest {

    private final ChannelBreakoutStrategy strategy = new ChannelBreakoutStrategy();

    private static List<Candle> closes(double... values) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            candles.add(Candle.of(i * 60_000L, values[i]));
        }
        return candles;
    }

    @Test
    @DisplayName("Close above the channel high should signal BUY")
    void testBuy() {
        Signal signal = strategy.evaluate(closes(100, 102, 101, 103), Map.of("length", 3));

        assertThat(signal).isEqualTo(Signal.BUY);
    }

    @Test
    @DisplayName("Close below the channel low should signal SELL")
    void testSell() {
        Signal signal = strategy.evaluate(closes(100, 102, 101, 99.5), Map.of("length", 3));

        assertThat(signal).isEqualTo(Signal.SELL);
    }

    @Test
    @DisplayName("Close inside the channel should be NEUTRAL")
    void testNeutral() {
        Signal signal = strategy.evaluate(closes(100, 102, 101, 101.5), Map.of("length", 3));

        assertThat(signal).isEqualTo(Signal.NEUTRAL);
    }

    @Test
    @DisplayName("Only the last length candles before the close should form the channel")
    void testWindow() {
        // 200 falls outside a length-2 window
        Signal signal = strategy.evaluate(closes(200, 100, 101, 102), Map.of("length", 2));

        assertThat(signal).isEqualTo(Signal.BUY);
    }

    @Test
    @DisplayName("Should accept numeric strings and integral doubles")
    void testParameterForms() {
        List<Candle> history = closes(100, 101, 102);

        assertThat(strategy.evaluate(history, Map.of("length", "2"))).isEqualTo(Signal.BUY);
        assertThat(strategy.evaluate(history, Map.of("length", 2.0))).isEqualTo(Signal.BUY);
    }

    @Test
    @DisplayName("Should fail with insufficient history")
    void testInsufficientHistory() {
        assertThatThrownBy(() -> strategy.evaluate(closes(100, 101), Map.of("length", 3)))
            .isInstanceOf(StrategyException.class)
            .hasMessageContaining("needs 4 closed candles, got 2");
    }

    @Test
    @DisplayName("Huge length should fail with insufficient history instead of overflowing")
    void testHugeLength() {
        assertThatThrownBy(() -> strategy.evaluate(closes(100, 101, 102), Map.of("length", Integer.MAX_VALUE)))
            .isInstanceOf(StrategyException.class)
            .hasMessageContaining("needs 2147483648 closed candles, got 3");
        assertThatThrownBy(() -> strategy.evaluate(closes(100, 101, 102), Map.of("length", 1e12)))
            .isInstanceOf(StrategyException.class)
            .hasMessageContaining("needs 2147483648 closed candles");
    }

    @Test
    @DisplayName("Should fail on missing length")
    void testMissingLength() {
        assertThatThrownBy(() -> strategy.evaluate(closes(100, 101), Collections.emptyMap()))
            .isInstanceOf(StrategyException.class)
            .hasMessageContaining("length");
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "-3", "abc", "2.5"})
    @DisplayName("Should reject invalid length values")
    void testInvalidLength(String length) {
        assertThatThrownBy(() -> strategy.evaluate(closes(100, 101, 102), Map.of("length", length)))
            .isInstanceOf(StrategyException.class);
    }

    @Test
    @DisplayName("Should reject fractional numeric length")
    void testFractionalLength() {
        assertThatThrownBy(() -> strategy.evaluate(closes(100, 101, 102), Map.of("length", 1.5)))
            .isInstanceOf(StrategyException.class);
    }
}
