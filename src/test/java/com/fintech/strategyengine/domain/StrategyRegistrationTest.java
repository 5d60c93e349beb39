package com.fintech.strategyengine.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("StrategyRegistration Tests")
class StrategyRegistrationTest {

    @Test
    @DisplayName("Should copy parameters on construction")
    void testParametersCopied() {
        Map<String, Object> params = new HashMap<>();
        params.put("length", 10);
        StrategyRegistration registration =
            new StrategyRegistration(SeriesKey.of("3045", Timeframe.M1), "ChannelBreakout", params);

        params.put("length", 20);

        assertThat(registration.parameters()).containsEntry("length", 10);
        assertThatThrownBy(() -> registration.parameters().put("x", 1))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should treat null parameters as empty")
    void testNullParameters() {
        StrategyRegistration registration =
            new StrategyRegistration(SeriesKey.of("3045", Timeframe.M5), "ChannelBreakout", null);

        assertThat(registration.parameters()).isEmpty();
        assertThat(registration.instrumentId()).isEqualTo("3045");
        assertThat(registration.timeframe()).isEqualTo(Timeframe.M5);
    }

    @Test
    @DisplayName("Should order keys by instrument then timeframe")
    void testKeyOrdering() {
        SeriesKey a = SeriesKey.of("1594", Timeframe.H1);
        SeriesKey b = SeriesKey.of("3045", Timeframe.M1);
        SeriesKey c = SeriesKey.of("3045", Timeframe.M5);

        assertThat(a).isLessThan(b);
        assertThat(b).isLessThan(c);
        assertThat(c.toString()).isEqualTo("3045-5m");
    }
}
