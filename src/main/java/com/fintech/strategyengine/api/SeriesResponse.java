package com.fintech.strategyengine.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fintech.strategyengine.aggregation.SeriesSnapshot;
import com.fintech.strategyengine.domain.Candle;

import java.util.ArrayList;
import java.util.List;

/**
 * Columnar view of a series, compatible with TradingView Lightweight Charts.
 * Closed candles go in the t/o/h/l/c arrays; the forming candle is reported separately
 * because it can still change.
 *
 * Example response:
 * {
 *   "s": "ok",
 *   "instrument": "3045",
 *   "timeframe": "1m",
 *   "active": true,
 *   "t": [1620000000, 1620000060],
 *   "o": [601.5, 602.0],
 *   "h": [602.1, 602.4],
 *   "l": [601.2, 601.9],
 *   "c": [602.0, 602.3],
 *   "forming": {"bucketStart": 1620000120000, "open": 602.3, ...}
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SeriesResponse(
    @JsonProperty("s") String status,
    @JsonProperty("instrument") String instrumentId,
    @JsonProperty("timeframe") String timeframe,
    @JsonProperty("active") boolean active,
    @JsonProperty("t") List<Long> time,
    @JsonProperty("o") List<Double> open,
    @JsonProperty("h") List<Double> high,
    @JsonProperty("l") List<Double> low,
    @JsonProperty("c") List<Double> close,
    @JsonProperty("forming") Candle forming
) {

    public static SeriesResponse fromSnapshot(SeriesSnapshot snapshot) {
        List<Candle> candles = snapshot.closed();
        int size = candles.size();

        List<Long> time = new ArrayList<>(size);
        List<Double> open = new ArrayList<>(size);
        List<Double> high = new ArrayList<>(size);
        List<Double> low = new ArrayList<>(size);
        List<Double> close = new ArrayList<>(size);

        for (Candle candle : candles) {
            // Convert milliseconds to seconds for TradingView
            time.add(candle.bucketStart() / 1000);
            open.add(candle.open());
            high.add(candle.high());
            low.add(candle.low());
            close.add(candle.close());
        }

        return new SeriesResponse(
            "ok",
            snapshot.key().instrumentId(),
            snapshot.key().timeframe().code(),
            snapshot.active(),
            time, open, high, low, close,
            snapshot.forming()
        );
    }
}
