package com.fintech.strategyengine.api;

import com.fintech.strategyengine.aggregation.AggregationEngine;
import com.fintech.strategyengine.domain.SeriesKey;
import com.fintech.strategyengine.domain.Timeframe;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Read-only view of the in-memory candle series.
 */
@RestController
@RequestMapping("/api/v1/series")
@Tag(name = "Series", description = "In-memory candle series")
public class SeriesController {

    private final AggregationEngine engine;

    public SeriesController(AggregationEngine engine) {
        this.engine = engine;
    }

    @Operation(summary = "List registered series keys")
    @GetMapping
    public List<String> keys() {
        return engine.registeredKeys().stream()
            .map(SeriesKey::toString)
            .collect(Collectors.toList());
    }

    @Operation(summary = "Get closed candles and the forming candle of one series")
    @GetMapping("/{instrumentId}/{timeframe}")
    public ResponseEntity<SeriesResponse> get(@PathVariable String instrumentId, @PathVariable String timeframe) {
        SeriesKey key = SeriesKey.of(instrumentId, Timeframe.fromCode(timeframe));
        return engine.snapshot(key)
            .map(SeriesResponse::fromSnapshot)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
