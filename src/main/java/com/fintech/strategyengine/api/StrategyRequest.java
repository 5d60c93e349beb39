package com.fintech.strategyengine.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * Request body for binding a strategy to an (instrument, timeframe) series.
 */
@Schema(description = "Strategy binding request")
public record StrategyRequest(

    @NotBlank
    @Schema(description = "Instrument token", example = "3045")
    String instrumentId,

    @NotBlank
    @Schema(description = "Candle timeframe", example = "1m")
    String timeframe,

    @NotBlank
    @Schema(description = "Strategy identifier from the catalog", example = "ChannelBreakout")
    String strategyId,

    @Schema(description = "Strategy parameters", example = "{\"length\": 10}")
    Map<String, Object> parameters
) {
}
