package com.fintech.strategyengine.api;

import com.fintech.strategyengine.domain.Tick;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Request body for pushing one tick into the engine.
 */
@Schema(description = "Last traded price update")
public record TickRequest(

    @NotBlank
    @Schema(description = "Instrument token", example = "3045")
    String instrumentId,

    @Positive
    @Schema(description = "Last traded price", example = "601.45")
    double price,

    @Positive
    @Schema(description = "Exchange timestamp, epoch millis", example = "1733529420000")
    long eventTime
) {

    public Tick toTick() {
        return new Tick(instrumentId, price, eventTime);
    }
}
