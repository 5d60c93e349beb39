package com.fintech.strategyengine.api;

import com.fintech.strategyengine.ingestion.DisruptorTickPublisher;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP entry point for market data, for feeds that cannot publish in-process.
 */
@RestController
@RequestMapping("/api/v1/ticks")
@Tag(name = "Market Data", description = "Tick ingestion")
public class TickController {

    private final DisruptorTickPublisher publisher;

    public TickController(DisruptorTickPublisher publisher) {
        this.publisher = publisher;
    }

    @Operation(summary = "Publish a tick to the aggregation channel")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "202", description = "Tick queued"),
        @ApiResponse(responseCode = "503", description = "Tick channel full, tick dropped")
    })
    @PostMapping
    public ResponseEntity<Void> publish(@Valid @RequestBody TickRequest request) {
        boolean accepted = publisher.tryPublish(request.toTick());
        return accepted
            ? ResponseEntity.status(HttpStatus.ACCEPTED).build()
            : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
    }
}
