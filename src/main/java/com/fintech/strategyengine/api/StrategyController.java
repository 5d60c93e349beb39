package com.fintech.strategyengine.api;

import com.fintech.strategyengine.dispatch.StrategyBindingService;
import com.fintech.strategyengine.domain.StrategyRegistration;
import com.fintech.strategyengine.domain.Timeframe;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST API for adding and stopping strategy bindings.
 */
@RestController
@RequestMapping("/api/v1/strategies")
@Tag(name = "Strategies", description = "Strategy bindings per instrument and timeframe")
public class StrategyController {

    private static final Logger log = LoggerFactory.getLogger(StrategyController.class);

    private final StrategyBindingService bindingService;

    public StrategyController(StrategyBindingService bindingService) {
        this.bindingService = bindingService;
    }

    @Operation(
        summary = "Add or replace a strategy binding",
        description = """
            Binds a strategy to an (instrument, timeframe) series. A new series is seeded from
            history before it accepts live ticks; an existing binding for the same key is replaced.
            """
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "201", description = "Binding active"),
        @ApiResponse(responseCode = "400", description = "Malformed request or unsupported timeframe")
    })
    @PostMapping
    public ResponseEntity<StrategyResponse> add(@Valid @RequestBody StrategyRequest request) {
        log.debug("Add strategy request: {}", request);
        StrategyRegistration registration = bindingService.add(
            request.instrumentId(),
            request.timeframe(),
            request.strategyId(),
            request.parameters()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(StrategyResponse.from(registration));
    }

    @Operation(summary = "List strategy bindings")
    @GetMapping
    public List<StrategyResponse> list() {
        return bindingService.list().stream()
            .map(StrategyResponse::from)
            .collect(Collectors.toList());
    }

    @Operation(summary = "Stop the strategy for one instrument and timeframe")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "204", description = "Strategy stopped"),
        @ApiResponse(responseCode = "404", description = "No strategy bound to that key")
    })
    @DeleteMapping("/{instrumentId}/{timeframe}")
    public ResponseEntity<Void> remove(@PathVariable String instrumentId, @PathVariable String timeframe) {
        boolean removed = bindingService.remove(instrumentId, Timeframe.fromCode(timeframe));
        return removed ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    @Operation(summary = "Stop every strategy")
    @DeleteMapping
    public ResponseEntity<Void> removeAll() {
        bindingService.removeAll();
        return ResponseEntity.noContent().build();
    }
}
