package com.fintech.strategyengine.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for API documentation.
 *
 * - Swagger UI: http://localhost:8080/swagger-ui/index.html
 * - OpenAPI JSON: http://localhost:8080/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI strategyEngineOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Candle Strategy Engine API")
                        .description("""
                                Multi-timeframe candle aggregation with per-candle strategy dispatch.

                                **Features:**
                                - Timeframes: 1m, 3m, 5m, 15m, 30m, 1h, 1d
                                - Strategy bindings per (instrument, timeframe)
                                - One-time history backfill per new series
                                - Late ticks dropped and counted, never applied
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:8080")
                                .description("Local Development Server")
                ));
    }
}
