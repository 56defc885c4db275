package com.fintech.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for API documentation.
 *
 * Access the interactive API documentation at:
 * - Swagger UI: http://localhost:8080/swagger-ui/index.html
 * - OpenAPI JSON: http://localhost:8080/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI marketAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Market Anomaly Service API")
                        .description("""
                                Read-only access to detected market anomalies and stored OHLCV bars.

                                **Features:**
                                - Price, volume and volatility z-scores against a rolling window
                                - Weighted composite anomaly score
                                - Volume-ranked instrument universe
                                - Bounded bar store with age and size retention
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:8080")
                                .description("Local Development Server")
                ));
    }
}
