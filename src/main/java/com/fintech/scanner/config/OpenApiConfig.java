package com.fintech.scanner.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for API documentation.
 *
 * Access the interactive API documentation at:
 * - Swagger UI: http://localhost:3000/swagger-ui/index.html
 * - OpenAPI JSON: http://localhost:3000/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI volatilityScannerOpenAPI(@Value("${server.port:3000}") int port) {
        return new OpenAPI()
                .info(new Info()
                        .title("Volatility Scanner API")
                        .description("""
                                Per-minute best performer of Bybit USDT linear perpetuals.

                                **How a result is produced:**
                                - Prices sampled once per second (seconds 1-58 of each minute)
                                - Volatility = summed absolute moves / average price over the trailing 60s, in percent
                                - Winner picked at second 59 among symbols with at least $10M 24h turnover
                                - Minutes with any failed fetch publish nothing
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + port)
                                .description("Local Development Server")
                ));
    }
}
