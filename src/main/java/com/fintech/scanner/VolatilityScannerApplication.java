package com.fintech.scanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Volatility Scanner Service
 *
 * Samples Bybit linear perpetual tickers once per second and, at the end of
 * every minute, publishes the most volatile USDT pair that clears a liquidity floor.
 *
 * Key Features:
 * - Minute-aligned reset / accumulate / finalize cycle driven by the wall clock
 * - Rolling per-symbol price history with age-based pruning
 * - Normalized-movement volatility score with an epsilon tie-break on turnover
 * - Pluggable delivery: 24h history query and change-polling endpoints
 * - Prometheus metrics via actuator
 *
 * @since 1.0.0
 */
@SpringBootApplication
@EnableScheduling
public class VolatilityScannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(VolatilityScannerApplication.class, args);
    }
}
