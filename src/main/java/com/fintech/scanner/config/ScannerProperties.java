package com.fintech.scanner.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Externalized configuration for the volatility scanner.
 * Maps to 'scanner.*' properties in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "scanner")
public class ScannerProperties {

    private MarketData marketData = new MarketData();
    private Volatility volatility = new Volatility();
    private Selection selection = new Selection();
    private Cycle cycle = new Cycle();
    private Delivery delivery = new Delivery();

    @Data
    public static class MarketData {
        private String baseUrl = "https://api.bybit.com";
        private String tickersPath = "/v5/market/tickers";
        private String category = "linear";
        private String quoteSuffix = "USDT";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Volatility {
        /** Trailing window a sample must fall into to be scored. */
        private Duration window = Duration.ofSeconds(60);
        /** Samples older than this are pruned from history. */
        private Duration retention = Duration.ofSeconds(120);
    }

    @Data
    public static class Selection {
        /** Liquidity floor on 24h turnover, in quote currency units. */
        private double minTurnover = 10_000_000d;
        /** Absolute score difference (percentage points) treated as a tie. */
        private double tieEpsilon = 0.0001;
    }

    @Data
    public static class Cycle {
        private boolean autoStart = true;
        private String cron = "* * * * * *";
        private boolean refreshOnFinalize = false;
    }

    @Data
    public static class Delivery {
        private History history = new History();
        private Polling polling = new Polling();

        @Data
        public static class History {
            private boolean enabled = true;
            private Duration retention = Duration.ofHours(24);
        }

        @Data
        public static class Polling {
            private boolean enabled = true;
        }
    }
}
