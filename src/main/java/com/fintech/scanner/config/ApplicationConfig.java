package com.fintech.scanner.config;

import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring configuration for core application beans.
 */
@Configuration
public class ApplicationConfig {

    /**
     * Wall clock driving the minute cycle. UTC keeps second-of-minute independent of host zone.
     */
    @Bean
    public Clock scannerClock() {
        return Clock.systemUTC();
    }

    @Bean
    public OkHttpClient marketDataHttpClient(ScannerProperties properties) {
        ScannerProperties.MarketData marketData = properties.getMarketData();
        return new OkHttpClient.Builder()
            .connectTimeout(marketData.getConnectTimeout())
            .readTimeout(marketData.getReadTimeout())
            .build();
    }
}
