package com.fintech.scanner.aggregation;

import com.fintech.scanner.config.ScannerProperties;
import com.fintech.scanner.domain.PriceSample;
import com.fintech.scanner.storage.PriceHistoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Converts each symbol's recent samples into a volatility score.
 *
 * <pre>
 * totalMovement = Σ |price[i] − price[i−1]|
 * avgPrice      = mean(price)
 * score         = totalMovement / avgPrice × 100
 * </pre>
 *
 * Scores are recomputed from scratch on every call: the returned map reflects exactly the
 * current window.
 */
@Component
public class VolatilityEstimator {

    private static final Logger log = LoggerFactory.getLogger(VolatilityEstimator.class);

    private final PriceHistoryStore historyStore;
    private final Duration window;

    public VolatilityEstimator(PriceHistoryStore historyStore, ScannerProperties properties) {
        this.historyStore = historyStore;
        this.window = properties.getVolatility().getWindow();
    }

    /**
     * Scores every symbol with at least two samples in the trailing window.
     * Symbols with fewer samples get no entry rather than a zero.
     *
     * @param now Instant of the tick performing the computation
     * @return Fresh map of symbol to score
     */
    public Map<String, Double> estimate(Instant now) {
        Map<String, Double> scores = new HashMap<>();
        for (String symbol : historyStore.symbols()) {
            List<PriceSample> samples = historyStore.windowed(symbol, window, now);
            score(samples).ifPresent(score -> scores.put(symbol, score));
        }
        log.trace("Estimated volatility for {} symbols at {}", scores.size(), now);
        return scores;
    }

    /**
     * Computes the score for samples already in time order.
     *
     * @return Empty if fewer than two samples, the average price is not positive or the score is not finite
     */
    static OptionalDouble score(List<PriceSample> samples) {
        if (samples.size() < 2) {
            return OptionalDouble.empty();
        }

        double totalMovement = 0.0;
        double sum = samples.get(0).price();
        for (int i = 1; i < samples.size(); i++) {
            double price = samples.get(i).price();
            totalMovement += Math.abs(price - samples.get(i - 1).price());
            sum += price;
        }

        double averagePrice = sum / samples.size();
        if (!(averagePrice > 0)) {
            return OptionalDouble.empty();
        }
        double score = totalMovement / averagePrice * 100;
        return Double.isFinite(score) ? OptionalDouble.of(score) : OptionalDouble.empty();
    }
}
