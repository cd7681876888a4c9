package com.fintech.scanner.aggregation;

import com.fintech.scanner.config.ScannerProperties;
import com.fintech.scanner.domain.PerformerResult;
import com.fintech.scanner.domain.VolatilityScore;
import com.fintech.scanner.storage.PriceHistoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Picks the single best performer of a minute.
 *
 * Ranking:
 * <ol>
 *   <li>Drop symbols with a non-finite score or turnover, and those below the liquidity floor.</li>
 *   <li>Every candidate within {@code tieEpsilon} of the top score is tied with it.</li>
 *   <li>Among tied candidates the highest turnover wins; then higher score, then symbol name.</li>
 * </ol>
 * The tie group is anchored on the top score so the pick never depends on map iteration order.
 */
@Component
public class PerformerSelector {

    private static final Logger log = LoggerFactory.getLogger(PerformerSelector.class);

    private final PriceHistoryStore historyStore;
    private final double minTurnover;
    private final double tieEpsilon;

    public PerformerSelector(PriceHistoryStore historyStore, ScannerProperties properties) {
        this.historyStore = historyStore;
        this.minTurnover = properties.getSelection().getMinTurnover();
        this.tieEpsilon = properties.getSelection().getTieEpsilon();
    }

    /**
     * Selects using the turnover recorded in the history store.
     */
    public PerformerResult select(Map<String, Double> scores, boolean hasError) {
        return select(scores, historyStore::latestVolume, hasError);
    }

    /**
     * Selects the winner. Never throws; "no qualifying symbol" is a regular result.
     *
     * @param scores Current score map
     * @param volumeOf 24h turnover lookup per symbol
     * @param hasError Sticky error flag inherited from the minute
     */
    public PerformerResult select(Map<String, Double> scores, ToDoubleFunction<String> volumeOf, boolean hasError) {
        List<Candidate> candidates = new ArrayList<>();
        for (Map.Entry<String, Double> entry : scores.entrySet()) {
            if (entry.getValue() == null || !Double.isFinite(entry.getValue())) {
                continue;
            }
            double volume = volumeOf.applyAsDouble(entry.getKey());
            if (Double.isFinite(volume) && volume >= minTurnover) {
                candidates.add(new Candidate(new VolatilityScore(entry.getKey(), entry.getValue()), volume));
            }
        }

        if (candidates.isEmpty()) {
            log.debug("No symbol passed the turnover floor of {} ({} scored)", minTurnover, scores.size());
            return PerformerResult.noWinner(hasError);
        }

        double topScore = candidates.stream()
            .mapToDouble(c -> c.score().score())
            .max()
            .getAsDouble();

        Candidate best = candidates.stream()
            .filter(c -> topScore - c.score().score() <= tieEpsilon)
            .min(Comparator.comparingDouble(Candidate::volume).reversed()
                .thenComparing(Comparator.comparingDouble((Candidate c) -> c.score().score()).reversed())
                .thenComparing(c -> c.score().symbol()))
            .orElseThrow();

        log.debug("Selected {} score={} volume={} among {} candidates",
            best.score().symbol(), best.score().score(), best.volume(), candidates.size());
        return PerformerResult.winner(best.score(), best.volume(), hasError);
    }

    private record Candidate(VolatilityScore score, double volume) {
    }
}
