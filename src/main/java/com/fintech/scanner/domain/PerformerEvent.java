package com.fintech.scanner.domain;

import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Objects;

/**
 * Finalized per-minute result handed to delivery consumers.
 *
 * @param symbol Winning symbol
 * @param moves Integer-scaled volatility score
 * @param turnover 24h turnover in millions, 2 decimals
 * @param fundingRate Funding rate in percent, 4 decimals
 * @param minute Start of the minute the result belongs to
 * @param publishedAt Instant the scanner finalized the minute
 */
@Schema(description = "Best performer of one minute")
public record PerformerEvent(
    @Schema(example = "PEPEUSDT") String symbol,
    @Schema(example = "312") int moves,
    @Schema(description = "24h turnover in millions", example = "48.27") BigDecimal turnover,
    @Schema(description = "Funding rate in percent", example = "0.0100") BigDecimal fundingRate,
    Instant minute,
    Instant publishedAt
) {

    private static final BigDecimal ONE_MILLION = BigDecimal.valueOf(1_000_000L);
    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100L);

    public PerformerEvent {
        Objects.requireNonNull(symbol, "symbol cannot be null");
        Objects.requireNonNull(minute, "minute cannot be null");
        Objects.requireNonNull(publishedAt, "publishedAt cannot be null");
    }

    /**
     * Builds the published payload from a finalized result.
     *
     * @throws IllegalArgumentException if the result has no winner
     */
    public static PerformerEvent from(PerformerResult result, Instant minute, Instant publishedAt) {
        if (!result.hasWinner()) {
            throw new IllegalArgumentException("Cannot publish a minute without a winner");
        }
        return new PerformerEvent(
            result.symbol(),
            result.moves(),
            toMillions(result.turnover()),
            toPercent(result.fundingRate()),
            minute,
            publishedAt
        );
    }

    static BigDecimal toMillions(double turnover) {
        return BigDecimal.valueOf(turnover).divide(ONE_MILLION).setScale(2, RoundingMode.HALF_UP);
    }

    static BigDecimal toPercent(double fundingRate) {
        return BigDecimal.valueOf(fundingRate).multiply(ONE_HUNDRED).setScale(4, RoundingMode.HALF_UP);
    }
}
