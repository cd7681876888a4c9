package com.fintech.scanner.api;

import com.fintech.scanner.domain.PerformerEvent;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One published minute as exposed by the history endpoint.
 */
@Schema(description = "Best performer of one minute")
public record SymbolEntry(
    @Schema(example = "PEPEUSDT") String symbol,
    @Schema(example = "312") int moves,
    @Schema(description = "24h turnover in millions", example = "48.27") BigDecimal turnover,
    @Schema(description = "Funding rate in percent", example = "0.0100") BigDecimal fundingRate,
    @Schema(description = "When the entry was received", example = "2025-12-09T10:30:59Z") Instant timestamp
) {

    public static SymbolEntry of(PerformerEvent event, Instant receivedAt) {
        return new SymbolEntry(event.symbol(), event.moves(), event.turnover(), event.fundingRate(), receivedAt);
    }
}
