package com.fintech.scanner.api;

import com.fintech.scanner.domain.PerformerEvent;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;

/**
 * Latest result as served to change-polling clients.
 *
 * @param timestamp Strictly increasing epoch millis; clients echo it back as {@code lastUpdate}
 */
@Schema(description = "Latest best performer with its update timestamp")
public record UpdateResponse(
    @Schema(example = "PEPEUSDT") String symbol,
    @Schema(example = "312") int moves,
    @Schema(description = "24h turnover in millions", example = "48.27") BigDecimal turnover,
    @Schema(description = "Funding rate in percent", example = "0.0100") BigDecimal fundingRate,
    @Schema(description = "Update timestamp in epoch millis", example = "1733740259123") long timestamp
) {

    public static UpdateResponse of(PerformerEvent event, long timestamp) {
        return new UpdateResponse(event.symbol(), event.moves(), event.turnover(), event.fundingRate(), timestamp);
    }
}
