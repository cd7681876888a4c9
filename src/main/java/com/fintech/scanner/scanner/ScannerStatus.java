package com.fintech.scanner.scanner;

import com.fintech.scanner.domain.PerformerEvent;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

/**
 * Point-in-time view of the scanner for monitoring.
 */
@Schema(description = "Scanner state and per-minute progress")
public record ScannerStatus(
    @Schema(example = "RUNNING") ScannerState state,
    @Schema(description = "Start of the minute being accumulated") Instant currentMinute,
    @Schema(description = "True if a fetch failed during the current minute") boolean hasError,
    @Schema(description = "Symbols with a score in the current window", example = "412") int scoredSymbols,
    @Schema(description = "Symbols holding price history", example = "431") int trackedSymbols,
    @Schema(description = "Price samples held in history", example = "51720") long storedSamples,
    @Schema(description = "Ticks dropped because the previous tick was still running", example = "0") long ticksDropped,
    @Schema(description = "Most recently published result, if any") PerformerEvent lastPublished
) {
}
