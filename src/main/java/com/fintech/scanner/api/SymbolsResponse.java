package com.fintech.scanner.api;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Current best performer plus the retained history, newest first.
 */
@Schema(description = "Current result and recent history")
public record SymbolsResponse(
    @Schema(description = "Latest published result, null before the first one") SymbolEntry current,
    @Schema(description = "Published results within the retention window, newest first") List<SymbolEntry> history
) {
}
