package com.fintech.scanner.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Query endpoint for the current best performer and the retained history.
 */
@RestController
@RequestMapping("/api")
@ConditionalOnProperty(name = "scanner.delivery.history.enabled", havingValue = "true", matchIfMissing = true)
@Tag(name = "Best Performers", description = "Per-minute best performing symbols")
public class SymbolsController {

    private final SymbolHistoryStore historyStore;

    public SymbolsController(SymbolHistoryStore historyStore) {
        this.historyStore = historyStore;
    }

    /**
     * GET /api/symbols
     */
    @Operation(
        summary = "Get current best performer and history",
        description = "Returns the latest published minute and every published minute within the retention window (24h by default), newest first."
    )
    @ApiResponse(
        responseCode = "200",
        description = "Current result and history",
        content = @Content(
            mediaType = "application/json",
            schema = @Schema(implementation = SymbolsResponse.class),
            examples = @ExampleObject(
                name = "Sample Response",
                value = """
                    {
                      "current": {"symbol": "PEPEUSDT", "moves": 312, "turnover": 48.27, "fundingRate": 0.0100, "timestamp": "2025-12-09T10:30:59Z"},
                      "history": [
                        {"symbol": "PEPEUSDT", "moves": 312, "turnover": 48.27, "fundingRate": 0.0100, "timestamp": "2025-12-09T10:30:59Z"},
                        {"symbol": "WIFUSDT", "moves": 287, "turnover": 131.02, "fundingRate": -0.0051, "timestamp": "2025-12-09T10:29:59Z"}
                      ]
                    }
                    """
            )
        )
    )
    @GetMapping("/symbols")
    public ResponseEntity<SymbolsResponse> getSymbols() {
        return ResponseEntity.ok(historyStore.snapshot());
    }
}
