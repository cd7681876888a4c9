package com.fintech.scanner.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.PositiveOrZero;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Change-polling endpoint. Clients send the timestamp of the last update they saw and get
 * either a newer update or 304 Not Modified.
 */
@RestController
@RequestMapping("/api")
@ConditionalOnProperty(name = "scanner.delivery.polling.enabled", havingValue = "true", matchIfMissing = true)
@Tag(name = "Best Performers", description = "Per-minute best performing symbols")
public class UpdatesController {

    private static final Logger log = LoggerFactory.getLogger(UpdatesController.class);

    private final LatestUpdateStore updateStore;

    public UpdatesController(LatestUpdateStore updateStore) {
        this.updateStore = updateStore;
    }

    /**
     * GET /api/updates?lastUpdate={epochMillis}
     */
    @Operation(summary = "Poll for a newer best performer")
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "A result newer than lastUpdate",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = UpdateResponse.class))
        ),
        @ApiResponse(responseCode = "304", description = "Nothing newer than lastUpdate"),
        @ApiResponse(
            responseCode = "400",
            description = "lastUpdate is not a non-negative number",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    @GetMapping("/updates")
    public ResponseEntity<UpdateResponse> getUpdates(
            @Parameter(description = "Timestamp (epoch millis) of the last update seen; 0 for none", example = "0")
            @RequestParam(defaultValue = "0")
            @PositiveOrZero(message = "lastUpdate cannot be negative")
            long lastUpdate) {

        return updateStore.newerThan(lastUpdate)
            .map(ResponseEntity::ok)
            .orElseGet(() -> {
                log.trace("No update newer than {}", lastUpdate);
                return ResponseEntity.status(HttpStatus.NOT_MODIFIED).build();
            });
    }
}
