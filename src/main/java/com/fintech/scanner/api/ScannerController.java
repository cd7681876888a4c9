package com.fintech.scanner.api;

import com.fintech.scanner.scanner.MinuteCycleScanner;
import com.fintech.scanner.scanner.ScannerStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Monitoring and lifecycle control of the minute cycle.
 */
@RestController
@RequestMapping("/api/v1/scanner")
@Tag(name = "Scanner", description = "Scanner status and lifecycle")
public class ScannerController {

    private static final Logger log = LoggerFactory.getLogger(ScannerController.class);

    private final MinuteCycleScanner scanner;

    public ScannerController(MinuteCycleScanner scanner) {
        this.scanner = scanner;
    }

    @Operation(summary = "Get scanner status")
    @GetMapping("/status")
    public ResponseEntity<ScannerStatus> getStatus() {
        return ResponseEntity.ok(scanner.status());
    }

    @Operation(summary = "Start the minute cycle", description = "Idempotent; returns the status after the call.")
    @PostMapping("/start")
    public ResponseEntity<ScannerStatus> start() {
        boolean changed = scanner.start();
        log.info("Start requested via API: changed={}", changed);
        return ResponseEntity.ok(scanner.status());
    }

    @Operation(summary = "Stop the minute cycle", description = "Idempotent; returns the status after the call.")
    @PostMapping("/stop")
    public ResponseEntity<ScannerStatus> stop() {
        boolean changed = scanner.stop();
        log.info("Stop requested via API: changed={}", changed);
        return ResponseEntity.ok(scanner.status());
    }
}
