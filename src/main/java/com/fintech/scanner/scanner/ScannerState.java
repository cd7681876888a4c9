package com.fintech.scanner.scanner;

/**
 * Lifecycle of the minute cycle. RUNNING ends only on an explicit stop.
 */
public enum ScannerState {
    IDLE,
    RUNNING
}
