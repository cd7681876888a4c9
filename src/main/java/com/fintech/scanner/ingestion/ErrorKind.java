package com.fintech.scanner.ingestion;

/**
 * Classification of a failed ticker fetch. All kinds are handled identically
 * (the minute is marked as errored); the distinction is for diagnostics only.
 */
public enum ErrorKind {

    /** Connect or read timeout. */
    TIMEOUT(true),

    /** Peer reset the connection. */
    CONNECTION_RESET(true),

    /** Non-2xx HTTP status or a non-zero exchange return code. */
    HTTP_ERROR(false),

    /** Body missing required fields or holding unparseable values. */
    MALFORMED_RESPONSE(false),

    /** Any other I/O failure. */
    GENERIC(false);

    private final boolean transport;

    ErrorKind(boolean transport) {
        this.transport = transport;
    }

    /** Returns true for transport-level failures (timeout, reset). */
    public boolean isTransport() {
        return transport;
    }
}
