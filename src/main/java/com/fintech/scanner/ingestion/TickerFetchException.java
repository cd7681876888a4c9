package com.fintech.scanner.ingestion;

/**
 * Raised by a {@link MarketDataClient} when a snapshot cannot be obtained.
 */
public class TickerFetchException extends RuntimeException {

    private final ErrorKind kind;

    public TickerFetchException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TickerFetchException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
