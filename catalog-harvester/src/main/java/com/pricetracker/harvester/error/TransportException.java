package com.pricetracker.harvester.error;

/**
 * Network or HTTP-level failure. The only failure the transport retry policy retries.
 */
public class TransportException extends HarvestException {

    private final int statusCode;

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public TransportException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /** HTTP status, or -1 when no response was received */
    public int getStatusCode() {
        return statusCode;
    }
}
