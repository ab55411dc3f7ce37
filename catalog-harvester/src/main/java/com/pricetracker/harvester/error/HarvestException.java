package com.pricetracker.harvester.error;

/**
 * Base type for every failure the harvester reports on purpose.
 */
public class HarvestException extends RuntimeException {

    public HarvestException(String message) {
        super(message);
    }

    public HarvestException(String message, Throwable cause) {
        super(message, cause);
    }
}
