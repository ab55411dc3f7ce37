package com.pricetracker.harvester.error;

/**
 * A catalog write failed and the run's transaction was rolled back.
 */
public class CatalogWriteException extends HarvestException {

    public CatalogWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
