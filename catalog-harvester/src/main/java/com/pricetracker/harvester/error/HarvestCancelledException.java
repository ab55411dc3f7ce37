package com.pricetracker.harvester.error;

/**
 * The worker was interrupted, either by the run deadline or by shutdown.
 */
public class HarvestCancelledException extends HarvestException {

    public HarvestCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
