package com.pricetracker.harvester.error;

/**
 * A response arrived but lacks a field or structure the pipeline depends on.
 */
public class PayloadParseException extends HarvestException {

    public PayloadParseException(String message) {
        super(message);
    }

    public PayloadParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
