package com.pricetracker.harvester.service;

/**
 * Pause taken between two consecutive API page requests of one category.
 */
@FunctionalInterface
public interface PacingPolicy {

    void pause();

    static PacingPolicy none() {
        return () -> { };
    }
}
