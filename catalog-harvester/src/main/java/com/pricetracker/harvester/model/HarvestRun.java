package com.pricetracker.harvester.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Tracks each harvest run for observability.
 * Stored in the harvest_runs table, outside the catalog transaction.
 */
@Data
@Builder
public class HarvestRun {

    private String runId;           // UUID
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private Status status;
    private int categoriesTotal;
    private int categoriesSucceeded;
    private int categoriesSkipped;
    private int categoriesFailed;
    private int recordsFound;
    private int productsWritten;
    private int observationsWritten;
    private String errorMessage;    // null on success

    public enum Status {
        RUNNING, SUCCESS, EMPTY, FAILED
    }
}
