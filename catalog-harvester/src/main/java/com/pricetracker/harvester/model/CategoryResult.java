package com.pricetracker.harvester.model;

import java.util.List;

/**
 * Outcome of one category pipeline. Exactly one per configured category per run.
 */
public record CategoryResult(CategorySource source, Status status, List<ProductRecord> records, String error) {

    public enum Status {
        SUCCESS, SKIPPED, FAILED
    }

    public CategoryResult {
        records = records == null ? List.of() : List.copyOf(records);
    }

    public static CategoryResult success(CategorySource source, List<ProductRecord> records) {
        return new CategoryResult(source, Status.SUCCESS, records, null);
    }

    public static CategoryResult skipped(CategorySource source, String reason) {
        return new CategoryResult(source, Status.SKIPPED, List.of(), reason);
    }

    public static CategoryResult failed(CategorySource source, String error) {
        return new CategoryResult(source, Status.FAILED, List.of(), error);
    }
}
