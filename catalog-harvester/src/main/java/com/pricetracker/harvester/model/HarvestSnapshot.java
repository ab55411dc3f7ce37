package com.pricetracker.harvester.model;

import java.util.List;

/**
 * Everything one run collected, in memory between fan-in and persistence.
 */
public record HarvestSnapshot(List<CategoryResult> results) {

    public HarvestSnapshot {
        results = List.copyOf(results);
    }

    public List<ProductRecord> records() {
        return results.stream()
                .filter(r -> r.status() == CategoryResult.Status.SUCCESS)
                .flatMap(r -> r.records().stream())
                .toList();
    }

    public boolean isEmpty() {
        return records().isEmpty();
    }

    public long count(CategoryResult.Status status) {
        return results.stream().filter(r -> r.status() == status).count();
    }
}
