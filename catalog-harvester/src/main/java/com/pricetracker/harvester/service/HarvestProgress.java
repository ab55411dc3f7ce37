package com.pricetracker.harvester.service;

import com.pricetracker.harvester.model.CategoryResult;
import com.pricetracker.harvester.model.CategorySource;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Completed-category counter for one run. Safe to update from any worker thread.
 */
@Slf4j
public class HarvestProgress {

    private final int total;
    private final AtomicInteger completed = new AtomicInteger(0);

    public HarvestProgress(int total) {
        this.total = total;
    }

    /**
     * @param result null when the pipeline died with an unexpected exception
     */
    public void complete(CategorySource source, CategoryResult result) {
        int done = completed.incrementAndGet();
        String outcome = result == null ? "FAILED" : result.status().name();
        int records = result == null ? 0 : result.records().size();
        log.info("Categories completed: {}/{} ('{}' {}, {} records)",
                done, total, source.categoryName(), outcome, records);
    }

    public int getCompleted() {
        return completed.get();
    }

    public int getTotal() {
        return total;
    }

    public boolean isFinished() {
        return completed.get() >= total;
    }
}
