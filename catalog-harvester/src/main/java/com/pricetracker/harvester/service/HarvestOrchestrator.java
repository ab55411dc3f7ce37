package com.pricetracker.harvester.service;

import com.pricetracker.harvester.config.HarvesterProperties;
import com.pricetracker.harvester.error.HarvestCancelledException;
import com.pricetracker.harvester.model.CategoryResult;
import com.pricetracker.harvester.model.CategorySource;
import com.pricetracker.harvester.model.HarvestSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans one {@link CategoryPipeline} per category out over a fixed worker pool and
 * gathers the results once every worker has finished or the run deadline has passed.
 *
 * Workers share nothing but the progress counter. Results are collected here, on the
 * calling thread, in configuration order.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HarvestOrchestrator {

    private final CategoryPipeline categoryPipeline;
    private final HarvesterProperties properties;

    private volatile HarvestProgress currentProgress;

    public HarvestSnapshot harvest(List<CategorySource> sources) {
        if (sources.isEmpty()) {
            log.warn("No categories configured");
            return new HarvestSnapshot(List.of());
        }

        int workers = Math.max(1, Math.min(properties.getWorkers(), sources.size()));
        Duration timeout = properties.getRunTimeout();
        HarvestProgress progress = new HarvestProgress(sources.size());
        currentProgress = progress;

        log.info("Harvesting {} categories with {} workers (deadline {})", sources.size(), workers, timeout);

        ExecutorService executor = Executors.newFixedThreadPool(workers, workerThreadFactory());
        try {
            List<Future<CategoryResult>> futures = new ArrayList<>(sources.size());
            for (CategorySource source : sources) {
                futures.add(executor.submit(() -> runTracked(source, progress)));
            }

            long deadline = System.nanoTime() + timeout.toNanos();
            List<CategoryResult> results = new ArrayList<>(sources.size());
            for (int i = 0; i < sources.size(); i++) {
                results.add(await(sources.get(i), futures.get(i), deadline, timeout));
            }
            return new HarvestSnapshot(results);

        } finally {
            executor.shutdownNow();
        }
    }

    public Optional<HarvestProgress> currentProgress() {
        return Optional.ofNullable(currentProgress);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private CategoryResult runTracked(CategorySource source, HarvestProgress progress) {
        CategoryResult result = null;
        try {
            result = categoryPipeline.run(source);
            return result;
        } finally {
            progress.complete(source, result);
        }
    }

    private CategoryResult await(CategorySource source, Future<CategoryResult> future, long deadline, Duration timeout) {
        try {
            long remaining = Math.max(0, deadline - System.nanoTime());
            return future.get(remaining, TimeUnit.NANOSECONDS);

        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Category '{}' ({}) did not finish within {}", source.categoryName(), source.entryUrl(), timeout);
            return CategoryResult.failed(source, "Timed out after " + timeout);

        } catch (CancellationException e) {
            return CategoryResult.failed(source, "Cancelled");

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Category '{}' ({}) failed unexpectedly: {}",
                    source.categoryName(), source.entryUrl(), cause.getMessage(), cause);
            return CategoryResult.failed(source, cause.toString());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HarvestCancelledException("Harvest interrupted while waiting for '" + source.categoryName() + "'", e);
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable, "harvest-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
