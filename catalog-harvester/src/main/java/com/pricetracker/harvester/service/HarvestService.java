package com.pricetracker.harvester.service;

import com.pricetracker.harvester.config.HarvesterProperties;
import com.pricetracker.harvester.error.HarvestException;
import com.pricetracker.harvester.model.CategoryResult;
import com.pricetracker.harvester.model.CategorySource;
import com.pricetracker.harvester.model.HarvestRun;
import com.pricetracker.harvester.model.HarvestSnapshot;
import com.pricetracker.harvester.model.ProductRecord;
import com.pricetracker.harvester.output.CatalogWriter;
import com.pricetracker.harvester.output.OutputRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one harvest end to end: fan out over the configured categories, then reconcile
 * the snapshot with storage. A run never throws; its outcome is in the returned
 * {@link HarvestRun}, which is also recorded in harvest_runs.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HarvestService {

    private final HarvestOrchestrator orchestrator;
    private final OutputRouter outputRouter;
    private final HarvesterProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile HarvestRun lastRun;

    /**
     * @return the finished run, or empty when another run was already in progress
     */
    public Optional<HarvestRun> runHarvest() {
        if (!running.compareAndSet(false, true)) {
            log.warn("A harvest run is already in progress, ignoring trigger");
            return Optional.empty();
        }
        try {
            HarvestRun run = harvest();
            lastRun = run;
            return Optional.of(run);
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public Optional<HarvestRun> getLastRun() {
        return Optional.ofNullable(lastRun);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private HarvestRun harvest() {
        HarvestRun run = HarvestRun.builder()
                .runId(UUID.randomUUID().toString())
                .startedAt(LocalDateTime.now())
                .status(HarvestRun.Status.RUNNING)
                .build();

        log.info("Starting harvest run {} at {}", run.getRunId(), run.getStartedAt());

        try {
            List<CategorySource> sources = properties.categorySources();
            run.setCategoriesTotal(sources.size());

            HarvestSnapshot snapshot = orchestrator.harvest(sources);
            run.setCategoriesSucceeded((int) snapshot.count(CategoryResult.Status.SUCCESS));
            run.setCategoriesSkipped((int) snapshot.count(CategoryResult.Status.SKIPPED));
            run.setCategoriesFailed((int) snapshot.count(CategoryResult.Status.FAILED));

            List<ProductRecord> records = snapshot.records();
            run.setRecordsFound(records.size());

            if (records.isEmpty()) {
                log.warn("No data collected in run {}, nothing written", run.getRunId());
                run.setStatus(HarvestRun.Status.EMPTY);
                return run;
            }

            LocalDateTime observedAt = LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS);
            CatalogWriter.WriteResult written = outputRouter.write(records, observedAt);
            run.setProductsWritten(written.productsUpserted());
            run.setObservationsWritten(written.observationsInserted());
            run.setStatus(HarvestRun.Status.SUCCESS);

        } catch (HarvestException e) {
            log.error("Harvest run {} failed: {}", run.getRunId(), e.getMessage(), e);
            run.setStatus(HarvestRun.Status.FAILED);
            run.setErrorMessage(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Harvest run {} failed unexpectedly", run.getRunId(), e);
            run.setStatus(HarvestRun.Status.FAILED);
            run.setErrorMessage(e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            run.setCompletedAt(LocalDateTime.now());
            outputRouter.writeHarvestRun(run);
        }

        log.info("Harvest run {} finished {} in {} ({}/{} categories ok, {} skipped, {} failed, {} records)",
                run.getRunId(), run.getStatus(), Duration.between(run.getStartedAt(), run.getCompletedAt()),
                run.getCategoriesSucceeded(), run.getCategoriesTotal(), run.getCategoriesSkipped(),
                run.getCategoriesFailed(), run.getRecordsFound());
        return run;
    }
}
