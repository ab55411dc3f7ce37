package com.pricetracker.harvester.scheduler;

import com.pricetracker.harvester.config.HarvesterProperties;
import com.pricetracker.harvester.output.CatalogWriter;
import com.pricetracker.harvester.service.HarvestService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup harvesting.
 *
 * Default schedule: every day at 03:00 UTC.
 * Override with CRON env var or harvester.scheduling.cron property.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class HarvestScheduler {

    private final HarvestService harvestService;
    private final CatalogWriter catalogWriter;
    private final HarvesterProperties properties;

    /**
     * The schema must exist before the dashboard or the first run touches the database.
     */
    @PostConstruct
    public void ensureSchema() {
        catalogWriter.ensureSchema();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (properties.getScheduling().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, harvesting {} categories now", properties.getCategories().size());
            try {
                harvestService.runHarvest();
            } catch (Exception e) {
                log.error("Startup harvest failed: {}", e.getMessage(), e);
            }
        } else {
            log.info("Harvester ready. Next scheduled run: {}", properties.getScheduling().getCron());
        }
    }

    @Scheduled(cron = "${harvester.scheduling.cron:0 0 3 * * ?}", zone = "UTC")
    public void scheduledHarvest() {
        log.info("Scheduled harvest triggered");
        try {
            harvestService.runHarvest();
        } catch (Exception e) {
            log.error("Scheduled harvest failed: {}", e.getMessage(), e);
        }
    }
}
