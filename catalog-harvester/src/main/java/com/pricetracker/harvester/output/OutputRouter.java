package com.pricetracker.harvester.output;

import com.pricetracker.harvester.config.HarvesterProperties;
import com.pricetracker.harvester.error.HarvestException;
import com.pricetracker.harvester.model.HarvestRun;
import com.pricetracker.harvester.model.ProductRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Routes a run's snapshot to the configured sink(s): DATABASE, CSV or BOTH.
 * In BOTH mode the CSV export happens after the catalog commit and its failure
 * does not fail the run.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OutputRouter {

    private final CatalogWriter catalogWriter;
    private final CsvWriter csvWriter;
    private final HarvesterProperties properties;

    public CatalogWriter.WriteResult write(List<ProductRecord> records, LocalDateTime observedAt) {
        HarvesterProperties.Output.OutputMode mode = properties.getOutput().getMode();

        return switch (mode) {
            case DATABASE -> catalogWriter.write(records, observedAt);
            case CSV -> {
                csvWriter.write(records, observedAt);
                yield CatalogWriter.WriteResult.none();
            }
            case BOTH -> {
                CatalogWriter.WriteResult result = catalogWriter.write(records, observedAt);
                try {
                    csvWriter.write(records, observedAt);
                } catch (HarvestException e) {
                    log.error("Catalog committed but CSV export failed: {}", e.getMessage());
                }
                yield result;
            }
        };
    }

    public void writeHarvestRun(HarvestRun run) {
        if (properties.getOutput().getMode() != HarvesterProperties.Output.OutputMode.CSV) {
            catalogWriter.writeHarvestRun(run);
        }
    }
}
