package com.pricetracker.harvester.output;

import com.opencsv.CSVWriter;
import com.pricetracker.harvester.config.HarvesterProperties;
import com.pricetracker.harvester.error.HarvestException;
import com.pricetracker.harvester.model.ProductRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Exports a run's snapshot to CSV.
 *
 * Output path pattern: {outputDir}/snapshot_{yyyyMMdd_HHmmss}.csv
 * e.g. data/snapshots/snapshot_20241019_030000.csv
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvWriter {

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final HarvesterProperties properties;

    static final String[] HEADERS = {
            "product_code", "title", "subtitle", "category",
            "image_url", "url",
            "price", "currency", "badge_label",
            "observed_at"
    };

    public Path write(List<ProductRecord> records, LocalDateTime observedAt) {
        Path outputDir = Paths.get(properties.getOutput().getCsv().getOutputDir());
        ensureDirectory(outputDir);

        Path outputPath = outputDir.resolve("snapshot_" + observedAt.format(FILE_STAMP) + ".csv");
        String observed = observedAt.format(CatalogWriter.TIMESTAMP_FORMAT);

        try (Writer out = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out,
                     CSVWriter.DEFAULT_SEPARATOR,
                     CSVWriter.DEFAULT_QUOTE_CHARACTER,
                     CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                     CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getOutput().getCsv().isIncludeHeader()) {
                writer.writeNext(HEADERS);
            }

            for (ProductRecord r : records) {
                writer.writeNext(toRow(r, observed));
            }

            log.info("Written {} records to CSV: {}", records.size(), outputPath);
            return outputPath;

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new HarvestException("CSV export failed: " + outputPath, e);
        }
    }

    private String[] toRow(ProductRecord r, String observed) {
        return new String[]{
                str(r.getProductCode()),
                str(r.getTitle()),
                str(r.getSubtitle()),
                str(r.getCategory()),
                str(r.getImageUrl()),
                str(r.getUrl()),
                str(r.getPrice()),
                str(r.getCurrency()),
                str(r.getBadgeLabel()),
                observed
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new HarvestException("Cannot create output directory: " + dir, e);
        }
    }
}
