package com.pricetracker.harvester.output;

import com.pricetracker.harvester.error.CatalogWriteException;
import com.pricetracker.harvester.model.HarvestRun;
import com.pricetracker.harvester.model.ProductRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reconciles a run's snapshot with the SQLite catalog.
 *
 * One transaction per run: upsert every distinct product, then append one price_history
 * row per snapshot row, all stamped with the same run timestamp. Any failed statement
 * rolls back the whole run.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CatalogWriter {

    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final String UPSERT_PRODUCT = """
            INSERT INTO products (product_code, title, subtitle, category, image_url, url, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(product_code) DO UPDATE SET
                title     = excluded.title,
                subtitle  = excluded.subtitle,
                category  = excluded.category,
                image_url = excluded.image_url,
                url       = excluded.url
            """;

    private static final String INSERT_PRICE = """
            INSERT INTO price_history (product_code, price, timestamp)
            VALUES (?, ?, ?)
            """;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public record WriteResult(int productsUpserted, int observationsInserted) {
        public static WriteResult none() {
            return new WriteResult(0, 0);
        }
    }

    public void ensureSchema() {
        log.info("Ensuring catalog schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS products
            (
                product_code  TEXT PRIMARY KEY NOT NULL,
                title         TEXT,
                subtitle      TEXT,
                category      TEXT,
                image_url     TEXT,
                url           TEXT,
                created_at    DATETIME DEFAULT CURRENT_TIMESTAMP
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS price_history
            (
                id            INTEGER PRIMARY KEY AUTOINCREMENT,
                product_code  TEXT NOT NULL,
                price         REAL,
                timestamp     DATETIME DEFAULT CURRENT_TIMESTAMP,
                FOREIGN KEY (product_code) REFERENCES products (product_code)
            )
        """);

        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS idx_price_history_product
                ON price_history (product_code, timestamp)
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS harvest_runs
            (
                run_id                TEXT PRIMARY KEY,
                started_at            DATETIME NOT NULL,
                completed_at          DATETIME,
                status                TEXT NOT NULL,
                categories_total      INTEGER,
                categories_succeeded  INTEGER,
                categories_skipped    INTEGER,
                categories_failed     INTEGER,
                records_found         INTEGER,
                products_written      INTEGER,
                observations_written  INTEGER,
                error_message         TEXT
            )
        """);

        log.info("Catalog schema ready.");
    }

    public WriteResult write(List<ProductRecord> records, LocalDateTime observedAt) {
        if (records.isEmpty()) return WriteResult.none();

        String timestamp = observedAt.format(TIMESTAMP_FORMAT);

        // later occurrences win, so a product seen in two categories keeps the last one
        Map<String, ProductRecord> latest = new LinkedHashMap<>();
        for (ProductRecord r : records) {
            latest.put(r.getProductCode(), r);
        }

        log.info("Writing {} products and {} price observations at {}", latest.size(), records.size(), timestamp);

        try {
            WriteResult result = transactionTemplate.execute(status -> {
                for (ProductRecord r : latest.values()) {
                    upsertProduct(r, timestamp);
                }
                for (ProductRecord r : records) {
                    appendObservation(r, timestamp);
                }
                return new WriteResult(latest.size(), records.size());
            });
            log.info("Updated {} products and added {} price entries", latest.size(), records.size());
            return result;

        } catch (DataAccessException | TransactionException e) {
            throw new CatalogWriteException(
                    "Catalog write rolled back: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    public void writeHarvestRun(HarvestRun run) {
        try {
            jdbcTemplate.update("""
                INSERT OR REPLACE INTO harvest_runs
                (run_id, started_at, completed_at, status, categories_total, categories_succeeded,
                 categories_skipped, categories_failed, records_found, products_written,
                 observations_written, error_message)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                    run.getRunId(),
                    format(run.getStartedAt()),
                    format(run.getCompletedAt()),
                    run.getStatus().name(),
                    run.getCategoriesTotal(),
                    run.getCategoriesSucceeded(),
                    run.getCategoriesSkipped(),
                    run.getCategoriesFailed(),
                    run.getRecordsFound(),
                    run.getProductsWritten(),
                    run.getObservationsWritten(),
                    run.getErrorMessage());
        } catch (DataAccessException e) {
            log.warn("Failed to write harvest run {}: {}", run.getRunId(), e.getMessage());
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void upsertProduct(ProductRecord r, String timestamp) {
        try {
            jdbcTemplate.update(UPSERT_PRODUCT,
                    r.getProductCode(),
                    r.getTitle(),
                    r.getSubtitle(),
                    r.getCategory(),
                    r.getImageUrl(),
                    r.getUrl(),
                    timestamp);
        } catch (DataAccessException e) {
            log.error("Product upsert failed, rolling back run. Failed row data: {}", r);
            throw e;
        }
    }

    private void appendObservation(ProductRecord r, String timestamp) {
        try {
            jdbcTemplate.update(INSERT_PRICE, r.getProductCode(), r.getPrice(), timestamp);
        } catch (DataAccessException e) {
            log.error("Price insert failed, rolling back run. Failed row data: {}", r);
            throw e;
        }
    }

    private String format(LocalDateTime time) {
        return time == null ? null : time.format(TIMESTAMP_FORMAT);
    }
}
