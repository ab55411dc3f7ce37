package com.pricetracker.harvester.output;

import com.pricetracker.harvester.error.CatalogWriteException;
import com.pricetracker.harvester.model.HarvestRun;
import com.pricetracker.harvester.model.ProductRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CatalogWriterTest {

    private static final LocalDateTime RUN_1 = LocalDateTime.of(2024, 10, 1, 3, 0, 0);
    private static final LocalDateTime RUN_2 = LocalDateTime.of(2024, 10, 2, 3, 0, 0);

    @TempDir
    Path tempDir;

    private TestCatalogDatabase db;
    private CatalogWriter writer;

    @BeforeEach
    void setUp() {
        db = new TestCatalogDatabase(tempDir);
        writer = db.writer();
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void sameProductTwiceKeepsOneProductRowAndTwoObservations() {
        ProductRecord pegasus = product("FD2596-100", "mens shoes", 11895.0);

        writer.write(List.of(pegasus), RUN_1);
        writer.write(List.of(pegasus), RUN_2);

        assertThat(db.count("products")).isEqualTo(1);
        assertThat(db.count("price_history")).isEqualTo(2);
    }

    @Test
    void upsertOverwritesMutableFieldsAndKeepsCreatedAt() {
        writer.write(List.of(product("FD2596-100", "mens shoes", 11895.0)), RUN_1);

        ProductRecord renamed = product("FD2596-100", "womens shoes", 9995.0);
        renamed.setTitle("Nike Pegasus 41 Premium");
        renamed.setSubtitle(null);
        writer.write(List.of(renamed), RUN_2);

        Map<String, Object> row = db.jdbc().queryForMap("SELECT * FROM products WHERE product_code = 'FD2596-100'");
        assertThat(row.get("category")).isEqualTo("womens shoes");
        assertThat(row.get("title")).isEqualTo("Nike Pegasus 41 Premium");
        assertThat(row.get("subtitle")).isNull();
        assertThat(row.get("created_at")).isEqualTo("2024-10-01 03:00:00");
    }

    @Test
    void everyObservationOfARunSharesTheRunTimestamp() {
        CatalogWriter.WriteResult result = writer.write(List.of(
                product("AA0001-001", "mens shoes", 100.0),
                product("AA0002-001", "mens shoes", 200.0),
                product("AA0003-001", "kids shoes", 300.0)), RUN_1);

        assertThat(result).isEqualTo(new CatalogWriter.WriteResult(3, 3));
        List<String> timestamps = db.jdbc().queryForList("SELECT DISTINCT timestamp FROM price_history", String.class);
        assertThat(timestamps).containsExactly("2024-10-01 03:00:00");
    }

    @Test
    void productSeenInTwoCategoriesKeepsTheLastOneAndLogsBothPrices() {
        CatalogWriter.WriteResult result = writer.write(List.of(
                product("AA0001-001", "mens shoes", 100.0),
                product("AA0001-001", "kids shoes", 100.0)), RUN_1);

        assertThat(result).isEqualTo(new CatalogWriter.WriteResult(1, 2));
        assertThat(db.jdbc().queryForObject("SELECT category FROM products", String.class)).isEqualTo("kids shoes");
        assertThat(db.count("price_history")).isEqualTo(2);
    }

    @Test
    void failingRowRollsBackTheWholeRun() {
        List<ProductRecord> batch = List.of(
                product("AA0001-001", "mens shoes", 100.0),
                product(null, "mens shoes", 150.0),
                product("AA0003-001", "mens shoes", 200.0));

        assertThatThrownBy(() -> writer.write(batch, RUN_1))
                .isInstanceOf(CatalogWriteException.class)
                .hasMessageContaining("rolled back");

        assertThat(db.count("products")).isZero();
        assertThat(db.count("price_history")).isZero();
    }

    @Test
    void failedRunLeavesEarlierRunsIntact() {
        writer.write(List.of(product("AA0001-001", "mens shoes", 100.0)), RUN_1);

        assertThatThrownBy(() -> writer.write(List.of(
                product("AA0001-001", "mens shoes", 90.0),
                product(null, "mens shoes", 150.0)), RUN_2))
                .isInstanceOf(CatalogWriteException.class);

        assertThat(db.count("products")).isEqualTo(1);
        assertThat(db.jdbc().queryForList("SELECT price FROM price_history", Double.class)).containsExactly(100.0);
    }

    @Test
    void emptySnapshotWritesNothing() {
        assertThat(writer.write(List.of(), RUN_1)).isEqualTo(CatalogWriter.WriteResult.none());
        assertThat(db.count("products")).isZero();
    }

    @Test
    void schemaCreationIsRepeatable() {
        writer.ensureSchema();
        writer.ensureSchema();

        assertThat(db.count("products")).isZero();
    }

    @Test
    void harvestRunIsRecorded() {
        writer.writeHarvestRun(HarvestRun.builder()
                .runId("run-1")
                .startedAt(RUN_1)
                .completedAt(RUN_1.plusMinutes(4))
                .status(HarvestRun.Status.SUCCESS)
                .categoriesTotal(9)
                .categoriesSucceeded(8)
                .categoriesSkipped(1)
                .recordsFound(1200)
                .productsWritten(1180)
                .observationsWritten(1200)
                .build());

        Map<String, Object> row = db.jdbc().queryForMap("SELECT * FROM harvest_runs WHERE run_id = 'run-1'");
        assertThat(row.get("status")).isEqualTo("SUCCESS");
        assertThat(row.get("completed_at")).isEqualTo("2024-10-01 03:04:00");
        assertThat(((Number) row.get("products_written")).intValue()).isEqualTo(1180);
    }

    @Test
    void transactionThatCannotStartSurfacesAsCatalogWriteFailure() {
        PlatformTransactionManager manager = mock(PlatformTransactionManager.class);
        when(manager.getTransaction(any())).thenThrow(new CannotCreateTransactionException("pool timeout"));
        CatalogWriter unavailable = new CatalogWriter(db.jdbc(), new TransactionTemplate(manager));

        assertThatThrownBy(() -> unavailable.write(List.of(product("FD2596-100", "mens shoes", 11895.0)), RUN_1))
                .isInstanceOf(CatalogWriteException.class)
                .hasMessageContaining("pool timeout");
        assertThat(db.count("products")).isZero();
    }

    static ProductRecord product(String code, String category, Double price) {
        return ProductRecord.builder()
                .productCode(code)
                .title("Product " + code)
                .subtitle("Running Shoes")
                .category(category)
                .url("https://www.nike.com/in/t/" + code)
                .price(price)
                .currency("INR")
                .build();
    }
}
