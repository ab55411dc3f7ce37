package com.pricetracker.harvester.config;

import com.pricetracker.harvester.service.CatalogQueryService;
import com.pricetracker.harvester.service.HarvestOrchestrator;
import com.pricetracker.harvester.service.HarvestService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class HarvestController {

    private final HarvestService harvestService;
    private final HarvestOrchestrator orchestrator;
    private final CatalogQueryService catalogQueryService;

    // ── Harvest triggers ──────────────────────────────────────────────────────

    @PostMapping("/harvest/trigger")
    public ResponseEntity<Map<String, String>> trigger() {
        if (harvestService.isRunning()) {
            return ResponseEntity.status(409).body(Map.of("status", "already-running"));
        }
        new Thread(harvestService::runHarvest, "manual-harvest").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted"));
    }

    @GetMapping("/harvest/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "catalog-harvester");
        body.put("running", harvestService.isRunning());
        orchestrator.currentProgress().ifPresent(p -> body.put("progress", Map.of(
                "completed", p.getCompleted(),
                "total", p.getTotal())));
        harvestService.getLastRun().ifPresent(run -> body.put("lastRun", run));
        return ResponseEntity.ok(body);
    }

    // ── Catalog query API (read-only) ─────────────────────────────────────────

    /**
     * GET /products?search=pegasus&category=mens+shoes&sort=PRICE_ASC&limit=50
     */
    @GetMapping("/products")
    public ResponseEntity<?> products(
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String category,
            @RequestParam(defaultValue = "RECENTLY_UPDATED") CatalogQueryService.ProductSort sort,
            @RequestParam(defaultValue = "100") int limit) {
        try {
            return ResponseEntity.ok(catalogQueryService.findProducts(search, category, sort, limit));
        } catch (Exception e) {
            log.error("Product query failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/products/categories")
    public ResponseEntity<List<String>> categories() {
        return ResponseEntity.ok(catalogQueryService.findCategories());
    }

    @GetMapping("/products/{productCode}/history")
    public ResponseEntity<List<Map<String, Object>>> history(@PathVariable String productCode) {
        return ResponseEntity.ok(catalogQueryService.getPriceHistory(productCode));
    }

    @GetMapping("/products/{productCode}/stats")
    public ResponseEntity<?> stats(@PathVariable String productCode) {
        return catalogQueryService.getPriceStats(productCode)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(404)
                        .body(Map.of("error", "No price history for " + productCode)));
    }
}
