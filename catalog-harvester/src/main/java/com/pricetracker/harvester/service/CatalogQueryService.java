package com.pricetracker.harvester.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only queries over products and price_history, the data a dashboard renders.
 *
 * "Current price" of a product is the price of its most recent price_history row.
 * image_url and subtitle may be null.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CatalogQueryService {

    private final JdbcTemplate jdbcTemplate;

    public enum ProductSort {
        RECENTLY_UPDATED("last_updated DESC"),
        PRICE_DESC("current_price IS NULL, current_price DESC"),
        PRICE_ASC("current_price IS NULL, current_price ASC"),
        NAME_ASC("p.title ASC"),
        NAME_DESC("p.title DESC");

        private final String orderBy;

        ProductSort(String orderBy) {
            this.orderBy = orderBy;
        }
    }

    public record PriceStats(String productCode, double highest, double lowest, double average,
                             double current, int observations) {}

    /**
     * Products with their latest price, filtered and sorted.
     *
     * @param search   case-insensitive match on title or product code, null for all
     * @param category exact category name, null or "All" for all
     */
    public List<Map<String, Object>> findProducts(String search, String category, ProductSort sort, int limit) {
        StringBuilder sql = new StringBuilder("""
            SELECT
                p.product_code,
                p.title,
                p.subtitle,
                p.category,
                p.image_url,
                p.url,
                p.created_at,
                lp.price     AS current_price,
                lp.timestamp AS last_updated
            FROM products p
            LEFT JOIN (
                SELECT ph.product_code, ph.price, ph.timestamp
                FROM price_history ph
                WHERE ph.id = (SELECT MAX(id) FROM price_history WHERE product_code = ph.product_code)
            ) lp ON lp.product_code = p.product_code
            WHERE 1 = 1
            """);

        List<Object> args = new ArrayList<>();
        if (search != null && !search.isBlank()) {
            String pattern = "%" + escapeLike(search.trim().toLowerCase(Locale.ROOT)) + "%";
            sql.append(" AND (LOWER(p.title) LIKE ? ESCAPE '\\' OR LOWER(p.product_code) LIKE ? ESCAPE '\\')");
            args.add(pattern);
            args.add(pattern);
        }
        if (category != null && !category.isBlank() && !"All".equalsIgnoreCase(category)) {
            sql.append(" AND p.category = ?");
            args.add(category);
        }

        ProductSort order = sort != null ? sort : ProductSort.RECENTLY_UPDATED;
        sql.append(" ORDER BY ").append(order.orderBy).append(", p.product_code ASC LIMIT ?");
        args.add(Math.max(1, limit));

        return jdbcTemplate.queryForList(sql.toString(), args.toArray());
    }

    public List<String> findCategories() {
        return jdbcTemplate.queryForList(
                "SELECT DISTINCT category FROM products WHERE category IS NOT NULL ORDER BY category DESC",
                String.class);
    }

    /** Price observations of one product, oldest first. */
    public List<Map<String, Object>> getPriceHistory(String productCode) {
        return jdbcTemplate.queryForList("""
            SELECT price, timestamp
            FROM price_history
            WHERE product_code = ?
            ORDER BY timestamp ASC, id ASC
            """, productCode);
    }

    public Optional<PriceStats> getPriceStats(String productCode) {
        List<Map<String, Object>> history = getPriceHistory(productCode);
        List<Double> prices = history.stream()
                .map(r -> (Number) r.get("price"))
                .filter(Objects::nonNull)
                .map(Number::doubleValue)
                .toList();

        if (prices.isEmpty()) {
            log.debug("No priced observations for {}", productCode);
            return Optional.empty();
        }

        double highest = prices.stream().mapToDouble(Double::doubleValue).max().orElseThrow();
        double lowest = prices.stream().mapToDouble(Double::doubleValue).min().orElseThrow();
        double average = prices.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
        double current = prices.get(prices.size() - 1);

        return Optional.of(new PriceStats(productCode, highest, lowest, average, current, prices.size()));
    }

    private String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
