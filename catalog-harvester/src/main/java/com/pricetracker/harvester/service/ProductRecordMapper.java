package com.pricetracker.harvester.service;

import com.pricetracker.harvester.model.ProductRecord;
import com.pricetracker.harvester.model.ProductWallResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps product wall pages to flat {@link ProductRecord}s.
 *
 * Field mapping (missing source block or value → null column):
 * <pre>
 *   productCode                 → productCode   (required, product dropped when blank)
 *   copy.title                  → title
 *   copy.subTitle               → subtitle
 *   colorwayImages.portraitURL  → imageUrl
 *   pdpUrl.url                  → url
 *   prices.currentPrice         → price
 *   prices.currency             → currency
 *   badgeLabel                  → badgeLabel
 * </pre>
 * Only the first colour variant of a grouping is kept; groupings without products are skipped.
 */
@Component
@Slf4j
public class ProductRecordMapper {

    public List<ProductRecord> normalize(ProductWallResponse page, String category) {
        if (page == null || page.getProductGroupings() == null) {
            return List.of();
        }

        List<ProductRecord> records = new ArrayList<>();
        int emptyGroupings = 0;

        for (ProductWallResponse.ProductGrouping grouping : page.getProductGroupings()) {
            if (grouping == null || grouping.getProducts() == null || grouping.getProducts().isEmpty()) {
                emptyGroupings++;
                continue;
            }

            ProductWallResponse.Product product = grouping.getProducts().get(0);
            if (product == null || isBlank(product.getProductCode())) {
                log.warn("Dropping product without productCode in category '{}'", category);
                continue;
            }

            records.add(map(product, category));
        }

        if (emptyGroupings > 0) {
            log.debug("Skipped {} groupings without products in category '{}'", emptyGroupings, category);
        }
        return records;
    }

    public ProductRecord map(ProductWallResponse.Product product, String category) {
        ProductWallResponse.Copy copy = product.getCopy();
        ProductWallResponse.Prices prices = product.getPrices();

        return ProductRecord.builder()
                .productCode(product.getProductCode().trim())
                .title(copy != null ? emptyToNull(copy.getTitle()) : null)
                .subtitle(copy != null ? emptyToNull(copy.getSubTitle()) : null)
                .category(category)
                .imageUrl(product.getColorwayImages() != null
                        ? emptyToNull(product.getColorwayImages().getPortraitURL()) : null)
                .url(product.getPdpUrl() != null ? emptyToNull(product.getPdpUrl().getUrl()) : null)
                .price(prices != null ? prices.getCurrentPrice() : null)
                .currency(prices != null ? emptyToNull(prices.getCurrency()) : null)
                .badgeLabel(emptyToNull(product.getBadgeLabel()))
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private boolean isBlank(String val) {
        return val == null || val.isBlank();
    }

    private String emptyToNull(String val) {
        return isBlank(val) ? null : val;
    }
}
