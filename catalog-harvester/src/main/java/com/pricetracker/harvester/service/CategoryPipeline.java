package com.pricetracker.harvester.service;

import com.pricetracker.harvester.error.HarvestCancelledException;
import com.pricetracker.harvester.error.HarvestException;
import com.pricetracker.harvester.model.CategoryResult;
import com.pricetracker.harvester.model.CategorySource;
import com.pricetracker.harvester.model.ProductRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Discovery → fetch → normalise for a single category, on its own session.
 * Every expected failure ends up in the returned {@link CategoryResult}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CategoryPipeline {

    private final SessionProvider sessionProvider;
    private final CategoryIdResolver categoryIdResolver;
    private final ProductWallClient productWallClient;

    public CategoryResult run(CategorySource source) {
        HarvestSession session = sessionProvider.newSession();
        try {
            Optional<String> categoryId = categoryIdResolver.resolve(session, source);
            if (categoryId.isEmpty()) {
                log.warn("Skipping '{}': no category identifier found on {}", source.categoryName(), source.entryUrl());
                return CategoryResult.skipped(source, "No category identifier on landing page");
            }

            List<ProductRecord> records = productWallClient.fetchAll(session, source, categoryId.get());
            return CategoryResult.success(source, records);

        } catch (HarvestCancelledException e) {
            log.warn("Category '{}' cancelled: {}", source.categoryName(), e.getMessage());
            return CategoryResult.failed(source, "Cancelled: " + e.getMessage());
        } catch (HarvestException e) {
            log.error("Category '{}' failed ({}): {}", source.categoryName(), source.entryUrl(), e.getMessage(), e);
            return CategoryResult.failed(source, e.getMessage());
        }
    }
}
