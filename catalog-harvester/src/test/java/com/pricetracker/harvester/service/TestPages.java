package com.pricetracker.harvester.service;

import com.pricetracker.harvester.model.ProductWallResponse;

import java.util.Arrays;
import java.util.List;

/**
 * Builds product wall pages for tests.
 */
final class TestPages {

    private TestPages() {
    }

    static ProductWallResponse page(int totalResources, String next, String... productCodes) {
        ProductWallResponse.Pages pages = new ProductWallResponse.Pages();
        pages.setTotalResources(totalResources);
        pages.setNext(next);

        ProductWallResponse page = new ProductWallResponse();
        page.setPages(pages);
        page.setProductGroupings(Arrays.stream(productCodes).map(TestPages::grouping).toList());
        return page;
    }

    private static ProductWallResponse.ProductGrouping grouping(String productCode) {
        ProductWallResponse.Copy copy = new ProductWallResponse.Copy();
        copy.setTitle("Product " + productCode);

        ProductWallResponse.Prices prices = new ProductWallResponse.Prices();
        prices.setCurrency("INR");
        prices.setCurrentPrice(4995.0);

        ProductWallResponse.Product product = new ProductWallResponse.Product();
        product.setProductCode(productCode);
        product.setCopy(copy);
        product.setPrices(prices);

        ProductWallResponse.ProductGrouping grouping = new ProductWallResponse.ProductGrouping();
        grouping.setProducts(List.of(product));
        return grouping;
    }
}
