package com.pricetracker.harvester.model;

import lombok.Builder;
import lombok.Data;

/**
 * Flat, normalised product row harvested from one product wall page.
 *
 * productCode is the identity across runs. Everything else is snapshot state and is
 * overwritten on the next observation (category included: last writer wins).
 */
@Data
@Builder
public class ProductRecord {

    /** Stable style-colour code, e.g. "FD2596-100" */
    private String productCode;

    private String title;

    /** Null for products the storefront shows without a subtitle */
    private String subtitle;

    /** Display name of the category this product was harvested under */
    private String category;

    private String imageUrl;

    /** Canonical product detail page URL */
    private String url;

    private Double price;

    private String currency;

    /** Merchandising badge ("Just In", "Bestseller"), usually null */
    private String badgeLabel;
}
