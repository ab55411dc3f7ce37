package com.pricetracker.harvester.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * Raw DTO for one page of the product wall API.
 * Kept separate from {@link ProductRecord} to isolate API coupling; every nested block is
 * optional and maps to null when the API leaves it out.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProductWallResponse {

    private Pages pages;

    private List<ProductGrouping> productGroupings;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Pages {
        private Integer totalResources;

        /** Server path of the next page, absent on the last page */
        private String next;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProductGrouping {
        /** Colour variants; the first one is the representative product */
        private List<Product> products;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Product {
        private String productCode;
        private String badgeLabel;
        private Copy copy;
        private Prices prices;
        private PdpUrl pdpUrl;
        private ColorwayImages colorwayImages;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Copy {
        private String title;
        private String subTitle;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Prices {
        private String currency;
        private Double currentPrice;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PdpUrl {
        private String url;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ColorwayImages {
        private String portraitURL;
    }
}
