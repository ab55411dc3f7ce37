package com.pricetracker.harvester.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricetracker.harvester.model.ProductRecord;
import com.pricetracker.harvester.model.ProductWallResponse;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProductRecordMapperTest {

    private final ProductRecordMapper mapper = new ProductRecordMapper();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void mapsFixturePageKeepingFirstVariantAndDroppingEmptyGroupings() throws IOException {
        ProductWallResponse page = load("fixtures/product-wall-page.json");

        List<ProductRecord> records = mapper.normalize(page, "mens shoes");

        assertThat(records).extracting(ProductRecord::getProductCode)
                .containsExactly("FD2596-100", "HF4480-001");

        ProductRecord pegasus = records.get(0);
        assertThat(pegasus.getTitle()).isEqualTo("Nike Pegasus 41");
        assertThat(pegasus.getSubtitle()).isEqualTo("Men's Road Running Shoes");
        assertThat(pegasus.getCategory()).isEqualTo("mens shoes");
        assertThat(pegasus.getImageUrl()).isEqualTo("https://static.nike.com/a/images/pegasus-41-portrait.png");
        assertThat(pegasus.getUrl()).endsWith("/FD2596-100");
        assertThat(pegasus.getPrice()).isEqualTo(11895.0);
        assertThat(pegasus.getCurrency()).isEqualTo("INR");
        assertThat(pegasus.getBadgeLabel()).isEqualTo("Just In");
    }

    @Test
    void missingOptionalFieldsBecomeNull() throws IOException {
        ProductWallResponse page = load("fixtures/product-wall-page.json");

        ProductRecord airMax = mapper.normalize(page, "mens shoes").get(1);

        assertThat(airMax.getSubtitle()).isNull();
        assertThat(airMax.getImageUrl()).isNull();
        assertThat(airMax.getBadgeLabel()).isNull();
        assertThat(airMax.getPrice()).isEqualTo(14995.0);
    }

    @Test
    void emptyGroupingPlusOneProductYieldsExactlyOneRecord() {
        ProductWallResponse page = new ProductWallResponse();
        List<ProductWallResponse.ProductGrouping> groupings = new ArrayList<>();

        ProductWallResponse.ProductGrouping empty = new ProductWallResponse.ProductGrouping();
        empty.setProducts(List.of());
        groupings.add(empty);

        ProductWallResponse.Product product = new ProductWallResponse.Product();
        product.setProductCode("DV3853-001");
        ProductWallResponse.ProductGrouping single = new ProductWallResponse.ProductGrouping();
        single.setProducts(List.of(product));
        groupings.add(single);

        page.setProductGroupings(groupings);

        List<ProductRecord> records = mapper.normalize(page, "womens shoes");

        assertThat(records).hasSize(1);
        assertThat(records.get(0).getProductCode()).isEqualTo("DV3853-001");
        assertThat(records.get(0).getTitle()).isNull();
        assertThat(records.get(0).getPrice()).isNull();
    }

    @Test
    void pageWithoutGroupingsYieldsNothing() {
        assertThat(mapper.normalize(new ProductWallResponse(), "kids shoes")).isEmpty();
        assertThat(mapper.normalize(null, "kids shoes")).isEmpty();
    }

    private ProductWallResponse load(String name) throws IOException {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(name)) {
            return objectMapper.readValue(in, ProductWallResponse.class);
        }
    }
}
