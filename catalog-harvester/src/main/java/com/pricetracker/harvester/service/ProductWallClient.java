package com.pricetracker.harvester.service;

import com.pricetracker.harvester.config.HarvesterProperties;
import com.pricetracker.harvester.error.PayloadParseException;
import com.pricetracker.harvester.model.CategorySource;
import com.pricetracker.harvester.model.ProductRecord;
import com.pricetracker.harvester.model.ProductWallResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Walks the product wall API for one category, page by page.
 *
 * The first request starts at anchor 0; every later request follows the server's
 * {@code pages.next} path. The loop ends only when a page comes back without
 * {@code next}. {@code totalResources} is used for progress logging and nothing else,
 * the API is known to over-report it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ProductWallClient {

    private final HarvesterProperties properties;
    private final ProductRecordMapper mapper;
    private final PacingPolicy pacingPolicy;

    public List<ProductRecord> fetchAll(HarvestSession session, CategorySource source, String categoryId) {
        String category = source.categoryName();
        int pageSize = properties.effectivePageSize();

        String url = firstPageUrl(source, categoryId);
        ProductWallResponse page = fetchPage(session, url);

        int totalResources = page.getPages().getTotalResources() != null ? page.getPages().getTotalResources() : 0;
        int totalPages = (int) Math.ceil(totalResources / (double) pageSize);
        log.info("'{}': {} products reported across ~{} pages", category, totalResources, totalPages);

        List<ProductRecord> records = new ArrayList<>(mapper.normalize(page, category));
        Set<String> visited = new HashSet<>();
        visited.add(url);
        int fetched = 1;

        String next = nextPath(page);
        while (next != null) {
            pacingPolicy.pause();

            String nextUrl = resolve(next);
            if (!visited.add(nextUrl)) {
                throw new PayloadParseException("Cursor did not advance for '" + category + "': " + nextUrl);
            }

            page = fetchPage(session, nextUrl);
            records.addAll(mapper.normalize(page, category));
            fetched++;
            log.debug("'{}': page {}/{} fetched, {} records so far", category, fetched, totalPages, records.size());

            next = nextPath(page);
        }

        log.info("'{}': {} pages fetched, {} records normalised", category, fetched, records.size());
        return records;
    }

    /**
     * First page URL, e.g.
     * {@code /discover/product_wall/v1/marketplace/IN/language/en-GB/consumerChannelId/{id}
     * ?path=in/w/mens-shoes-nik1zy7ok&attributeIds=...&queryType=PRODUCTS&anchor=0&count=100}
     */
    public String firstPageUrl(CategorySource source, String categoryId) {
        HarvesterProperties.Api api = properties.getApi();
        return UriComponentsBuilder
                .fromHttpUrl(api.getBaseUrl() + api.getDiscoveryPath())
                .pathSegment("marketplace", api.getMarketplace())
                .pathSegment("language", api.getLanguage())
                .pathSegment("consumerChannelId", api.getConsumerChannelId())
                .queryParam("path", source.path())
                .queryParam("attributeIds", categoryId)
                .queryParam("queryType", "PRODUCTS")
                .queryParam("anchor", 0)
                .queryParam("count", properties.effectivePageSize())
                .toUriString();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private ProductWallResponse fetchPage(HarvestSession session, String url) {
        ProductWallResponse page = session.fetchJson(url, ProductWallResponse.class);
        if (page == null || page.getPages() == null) {
            throw new PayloadParseException("Response from " + url + " has no pages block");
        }
        return page;
    }

    private String nextPath(ProductWallResponse page) {
        String next = page.getPages().getNext();
        return (next == null || next.isBlank()) ? null : next;
    }

    private String resolve(String next) {
        if (next.startsWith("http://") || next.startsWith("https://")) {
            return next;
        }
        String base = properties.getApi().getBaseUrl();
        return next.startsWith("/") ? base + next : base + "/" + next;
    }
}
