package com.pricetracker.harvester.service;

import com.pricetracker.harvester.error.TransportException;
import com.pricetracker.harvester.model.CategorySource;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Finds the opaque category identifier ("concept id") a landing page embeds in its
 * deep-link meta tag, e.g.
 * {@code <meta name="branch:deeplink:$deeplink_path" content="x-callback-url/product-wall?conceptid=...">}.
 *
 * A missing tag, a tag without the parameter and a failed fetch all resolve to empty;
 * the caller skips the category either way.
 */
@Component
@Slf4j
public class CategoryIdResolver {

    static final String DEEPLINK_META = "branch:deeplink:$deeplink_path";
    static final String CONCEPT_ID_PARAM = "conceptid";

    public Optional<String> resolve(HarvestSession session, CategorySource source) {
        String url = source.entryUrl();
        log.info("Fetching landing page for '{}': {}", source.categoryName(), url);

        String html;
        try {
            html = session.fetchPage(url);
        } catch (TransportException e) {
            log.warn("Could not fetch landing page {}: {}", url, e.getMessage());
            return Optional.empty();
        }

        return extract(html, url);
    }

    Optional<String> extract(String html, String url) {
        Document doc = Jsoup.parse(html, url);
        Element meta = doc.getElementsByAttributeValue("name", DEEPLINK_META).first();
        if (meta == null || meta.attr("content").isBlank()) {
            log.warn("No deep-link meta tag on {}", url);
            return Optional.empty();
        }

        String deeplink = meta.attr("content");
        String raw;
        try {
            raw = UriComponentsBuilder.fromUriString(deeplink).build()
                    .getQueryParams()
                    .getFirst(CONCEPT_ID_PARAM);
        } catch (IllegalArgumentException e) {
            log.warn("Unparseable deep-link path '{}' on {}", deeplink, url);
            return Optional.empty();
        }

        if (raw == null || raw.isBlank()) {
            log.warn("Deep-link meta tag on {} carries no {} parameter", url, CONCEPT_ID_PARAM);
            return Optional.empty();
        }

        String conceptId = URLDecoder.decode(raw, StandardCharsets.UTF_8);
        log.debug("Resolved {} → {}", url, conceptId);
        return Optional.of(conceptId);
    }
}
