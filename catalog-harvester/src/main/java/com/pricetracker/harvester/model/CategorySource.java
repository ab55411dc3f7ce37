package com.pricetracker.harvester.model;

import java.net.URI;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * A configured category landing page and the display name derived from its slug.
 * e.g. ".../w/mens-shoes-nik1zy7ok" → "mens shoes" (the trailing storefront code is dropped).
 */
public record CategorySource(String entryUrl, String categoryName) {

    public static CategorySource fromUrl(String entryUrl) {
        if (entryUrl == null || entryUrl.isBlank()) {
            throw new IllegalArgumentException("Category URL must not be blank");
        }
        String trimmed = entryUrl.trim();
        return new CategorySource(trimmed, nameFromSlug(trimmed));
    }

    /** Path of the landing page without the leading slash, as the catalog API expects it. */
    public String path() {
        String path = URI.create(entryUrl).getPath();
        if (path == null) return "";
        return path.startsWith("/") ? path.substring(1) : path;
    }

    private static String nameFromSlug(String url) {
        String noTrailing = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        String slug = noTrailing.substring(noTrailing.lastIndexOf('/') + 1);
        String[] parts = slug.split("-");
        if (parts.length <= 1) return slug;
        return Arrays.stream(parts, 0, parts.length - 1)
                .collect(Collectors.joining(" "));
    }
}
