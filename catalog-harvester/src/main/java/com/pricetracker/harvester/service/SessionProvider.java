package com.pricetracker.harvester.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricetracker.harvester.config.HarvesterProperties;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.CookieManager;
import java.net.http.HttpClient;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Hands out a fresh {@link HarvestSession} per category pipeline.
 * Each session gets its own client and cookie jar and a user agent drawn from the
 * configured pool, so workers never share connection state.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SessionProvider {

    private static final String FALLBACK_USER_AGENT =
            "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/132.0.0.0 Safari/537.36";

    private final HarvesterProperties properties;
    private final ObjectMapper objectMapper;
    private final Retry catalogTransportRetry;

    public HarvestSession newSession() {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getSession().getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .cookieHandler(new CookieManager())
                .build();

        String userAgent = pickUserAgent();
        log.debug("New harvest session with user agent {}", userAgent);
        return new HarvestSession(httpClient, objectMapper, catalogTransportRetry, properties, userAgent);
    }

    private String pickUserAgent() {
        List<String> pool = properties.getSession().getUserAgents();
        if (pool == null || pool.isEmpty()) {
            return FALLBACK_USER_AGENT;
        }
        return pool.get(ThreadLocalRandom.current().nextInt(pool.size()));
    }
}
