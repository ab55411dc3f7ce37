package com.pricetracker.harvester.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricetracker.harvester.config.HarvesterProperties;
import com.pricetracker.harvester.error.HarvestCancelledException;
import com.pricetracker.harvester.error.PayloadParseException;
import com.pricetracker.harvester.error.TransportException;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * One worker's HTTP identity: its own client, cookie jar and user agent.
 * Never shared between category pipelines.
 */
@Slf4j
public class HarvestSession {

    public enum Profile {
        /** Looks like a browser navigating to a storefront page */
        BROWSER,
        /** Looks like the storefront's own script calling the catalog API */
        API
    }

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Retry retry;
    private final HarvesterProperties properties;
    private final String userAgent;

    public HarvestSession(HttpClient httpClient, ObjectMapper objectMapper, Retry retry,
                          HarvesterProperties properties, String userAgent) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.retry = retry;
        this.properties = properties;
        this.userAgent = userAgent;
    }

    /** GET an HTML page with the browser header profile. */
    public String fetchPage(String url) {
        return execute(url, Profile.BROWSER);
    }

    /** GET a JSON document with the API header profile and bind it to {@code type}. */
    public <T> T fetchJson(String url, Class<T> type) {
        String body = execute(url, Profile.API);
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new PayloadParseException("Unreadable JSON from " + url + ": " + e.getOriginalMessage(), e);
        }
    }

    public String getUserAgent() {
        return userAgent;
    }

    HttpRequest buildRequest(String url, Profile profile) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(properties.getSession().getRequestTimeout())
                .header("accept-language", properties.getSession().getAcceptLanguage())
                .header("user-agent", userAgent)
                .GET();

        switch (profile) {
            case BROWSER -> builder.header("accept",
                    "text/html,application/xhtml+xml,application/xml;q=0.9,image/avif,image/webp,image/apng,*/*;q=0.8");
            case API -> {
                HarvesterProperties.Api api = properties.getApi();
                builder.header("accept", "*/*")
                        .header("nike-api-caller-id", api.getCallerId())
                        .header("origin", api.getOrigin())
                        .header("referer", api.getOrigin() + "/");
            }
        }
        return builder.build();
    }

    private String execute(String url, Profile profile) {
        return Retry.decorateSupplier(retry, () -> send(url, profile)).get();
    }

    private String send(String url, Profile profile) {
        HttpRequest request = buildRequest(url, profile);
        log.debug("--> GET {} [{}]", url, profile);
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            log.debug("<-- {} {}", status, url);
            if (status < 200 || status >= 300) {
                throw new TransportException("HTTP " + status + " from " + url, status);
            }
            return response.body();
        } catch (IOException e) {
            throw new TransportException("Request to " + url + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HarvestCancelledException("Interrupted while requesting " + url, e);
        }
    }
}
