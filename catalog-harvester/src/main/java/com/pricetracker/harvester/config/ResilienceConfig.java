package com.pricetracker.harvester.config;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the named retry policy applied to every catalog HTTP request.
 * <p>
 * The instance settings (attempts, backoff, which exceptions are retried) live under
 * {@code resilience4j.retry.instances.catalogTransport} in {@code application.yml}.
 */
@Configuration
public class ResilienceConfig {

    public static final String CATALOG_TRANSPORT = "catalogTransport";

    @Bean
    public Retry catalogTransportRetry(RetryRegistry registry) {
        return registry.retry(CATALOG_TRANSPORT);
    }
}
