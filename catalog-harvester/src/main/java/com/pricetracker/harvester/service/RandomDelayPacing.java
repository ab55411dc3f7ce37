package com.pricetracker.harvester.service;

import com.pricetracker.harvester.config.HarvesterProperties;
import com.pricetracker.harvester.error.HarvestCancelledException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Sleeps a uniformly random time in [min-delay, max-delay] to stay under the
 * catalog API's rate limits.
 */
@Component
public class RandomDelayPacing implements PacingPolicy {

    private final long minMillis;
    private final long maxMillis;

    @Autowired
    public RandomDelayPacing(HarvesterProperties properties) {
        this(properties.getPacing().getMinDelay(), properties.getPacing().getMaxDelay());
    }

    public RandomDelayPacing(Duration minDelay, Duration maxDelay) {
        long min = Math.max(0, minDelay.toMillis());
        long max = Math.max(min, maxDelay.toMillis());
        this.minMillis = min;
        this.maxMillis = max;
    }

    @Override
    public void pause() {
        sleepMs(nextDelayMs());
    }

    long nextDelayMs() {
        if (maxMillis == minMillis) return minMillis;
        return ThreadLocalRandom.current().nextLong(minMillis, maxMillis + 1);
    }

    private void sleepMs(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new HarvestCancelledException("Interrupted during pacing delay", ie);
        }
    }
}
