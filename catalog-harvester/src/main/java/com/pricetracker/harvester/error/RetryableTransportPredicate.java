package com.pricetracker.harvester.error;

import java.util.function.Predicate;

/**
 * Decides which failures the catalog transport retry may repeat: I/O failures,
 * throttling (429) and server errors. Other 4xx responses will not change on retry.
 */
public class RetryableTransportPredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        if (!(throwable instanceof TransportException e)) {
            return false;
        }
        int status = e.getStatusCode();
        return status < 0 || status == 429 || status >= 500;
    }
}
