package com.lbg.markets.surveillance.courier.dto;

import java.time.Instant;

/**
 * Synchronous health query result.
 *
 * @param status         {@code healthy} or {@code degraded}
 * @param processedCount events that reached a terminal success or failure
 * @param dlqCount       events delivered to the dead-letter sink
 * @param successRate    succeeded share of processed events, in percent
 * @param inFlight       claimed events not yet finished, including those waiting out a backoff
 * @param timestamp      when the snapshot was taken
 */
public record WorkerHealth(String status,
                           long processedCount,
                           long dlqCount,
                           double successRate,
                           int inFlight,
                           Instant timestamp) {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";

    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }
}
