package com.lbg.markets.surveillance.courier.exception;

/**
 * Classification of a failed transfer attempt.
 * <ul>
 *     <li>RETRYABLE: retry with backoff while the attempt budget lasts</li>
 *     <li>FATAL: no further attempts, route to the dead-letter queue</li>
 * </ul>
 */
public enum FailureClassification {
    RETRYABLE,
    FATAL
}
