package com.lbg.markets.surveillance.courier.service;

import com.lbg.markets.surveillance.courier.config.CourierConfiguration;
import com.lbg.markets.surveillance.courier.exception.ErrorKind;
import com.lbg.markets.surveillance.courier.exception.FailureClassification;
import com.lbg.markets.surveillance.courier.exception.TransferException;
import com.lbg.markets.surveillance.courier.model.AttemptRecord;
import com.lbg.markets.surveillance.courier.model.TransferEvent;
import com.lbg.markets.surveillance.courier.model.TransferState;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Failure classification and exponential backoff. Holds no per-event state and performs no I/O.
 * <p>
 * After the n-th failed attempt the next attempt waits {@code min(maxDelay, baseDelay * 2^(n-1))},
 * so the default sequence is 1s, 2s, 4s, 8s, 16s, 30s, 30s...
 */
@ApplicationScoped
public class RetryPolicy {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final int defaultMaxRetries;
    private final boolean checksumMismatchRetryable;

    @Inject
    public RetryPolicy(CourierConfiguration config) {
        this(config.retry().baseDelay(),
                config.retry().maxDelay(),
                config.retry().defaultMaxRetries(),
                config.retry().checksumMismatchRetryable());
    }

    public RetryPolicy(Duration baseDelay, Duration maxDelay, int defaultMaxRetries,
                       boolean checksumMismatchRetryable) {
        if (baseDelay.isNegative() || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException(
                    "Invalid backoff bounds: base=" + baseDelay + ", max=" + maxDelay);
        }
        if (defaultMaxRetries < 1) {
            throw new IllegalArgumentException("defaultMaxRetries must be at least 1");
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.defaultMaxRetries = defaultMaxRetries;
        this.checksumMismatchRetryable = checksumMismatchRetryable;
    }

    /**
     * Error kind of a failure. Anything outside the transfer taxonomy is UNCLASSIFIED.
     */
    public ErrorKind errorKind(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof TransferException transferException) {
            return transferException.getKind();
        }
        return ErrorKind.UNCLASSIFIED;
    }

    public FailureClassification classify(Throwable error) {
        ErrorKind kind = errorKind(error);
        if (kind == ErrorKind.CHECKSUM_MISMATCH && checksumMismatchRetryable) {
            return FailureClassification.RETRYABLE;
        }
        return kind.getDefaultClassification();
    }

    /**
     * Delay before the next attempt.
     *
     * @param failedAttempts attempts that have failed so far, at least 1
     */
    public Duration backoffDelay(int failedAttempts) {
        if (failedAttempts < 1) {
            throw new IllegalArgumentException("failedAttempts must be at least 1: " + failedAttempts);
        }
        int exponent = Math.min(failedAttempts - 1, 30);
        long millis = baseDelay.toMillis();
        for (int i = 0; i < exponent && millis < maxDelay.toMillis(); i++) {
            millis *= 2;
        }
        return Duration.ofMillis(Math.min(millis, maxDelay.toMillis()));
    }

    public int maxRetriesFor(TransferEvent event) {
        return event.metadata().maxRetriesOr(defaultMaxRetries);
    }

    /**
     * Apply a failed attempt to the record.
     *
     * @return RETRYING when another attempt is due, EXHAUSTED otherwise
     */
    public TransferState onFailure(AttemptRecord record, Throwable error, int maxRetries, Instant now) {
        ErrorKind kind = errorKind(error);
        String message = unwrap(error).getMessage();

        if (classify(error) == FailureClassification.FATAL || record.getAttempts() >= maxRetries) {
            record.recordExhausted(kind, message, now);
        } else {
            record.recordRetry(kind, message, backoffDelay(record.getAttempts()), now);
        }
        return record.getState();
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public int getDefaultMaxRetries() {
        return defaultMaxRetries;
    }
}
