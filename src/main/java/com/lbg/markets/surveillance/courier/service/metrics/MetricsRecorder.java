package com.lbg.markets.surveillance.courier.service.metrics;

import com.lbg.markets.surveillance.courier.exception.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Transfer metrics. Prometheus exposition names:
 * transfer_success_total, transfer_failure_total, retry_count_total,
 * transfer_duration_seconds, transfer_bytes.
 */
@ApplicationScoped
public class MetricsRecorder {

    static final String TRANSFER_SUCCESS = "transfer.success";
    static final String TRANSFER_FAILURE = "transfer.failure";
    static final String RETRY_COUNT = "retry.count";
    static final String TRANSFER_DURATION = "transfer.duration";
    static final String TRANSFER_BYTES = "transfer.bytes";
    static final String TRANSFER_MALFORMED = "transfer.malformed";
    static final String TRANSFER_DUPLICATE = "transfer.duplicate";
    static final String TRANSFER_UNCLASSIFIED = "transfer.unclassified";
    static final String DLQ_ROUTED = "dlq.routed";
    static final String DLQ_DELIVERY_FAILED = "dlq.delivery.failed";

    private final MeterRegistry registry;

    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();
    private final Map<String, DistributionSummary> summaries = new ConcurrentHashMap<>();

    @Inject
    public MetricsRecorder(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Duration and byte count of one attempt, successful or not.
     */
    public void recordAttempt(Duration duration, long bytes, boolean success) {
        String outcome = success ? "success" : "failure";
        getTimer(TRANSFER_DURATION, "outcome", outcome).record(duration);
        getSummary(TRANSFER_BYTES, "outcome", outcome).record(bytes);
    }

    public void recordSuccess() {
        getCounter(TRANSFER_SUCCESS).increment();
    }

    /**
     * An event that ended without a successful transfer.
     */
    public void recordFailure(ErrorKind kind) {
        getCounter(TRANSFER_FAILURE, "error_kind", kind.getWireName()).increment();
    }

    public void recordRetry(ErrorKind kind) {
        getCounter(RETRY_COUNT, "error_kind", kind.getWireName()).increment();
    }

    public void recordMalformed() {
        getCounter(TRANSFER_MALFORMED).increment();
    }

    public void recordDuplicate() {
        getCounter(TRANSFER_DUPLICATE).increment();
    }

    public void recordUnclassified(String exceptionType) {
        getCounter(TRANSFER_UNCLASSIFIED, "exception", exceptionType).increment();
    }

    public void recordDeadLettered(ErrorKind kind) {
        getCounter(DLQ_ROUTED, "error_kind", kind.getWireName()).increment();
    }

    public void recordDeadLetterDeliveryFailure() {
        getCounter(DLQ_DELIVERY_FAILED).increment();
    }

    private Counter getCounter(String name, String... tags) {
        String key = name + String.join(",", tags);
        return counters.computeIfAbsent(key, k ->
                Counter.builder(name).tags(tags).register(registry));
    }

    private Timer getTimer(String name, String... tags) {
        String key = name + String.join(",", tags);
        return timers.computeIfAbsent(key, k ->
                Timer.builder(name).tags(tags).publishPercentileHistogram().register(registry));
    }

    private DistributionSummary getSummary(String name, String... tags) {
        String key = name + String.join(",", tags);
        return summaries.computeIfAbsent(key, k ->
                DistributionSummary.builder(name).baseUnit("bytes").tags(tags).register(registry));
    }
}
