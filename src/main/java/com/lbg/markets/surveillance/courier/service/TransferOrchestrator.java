package com.lbg.markets.surveillance.courier.service;

import com.lbg.markets.surveillance.courier.config.CourierConfiguration;
import com.lbg.markets.surveillance.courier.dto.OrchestratorStatistics;
import com.lbg.markets.surveillance.courier.dto.WorkerHealth;
import com.lbg.markets.surveillance.courier.exception.DeadLetterDeliveryException;
import com.lbg.markets.surveillance.courier.exception.ErrorKind;
import com.lbg.markets.surveillance.courier.exception.SchemaValidationException;
import com.lbg.markets.surveillance.courier.exception.TransferTimeoutException;
import com.lbg.markets.surveillance.courier.model.AttemptRecord;
import com.lbg.markets.surveillance.courier.model.ProcessingOutcome;
import com.lbg.markets.surveillance.courier.model.TransferEvent;
import com.lbg.markets.surveillance.courier.model.TransferResult;
import com.lbg.markets.surveillance.courier.model.TransferState;
import com.lbg.markets.surveillance.courier.service.deadletter.DeadLetterRouter;
import com.lbg.markets.surveillance.courier.service.idempotency.ClaimResult;
import com.lbg.markets.surveillance.courier.service.idempotency.IdempotencyGuard;
import com.lbg.markets.surveillance.courier.service.logging.StructuredLogger;
import com.lbg.markets.surveillance.courier.service.metrics.MetricsRecorder;
import com.lbg.markets.surveillance.courier.service.queue.QueuedEvent;
import com.lbg.markets.surveillance.courier.service.queue.TransferQueue;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives each delivered event from validation to a terminal outcome.
 * <p>
 * Every event runs as its own state machine: claim the event id, run an attempt on the attempt
 * pool, then either finish or schedule the next attempt on the scheduler. No thread is held while
 * an event waits out its backoff, and one event's retries never delay another event.
 * <p>
 * A delivery is acknowledged only after a recorded success, a completed dead-letter routing, or
 * a malformed-payload drop. Everything else is rejected back to the queue for redelivery.
 */
@ApplicationScoped
public class TransferOrchestrator {

    private static final Logger LOG = Logger.getLogger(TransferOrchestrator.class);

    private final EventParser parser;
    private final IdempotencyGuard idempotencyGuard;
    private final TransferExecutor executor;
    private final RetryPolicy retryPolicy;
    private final DeadLetterRouter deadLetterRouter;
    private final TransferQueue queue;
    private final MetricsRecorder metrics;
    private final StructuredLogger log;
    private final Clock clock;

    private final ExecutorService attemptPool;
    private final ScheduledExecutorService scheduler;
    private final Duration attemptTimeout;
    private final Duration deferralDelay;
    private final double degradedSuccessRate;

    private final Map<String, EventProcessing> active = new ConcurrentHashMap<>();
    private volatile boolean shutdownRequested = false;

    // Statistics
    private final AtomicLong totalSuccessful = new AtomicLong();
    private final AtomicLong deadLettered = new AtomicLong();
    private final AtomicLong deadLetterFailures = new AtomicLong();
    private final AtomicLong droppedMalformed = new AtomicLong();
    private final AtomicLong duplicates = new AtomicLong();
    private final AtomicLong deferred = new AtomicLong();
    private final AtomicLong abandoned = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();
    private final AtomicLong totalBytes = new AtomicLong();
    private final AtomicLong totalSuccessNanos = new AtomicLong();

    @Inject
    public TransferOrchestrator(EventParser parser,
                                IdempotencyGuard idempotencyGuard,
                                TransferExecutor executor,
                                RetryPolicy retryPolicy,
                                DeadLetterRouter deadLetterRouter,
                                TransferQueue queue,
                                MetricsRecorder metrics,
                                StructuredLogger log,
                                Clock clock,
                                CourierConfiguration config) {
        this(parser, idempotencyGuard, executor, retryPolicy, deadLetterRouter, queue, metrics, log, clock,
                createAttemptPool(config.worker().threads()),
                createScheduler(),
                config.worker().attemptTimeout(),
                config.worker().deferralDelay(),
                config.health().degradedSuccessRate());
    }

    public TransferOrchestrator(EventParser parser,
                                IdempotencyGuard idempotencyGuard,
                                TransferExecutor executor,
                                RetryPolicy retryPolicy,
                                DeadLetterRouter deadLetterRouter,
                                TransferQueue queue,
                                MetricsRecorder metrics,
                                StructuredLogger log,
                                Clock clock,
                                ExecutorService attemptPool,
                                ScheduledExecutorService scheduler,
                                Duration attemptTimeout,
                                Duration deferralDelay,
                                double degradedSuccessRate) {
        this.parser = parser;
        this.idempotencyGuard = idempotencyGuard;
        this.executor = executor;
        this.retryPolicy = retryPolicy;
        this.deadLetterRouter = deadLetterRouter;
        this.queue = queue;
        this.metrics = metrics;
        this.log = log;
        this.clock = clock;
        this.attemptPool = attemptPool;
        this.scheduler = scheduler;
        this.attemptTimeout = attemptTimeout;
        this.deferralDelay = deferralDelay;
        this.degradedSuccessRate = degradedSuccessRate;
    }

    // ============ Public API ============

    /**
     * Process one delivery. The returned future completes with the outcome once the delivery has
     * been acknowledged or rejected; it never completes exceptionally.
     */
    public CompletableFuture<ProcessingOutcome> processEvent(QueuedEvent delivery) {
        if (shutdownRequested) {
            queue.nack(delivery);
            abandoned.incrementAndGet();
            return CompletableFuture.completedFuture(ProcessingOutcome.ABANDONED);
        }

        TransferEvent event;
        try {
            event = parser.parse(delivery.payload());
        } catch (SchemaValidationException e) {
            return CompletableFuture.completedFuture(dropMalformed(delivery, e));
        }

        ClaimResult claim = idempotencyGuard.tryClaim(event.eventId());
        switch (claim) {
            case ALREADY_PROCESSED -> {
                duplicates.incrementAndGet();
                metrics.recordDuplicate();
                log.info(event, "Duplicate event skipped; already processed",
                        fields("delivery_attempt", delivery.deliveryAttempt(), "outcome", "duplicate"));
                queue.ack(delivery);
                return CompletableFuture.completedFuture(ProcessingOutcome.DUPLICATE);
            }
            case IN_FLIGHT -> {
                deferred.incrementAndGet();
                log.info(event, "Event is already being processed; deferring redelivery",
                        fields("delivery_attempt", delivery.deliveryAttempt(),
                                "redelivery_delay_seconds", deferralDelay.toMillis() / 1000.0,
                                "outcome", "deferred"));
                queue.nack(delivery, deferralDelay);
                return CompletableFuture.completedFuture(ProcessingOutcome.DEFERRED);
            }
            default -> {
                EventProcessing processing = new EventProcessing(delivery, event);
                active.put(event.eventId(), processing);
                processing.attempt();
                return processing.outcome;
            }
        }
    }

    /**
     * Synchronous health query. Status is degraded once the success rate is at or below the threshold.
     */
    public WorkerHealth healthSnapshot() {
        OrchestratorStatistics stats = getStatistics();
        String status = stats.successRate > degradedSuccessRate ? WorkerHealth.HEALTHY : WorkerHealth.DEGRADED;
        return new WorkerHealth(status, stats.totalProcessed, deadLetterRouter.getRoutedCount(),
                stats.successRate, stats.inFlight, clock.instant());
    }

    /**
     * Deliveries claimed and not yet acknowledged or rejected.
     */
    public List<QueuedEvent> activeDeliveries() {
        return active.values().stream().map(processing -> processing.delivery).toList();
    }

    public OrchestratorStatistics getStatistics() {
        OrchestratorStatistics stats = new OrchestratorStatistics();
        stats.totalSuccessful = totalSuccessful.get();
        stats.deadLettered = deadLettered.get();
        stats.deadLetterFailures = deadLetterFailures.get();
        stats.totalFailed = stats.deadLettered + stats.deadLetterFailures;
        stats.totalProcessed = stats.totalSuccessful + stats.totalFailed;
        stats.droppedMalformed = droppedMalformed.get();
        stats.duplicates = duplicates.get();
        stats.deferred = deferred.get();
        stats.abandoned = abandoned.get();
        stats.retries = retries.get();
        stats.totalBytes = totalBytes.get();
        stats.avgDurationSeconds = stats.totalSuccessful > 0
                ? totalSuccessNanos.get() / 1_000_000_000.0 / stats.totalSuccessful : 0;
        stats.successRate = stats.totalProcessed > 0
                ? (double) stats.totalSuccessful / stats.totalProcessed * 100 : 100.0;
        stats.inFlight = active.size();
        return stats;
    }

    public int getInFlightCount() {
        return active.size();
    }

    public boolean isShutdownRequested() {
        return shutdownRequested;
    }

    /**
     * Stop taking work. Events waiting out a backoff are abandoned at once; running attempts get
     * {@code grace} to finish and are abandoned after that. Abandoned deliveries are rejected
     * back to the queue and their claims released.
     */
    public void shutdown(Duration grace) {
        if (shutdownRequested) {
            return;
        }
        shutdownRequested = true;
        LOG.infof("Shutting down transfer orchestrator with %d events in flight", active.size());

        List<CompletableFuture<ProcessingOutcome>> running = new ArrayList<>();
        for (EventProcessing processing : active.values()) {
            if (!processing.abandonIfWaiting()) {
                running.add(processing.outcome);
            }
        }

        if (!running.isEmpty()) {
            try {
                CompletableFuture.allOf(running.toArray(new CompletableFuture[0]))
                        .get(grace.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                LOG.warnf("Grace period of %s elapsed with %d attempts running", grace, active.size());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while waiting for running attempts");
            } catch (ExecutionException e) {
                LOG.error("Unexpected failure waiting for running attempts", e);
            }
        }
        active.values().forEach(EventProcessing::abandon);

        shutdownPool(scheduler, "scheduler");
        shutdownPool(attemptPool, "attempt");

        LOG.infof("Transfer orchestrator stopped - %s", getStatistics());
    }

    // ============ Processing ============

    private ProcessingOutcome dropMalformed(QueuedEvent delivery, SchemaValidationException e) {
        droppedMalformed.incrementAndGet();
        metrics.recordMalformed();
        log.warnUnparsed(
                parser.peekField(delivery.payload(), "correlationId").orElse(null),
                parser.peekField(delivery.payload(), "eventId").orElse(null),
                "Dropping malformed event",
                fields("violations", e.getViolations(),
                        "error_kind", ErrorKind.SCHEMA_VALIDATION.getWireName(),
                        "outcome", "dropped"));
        queue.ack(delivery);
        return ProcessingOutcome.DROPPED_MALFORMED;
    }

    /**
     * Processing state of one claimed event. Attempts of one event never overlap: the next attempt,
     * or the dead-letter routing, starts only once the previous attempt's task has returned.
     */
    private class EventProcessing {
        final QueuedEvent delivery;
        final TransferEvent event;
        final AttemptRecord record;
        final int maxRetries;
        final CompletableFuture<ProcessingOutcome> outcome = new CompletableFuture<>();
        final AtomicBoolean finished = new AtomicBoolean(false);

        private volatile ScheduledFuture<?> pendingRetry;
        private volatile Attempt current;

        EventProcessing(QueuedEvent delivery, TransferEvent event) {
            this.delivery = delivery;
            this.event = event;
            this.record = new AttemptRecord(event.eventId());
            this.maxRetries = retryPolicy.maxRetriesFor(event);
        }

        void attempt() {
            pendingRetry = null;
            if (shutdownRequested) {
                abandon();
                return;
            }
            try {
                int number = record.beginAttempt(clock.instant());
                log.info(event, "Transfer attempt started",
                        fields("attempt", number, "max_retries", maxRetries,
                                "delivery_attempt", delivery.deliveryAttempt()));
                Attempt attempt = new Attempt(number);
                current = attempt;
                attempt.start();
                attempt.result.whenComplete((result, error) -> {
                    if (error == null) {
                        onSuccess(result);
                    } else {
                        onFailure(error);
                    }
                });
            } catch (RejectedExecutionException e) {
                LOG.warnf("Attempt pool rejected event %s", event.eventId());
                abandon();
            } catch (RuntimeException e) {
                fail(e, false);
            }
        }

        private void onSuccess(TransferResult result) {
            if (!finished.compareAndSet(false, true)) {
                LOG.warnf("Attempt for %s succeeded after it was abandoned", event.eventId());
                return;
            }
            try {
                record.recordSuccess(clock.instant());
                idempotencyGuard.markProcessed(event.eventId());
                metrics.recordSuccess();
                totalSuccessful.incrementAndGet();
                totalBytes.addAndGet(result.bytesTransferred());
                totalSuccessNanos.addAndGet((long) (result.durationSeconds() * 1_000_000_000L));
                log.info(event, "Transfer succeeded",
                        fields("attempt", record.getAttempts(),
                                "bytes_transferred", result.bytesTransferred(),
                                "duration_seconds", result.durationSeconds(),
                                "checksum_sha256", result.checksumSha256(),
                                "outcome", "succeeded"));
                acknowledge();
                complete(ProcessingOutcome.SUCCEEDED);
            } catch (RuntimeException e) {
                fail(e, true);
            }
        }

        private void onFailure(Throwable error) {
            if (finished.get()) {
                return;
            }
            boolean claimed = false;
            try {
                Throwable cause = RetryPolicy.unwrap(error);
                ErrorKind kind = retryPolicy.errorKind(cause);
                int attempt = record.getAttempts();
                if (kind == ErrorKind.UNCLASSIFIED) {
                    metrics.recordUnclassified(cause.getClass().getSimpleName());
                    log.warn(event, "Unclassified failure treated as retryable",
                            fields("attempt", attempt, "exception", cause.getClass().getName(),
                                    "error_message", cause.getMessage()));
                }

                TransferState state = retryPolicy.onFailure(record, cause, maxRetries, clock.instant());
                if (state == TransferState.RETRYING) {
                    scheduleRetry(kind, cause, attempt);
                    return;
                }
                if (!finished.compareAndSet(false, true)) {
                    return;
                }
                claimed = true;
                metrics.recordFailure(kind);
                log.error(event, "Transfer failed permanently",
                        fields("attempt", attempt, "max_retries", maxRetries,
                                "error_kind", kind.getWireName(),
                                "error_message", cause.getMessage(),
                                "classification", retryPolicy.classify(cause).name()),
                        cause);
                routeToDeadLetter(cause);
            } catch (RuntimeException e) {
                fail(e, claimed);
            }
        }

        private void scheduleRetry(ErrorKind kind, Throwable cause, int attempt) {
            Duration delay = record.getNextRetryDelay();
            retries.incrementAndGet();
            metrics.recordRetry(kind);
            log.warn(event, "Transfer attempt failed; retry scheduled",
                    fields("attempt", attempt, "max_retries", maxRetries,
                            "error_kind", kind.getWireName(),
                            "error_message", cause.getMessage(),
                            "delay_seconds", delay.toMillis() / 1000.0));
            if (shutdownRequested) {
                abandon();
                return;
            }
            try {
                pendingRetry = scheduler.schedule(this::attempt, delay.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                LOG.warnf("Scheduler rejected retry of %s", event.eventId());
                abandon();
            }
        }

        /**
         * Requires {@link #finished} to be held by the caller.
         */
        private void routeToDeadLetter(Throwable cause) {
            try {
                deadLetterRouter.route(event, record.getHistory(), cause);
                deadLettered.incrementAndGet();
                idempotencyGuard.release(event.eventId());
                acknowledge();
                complete(ProcessingOutcome.DEAD_LETTERED);
            } catch (DeadLetterDeliveryException e) {
                deadLetterFailures.incrementAndGet();
                idempotencyGuard.release(event.eventId());
                reject();
                complete(ProcessingOutcome.DEAD_LETTER_FAILED);
            }
        }

        /**
         * Abandon the event if it is waiting out a backoff.
         *
         * @return true if the event was waiting and has been abandoned
         */
        boolean abandonIfWaiting() {
            ScheduledFuture<?> retry = pendingRetry;
            if (retry != null && retry.cancel(false)) {
                abandon();
                return true;
            }
            return false;
        }

        void abandon() {
            if (finished.compareAndSet(false, true)) {
                abandonClaimed();
            }
        }

        /**
         * Requires {@link #finished} to be held by the caller.
         */
        private void abandonClaimed() {
            ScheduledFuture<?> retry = pendingRetry;
            if (retry != null) {
                retry.cancel(false);
            }
            Attempt attempt = current;
            if (attempt != null) {
                attempt.cancel();
            }
            abandoned.incrementAndGet();
            idempotencyGuard.release(event.eventId());
            log.warn(event, "Processing abandoned; delivery left for redelivery",
                    fields("attempt", record.getAttempts(), "state", record.getState().name(),
                            "outcome", "abandoned"));
            reject();
            complete(ProcessingOutcome.ABANDONED);
        }

        /**
         * Last resort for a failure inside the state machine itself.
         */
        private void fail(RuntimeException e, boolean claimed) {
            LOG.errorf(e, "Processing of event %s failed unexpectedly", event.eventId());
            if (claimed) {
                abandonClaimed();
            } else {
                abandon();
            }
        }

        private void acknowledge() {
            try {
                queue.ack(delivery);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to acknowledge delivery of %s; it may be redelivered", event.eventId());
            }
        }

        private void reject() {
            try {
                queue.nack(delivery);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to reject delivery of %s; it will be redelivered after its ack deadline",
                        event.eventId());
            }
        }

        private void complete(ProcessingOutcome result) {
            active.remove(event.eventId(), this);
            outcome.complete(result);
        }

        /**
         * One attempt on the attempt pool. Its result completes only once the task has returned or
         * is known never to run, so a timed-out attempt cannot touch the destination after the
         * event has moved on.
         */
        private final class Attempt {
            final int number;
            final CompletableFuture<TransferResult> result = new CompletableFuture<>();
            private final AtomicBoolean started = new AtomicBoolean(false);
            private volatile boolean cancelled = false;
            private volatile boolean timedOut = false;
            private volatile Future<?> task;

            Attempt(int number) {
                this.number = number;
            }

            void start() {
                task = attemptPool.submit(this::run);
                ScheduledFuture<?> watchdog = scheduler.schedule(this::timeOut,
                        attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
                result.whenComplete((r, e) -> watchdog.cancel(false));
            }

            private void run() {
                if (!started.compareAndSet(false, true)) {
                    return;
                }
                try {
                    result.complete(executor.execute(event, number, () -> cancelled));
                } catch (Throwable t) {
                    result.completeExceptionally(timedOut ? new TransferTimeoutException(attemptTimeout) : t);
                }
            }

            private void timeOut() {
                timedOut = true;
                log.warn(event, "Transfer attempt exceeded its timeout; cancelling",
                        fields("attempt", number, "timeout_seconds", attemptTimeout.toMillis() / 1000.0));
                cancel();
            }

            void cancel() {
                cancelled = true;
                if (started.compareAndSet(false, true)) {
                    result.completeExceptionally(timedOut
                            ? new TransferTimeoutException(attemptTimeout)
                            : new CancellationException("Attempt " + number + " cancelled before it started"));
                }
                Future<?> running = task;
                if (running != null) {
                    running.cancel(true);
                }
            }
        }
    }

    // ============ Helper Methods ============

    static Map<String, Object> fields(Object... keyValues) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            fields.put((String) keyValues[i], keyValues[i + 1]);
        }
        return fields;
    }

    private static ExecutorService createAttemptPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return new ThreadPoolExecutor(
                threads, threads,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                r -> {
                    Thread thread = new Thread(r);
                    thread.setName("courier-attempt-" + counter.incrementAndGet());
                    thread.setDaemon(false);
                    return thread;
                });
    }

    private static ScheduledExecutorService createScheduler() {
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, r -> {
            Thread thread = new Thread(r);
            thread.setName("courier-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    private void shutdownPool(ExecutorService pool, String name) {
        try {
            pool.shutdown();
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                LOG.warnf("Forcing shutdown of %s pool", name);
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
