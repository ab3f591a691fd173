package com.lbg.markets.surveillance.courier.service;

import com.lbg.markets.surveillance.courier.TransferEvents;
import com.lbg.markets.surveillance.courier.dto.WorkerHealth;
import com.lbg.markets.surveillance.courier.exception.DeadLetterDeliveryException;
import com.lbg.markets.surveillance.courier.exception.ErrorKind;
import com.lbg.markets.surveillance.courier.exception.StorageNetworkException;
import com.lbg.markets.surveillance.courier.model.AttemptSnapshot;
import com.lbg.markets.surveillance.courier.model.CloudProvider;
import com.lbg.markets.surveillance.courier.model.DeadLetterEntry;
import com.lbg.markets.surveillance.courier.model.ProcessingOutcome;
import com.lbg.markets.surveillance.courier.model.TransferEvent;
import com.lbg.markets.surveillance.courier.model.TransferState;
import com.lbg.markets.surveillance.courier.service.deadletter.DeadLetterRouter;
import com.lbg.markets.surveillance.courier.service.deadletter.DeadLetterSink;
import com.lbg.markets.surveillance.courier.service.deadletter.InMemoryDeadLetterSink;
import com.lbg.markets.surveillance.courier.service.idempotency.ClaimResult;
import com.lbg.markets.surveillance.courier.service.idempotency.InMemoryIdempotencyGuard;
import com.lbg.markets.surveillance.courier.service.logging.StructuredLogger;
import com.lbg.markets.surveillance.courier.service.metrics.MetricsRecorder;
import com.lbg.markets.surveillance.courier.service.queue.InMemoryTransferQueue;
import com.lbg.markets.surveillance.courier.service.queue.QueuedEvent;
import com.lbg.markets.surveillance.courier.service.storage.LocalObjectStorage;
import com.lbg.markets.surveillance.courier.service.storage.ObjectStorage;
import com.lbg.markets.surveillance.courier.service.storage.StorageResolver;
import com.lbg.markets.surveillance.courier.service.storage.StoredObject;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TransferOrchestratorTest {

    private static final String CONTENT = "trade_id,qty\nT1,100\n";
    private static final Duration ATTEMPT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration DEFERRAL_DELAY = Duration.ofMillis(500);
    private static final long WAIT_SECONDS = 10;

    @TempDir
    Path root;

    private SimpleMeterRegistry registry;
    private InMemoryTransferQueue queue;
    private InMemoryIdempotencyGuard guard;
    private InMemoryDeadLetterSink sink;
    private LocalObjectStorage localSource;
    private LocalObjectStorage destination;
    private ExecutorService attemptPool;
    private TransferOrchestrator orchestrator;

    @BeforeEach
    void setUp() throws Exception {
        registry = new SimpleMeterRegistry();
        queue = new InMemoryTransferQueue();
        guard = new InMemoryIdempotencyGuard();
        sink = new InMemoryDeadLetterSink();
        localSource = new LocalObjectStorage(root.resolve("aws_s3"));
        destination = spy(new LocalObjectStorage(root.resolve("gcp_gcs")));
        attemptPool = Executors.newFixedThreadPool(4);

        localSource.write(TransferEvents.SOURCE_BUCKET, "data/file.csv",
                CONTENT.getBytes(StandardCharsets.UTF_8), "text/csv");
    }

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.shutdown(Duration.ofSeconds(1));
        }
        attemptPool.shutdownNow();
    }

    @Test
    @DisplayName("Scenario A: always-failing network source is attempted maxRetries times, then dead-lettered")
    void retryBoundThenDeadLetter() throws Exception {
        ObjectStorage failingSource = mock(ObjectStorage.class);
        when(failingSource.read(anyString(), anyString()))
                .thenThrow(new StorageNetworkException("connection reset"));
        RecordingScheduler scheduler = new RecordingScheduler();
        orchestrator = newOrchestrator(failingSource, sink, scheduler, ATTEMPT_TIMEOUT);

        QueuedEvent delivery = deliver(TransferEvents.builder("abc-123").maxRetries(3).payload());
        ProcessingOutcome outcome = orchestrator.processEvent(delivery).get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertThat(outcome).isEqualTo(ProcessingOutcome.DEAD_LETTERED);
        verify(failingSource, times(3)).read(TransferEvents.SOURCE_BUCKET, "data/file.csv");
        assertThat(scheduler.backoffs).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));

        assertThat(sink.getEntries()).hasSize(1);
        DeadLetterEntry entry = sink.getEntries().get(0);
        assertThat(entry.attempts()).hasSize(3);
        assertThat(entry.attempts()).extracting(AttemptSnapshot::attempt).containsExactly(1, 2, 3);
        assertThat(entry.attempts()).extracting(AttemptSnapshot::state)
                .containsExactly(TransferState.RETRYING, TransferState.RETRYING, TransferState.EXHAUSTED);
        assertThat(entry.finalErrorKind()).isEqualTo(ErrorKind.NETWORK);

        assertThat(queue.getAcknowledged()).containsExactly(delivery);
        assertThat(count("retry.count")).isEqualTo(2);
        assertThat(count("transfer.failure")).isEqualTo(1);
        assertThat(count("dlq.routed")).isEqualTo(1);
        assertThat(guard.hasProcessed("abc-123")).isFalse();
    }

    @Test
    @DisplayName("Scenario B: second delivery of a processed event is acknowledged with no side effects")
    void duplicateDeliveryIsSkipped() throws Exception {
        orchestrator = newOrchestrator(localSource, sink, new RecordingScheduler(), ATTEMPT_TIMEOUT);
        String payload = TransferEvents.builder("abc-123").payload();

        QueuedEvent first = deliver(payload);
        assertThat(orchestrator.processEvent(first).get(WAIT_SECONDS, TimeUnit.SECONDS))
                .isEqualTo(ProcessingOutcome.SUCCEEDED);
        QueuedEvent second = deliver(payload);
        assertThat(orchestrator.processEvent(second).get(WAIT_SECONDS, TimeUnit.SECONDS))
                .isEqualTo(ProcessingOutcome.DUPLICATE);

        verify(destination, times(1)).write(eq(TransferEvents.DEST_BUCKET), anyString(), any(byte[].class), any());
        assertThat(count("transfer.success")).isEqualTo(1);
        assertThat(count("transfer.duplicate")).isEqualTo(1);
        assertThat(queue.getAcknowledged()).containsExactly(first, second);
        assertThat(root.resolve("gcp_gcs").resolve(TransferEvents.DEST_BUCKET).resolve("landing/file.csv"))
                .hasContent(CONTENT);
    }

    @Test
    @DisplayName("Scenario C: checksum mismatch fails once and is dead-lettered without retry")
    void checksumMismatchIsDeadLetteredWithoutRetry() throws Exception {
        RecordingScheduler scheduler = new RecordingScheduler();
        orchestrator = newOrchestrator(localSource, sink, scheduler, ATTEMPT_TIMEOUT);

        QueuedEvent delivery = deliver(TransferEvents.builder("abc-123")
                .checksum(TransferEvents.sha256("not the content")).payload());
        ProcessingOutcome outcome = orchestrator.processEvent(delivery).get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertThat(outcome).isEqualTo(ProcessingOutcome.DEAD_LETTERED);
        assertThat(scheduler.backoffs).isEmpty();
        DeadLetterEntry entry = sink.getEntries().get(0);
        assertThat(entry.attempts()).hasSize(1);
        assertThat(entry.finalErrorKind()).isEqualTo(ErrorKind.CHECKSUM_MISMATCH);
        assertThat(root.resolve("gcp_gcs").resolve(TransferEvents.DEST_BUCKET).resolve("landing/file.csv"))
                .doesNotExist();
        assertThat(count("transfer.success")).isZero();
    }

    @Test
    void deadLetterEntryCarriesTheDeliveredPayloadByteForByte() throws Exception {
        orchestrator = newOrchestrator(localSource, sink, new RecordingScheduler(), ATTEMPT_TIMEOUT);
        String payload = "{\n  \"schemaVersion\": \"1.0.0\", \"eventId\": \"abc-123\", \"correlationId\": \"c-9\",\n"
                + "  \"timestamp\": \"2024-01-15T10:30:00+00:00\",\n"
                + "  \"source\": {\"provider\": \"aws_s3\", \"bucket\": \"source-bucket\", \"key\": \"data/missing.csv\"},\n"
                + "  \"destination\": {\"provider\": \"gcp_gcs\", \"bucket\": \"dest-bucket\", \"key\": \"out.csv\"},\n"
                + "  \"metadata\": {\"priority\": \"low\"}\n}";

        orchestrator.processEvent(deliver(payload)).get(WAIT_SECONDS, TimeUnit.SECONDS);

        DeadLetterEntry entry = sink.getEntries().get(0);
        assertThat(entry.originalEvent().toWireFormat()).isEqualTo(payload);
        assertThat(entry.toJson().get("originalEvent").getAsString()).isEqualTo(payload);
        assertThat(entry.finalErrorKind()).isEqualTo(ErrorKind.SOURCE_NOT_FOUND);
        assertThat(entry.attempts()).hasSize(1);
    }

    @Test
    void malformedPayloadIsDroppedAndAcknowledged() throws Exception {
        orchestrator = newOrchestrator(localSource, sink, new RecordingScheduler(), ATTEMPT_TIMEOUT);

        QueuedEvent delivery = deliver("{\"eventId\": \"abc-123\", \"schemaVersion\": \"1.0.0\"}");
        ProcessingOutcome outcome = orchestrator.processEvent(delivery).get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertThat(outcome).isEqualTo(ProcessingOutcome.DROPPED_MALFORMED);
        assertThat(queue.getAcknowledged()).containsExactly(delivery);
        assertThat(sink.getEntries()).isEmpty();
        assertThat(count("transfer.malformed")).isEqualTo(1);
        assertThat(guard.tryClaim("abc-123")).isEqualTo(ClaimResult.CLAIMED);
    }

    @Test
    void concurrentDuplicateIsDeferredUntilTheFirstFinishes() throws Exception {
        CountDownLatch readStarted = new CountDownLatch(1);
        CountDownLatch releaseRead = new CountDownLatch(1);
        ObjectStorage slowSource = mock(ObjectStorage.class);
        when(slowSource.read(anyString(), anyString())).thenAnswer(invocation -> {
            readStarted.countDown();
            releaseRead.await(WAIT_SECONDS, TimeUnit.SECONDS);
            return new StoredObject(new ByteArrayInputStream(CONTENT.getBytes(StandardCharsets.UTF_8)), "text/csv");
        });
        orchestrator = newOrchestrator(slowSource, sink, new RecordingScheduler(), ATTEMPT_TIMEOUT);
        String payload = TransferEvents.builder("abc-123").payload();

        var first = orchestrator.processEvent(deliver(payload));
        assertThat(readStarted.await(WAIT_SECONDS, TimeUnit.SECONDS)).isTrue();

        QueuedEvent concurrent = deliver(payload);
        assertThat(orchestrator.processEvent(concurrent).get(WAIT_SECONDS, TimeUnit.SECONDS))
                .isEqualTo(ProcessingOutcome.DEFERRED);
        assertThat(queue.getRejected()).containsExactly(concurrent);
        assertThat(queue.receive(Duration.ZERO)).isEmpty();

        releaseRead.countDown();
        assertThat(first.get(WAIT_SECONDS, TimeUnit.SECONDS)).isEqualTo(ProcessingOutcome.SUCCEEDED);

        QueuedEvent redelivered = queue.receive(Duration.ofSeconds(WAIT_SECONDS)).orElseThrow();
        assertThat(redelivered.deliveryAttempt()).isEqualTo(2);
        assertThat(orchestrator.processEvent(redelivered).get(WAIT_SECONDS, TimeUnit.SECONDS))
                .isEqualTo(ProcessingOutcome.DUPLICATE);
        verify(destination, times(1)).write(eq(TransferEvents.DEST_BUCKET), anyString(), any(byte[].class), any());
    }

    @Test
    void hungAttemptTimesOutAsRetryableTimeout() throws Exception {
        ObjectStorage hangingSource = mock(ObjectStorage.class);
        when(hangingSource.read(anyString(), anyString())).thenAnswer(invocation -> {
            try {
                Thread.sleep(TimeUnit.SECONDS.toMillis(WAIT_SECONDS * 3));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StorageNetworkException("interrupted", e);
            }
            return new StoredObject(new ByteArrayInputStream(new byte[0]), null);
        });
        RecordingScheduler scheduler = new RecordingScheduler();
        orchestrator = newOrchestrator(hangingSource, sink, scheduler, Duration.ofMillis(200));

        QueuedEvent delivery = deliver(TransferEvents.builder("abc-123").maxRetries(2).payload());
        ProcessingOutcome outcome = orchestrator.processEvent(delivery).get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertThat(outcome).isEqualTo(ProcessingOutcome.DEAD_LETTERED);
        DeadLetterEntry entry = sink.getEntries().get(0);
        assertThat(entry.attempts()).hasSize(2);
        assertThat(entry.attempts()).extracting(AttemptSnapshot::errorKind)
                .containsOnly(ErrorKind.TIMEOUT);
        assertThat(scheduler.backoffs).containsExactly(Duration.ofSeconds(1));
    }

    @Test
    void timedOutAttemptThatIgnoresInterruptsNeverWritesTheDestination() throws Exception {
        AtomicInteger reads = new AtomicInteger();
        ObjectStorage stubbornSource = mock(ObjectStorage.class);
        when(stubbornSource.read(anyString(), anyString())).thenAnswer(invocation -> {
            if (reads.incrementAndGet() == 1) {
                sleepIgnoringInterrupts(Duration.ofMillis(800));
            }
            return new StoredObject(new ByteArrayInputStream(CONTENT.getBytes(StandardCharsets.UTF_8)), "text/csv");
        });
        RecordingScheduler scheduler = new RecordingScheduler();
        orchestrator = newOrchestrator(stubbornSource, sink, scheduler, Duration.ofMillis(200));
        TransferEvent event = TransferEvents.builder("abc-123").event();

        ProcessingOutcome outcome = orchestrator.processEvent(deliver(TransferEvents.builder("abc-123").payload()))
                .get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertThat(outcome).isEqualTo(ProcessingOutcome.SUCCEEDED);
        assertThat(reads.get()).isEqualTo(2);
        assertThat(scheduler.backoffs).containsExactly(Duration.ofSeconds(1));
        verify(destination, times(1)).write(eq(TransferEvents.DEST_BUCKET), anyString(), any(byte[].class), any());
        verify(destination).write(eq(TransferEvents.DEST_BUCKET), eq(TransferExecutor.temporaryKey(event, 2)),
                any(byte[].class), any());
        verify(destination, times(1)).move(anyString(), anyString(), anyString());
        assertThat(count("transfer.success")).isEqualTo(1);
    }

    @Test
    void exhaustedTimeoutIsDeadLetteredOnlyAfterTheAttemptReturns() throws Exception {
        CountDownLatch readReturned = new CountDownLatch(1);
        ObjectStorage stubbornSource = mock(ObjectStorage.class);
        when(stubbornSource.read(anyString(), anyString())).thenAnswer(invocation -> {
            sleepIgnoringInterrupts(Duration.ofMillis(600));
            readReturned.countDown();
            return new StoredObject(new ByteArrayInputStream(CONTENT.getBytes(StandardCharsets.UTF_8)), "text/csv");
        });
        orchestrator = newOrchestrator(stubbornSource, sink, new RecordingScheduler(), Duration.ofMillis(100));

        ProcessingOutcome outcome = orchestrator.processEvent(
                        deliver(TransferEvents.builder("abc-123").maxRetries(1).payload()))
                .get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertThat(outcome).isEqualTo(ProcessingOutcome.DEAD_LETTERED);
        assertThat(readReturned.getCount()).isZero();
        assertThat(sink.getEntries().get(0).finalErrorKind()).isEqualTo(ErrorKind.TIMEOUT);
        verify(destination, never()).write(anyString(), anyString(), any(byte[].class), any());
        verify(destination, never()).move(anyString(), anyString(), anyString());
    }

    @Test
    void attemptFinishingAfterShutdownAbandonIsNeitherAcknowledgedNorRecorded() throws Exception {
        CountDownLatch readStarted = new CountDownLatch(1);
        CountDownLatch releaseRead = new CountDownLatch(1);
        ObjectStorage slowSource = mock(ObjectStorage.class);
        when(slowSource.read(anyString(), anyString())).thenAnswer(invocation -> {
            readStarted.countDown();
            awaitIgnoringInterrupts(releaseRead);
            return new StoredObject(new ByteArrayInputStream(CONTENT.getBytes(StandardCharsets.UTF_8)), "text/csv");
        });
        orchestrator = newOrchestrator(slowSource, sink, new RecordingScheduler(), ATTEMPT_TIMEOUT);

        QueuedEvent delivery = deliver(TransferEvents.builder("abc-123").payload());
        var outcome = orchestrator.processEvent(delivery);
        assertThat(readStarted.await(WAIT_SECONDS, TimeUnit.SECONDS)).isTrue();

        CompletableFuture<Void> stopping = CompletableFuture.runAsync(
                () -> orchestrator.shutdown(Duration.ofMillis(100)));
        assertThat(outcome.get(WAIT_SECONDS, TimeUnit.SECONDS)).isEqualTo(ProcessingOutcome.ABANDONED);
        releaseRead.countDown();
        stopping.get(WAIT_SECONDS * 2, TimeUnit.SECONDS);

        assertThat(queue.getRejected()).containsExactly(delivery);
        assertThat(queue.getAcknowledged()).isEmpty();
        assertThat(guard.hasProcessed("abc-123")).isFalse();
        assertThat(count("transfer.success")).isZero();
        verify(destination, never()).write(anyString(), anyString(), any(byte[].class), any());
    }

    @Test
    void unclassifiedFailureIsRetried() throws Exception {
        ObjectStorage flakySource = mock(ObjectStorage.class);
        when(flakySource.read(anyString(), anyString()))
                .thenThrow(new IllegalStateException("boom"))
                .thenAnswer(invocation -> new StoredObject(
                        new ByteArrayInputStream(CONTENT.getBytes(StandardCharsets.UTF_8)), "text/csv"));
        RecordingScheduler scheduler = new RecordingScheduler();
        orchestrator = newOrchestrator(flakySource, sink, scheduler, ATTEMPT_TIMEOUT);

        ProcessingOutcome outcome = orchestrator.processEvent(deliver(TransferEvents.builder("abc-123").payload()))
                .get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertThat(outcome).isEqualTo(ProcessingOutcome.SUCCEEDED);
        assertThat(scheduler.backoffs).containsExactly(Duration.ofSeconds(1));
        assertThat(count("transfer.unclassified")).isEqualTo(1);
        assertThat(count("retry.count")).isEqualTo(1);
        assertThat(guard.hasProcessed("abc-123")).isTrue();
    }

    @Test
    void failedDeadLetterDeliveryLeavesEventUnacknowledged() throws Exception {
        DeadLetterSink brokenSink = mock(DeadLetterSink.class);
        doThrow(new DeadLetterDeliveryException("topic unavailable", null)).when(brokenSink).deliver(any());
        orchestrator = newOrchestrator(localSource, brokenSink, new RecordingScheduler(), ATTEMPT_TIMEOUT);

        QueuedEvent delivery = deliver(TransferEvents.builder("abc-123").source("aws_s3", "data/missing.csv").payload());
        ProcessingOutcome outcome = orchestrator.processEvent(delivery).get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertThat(outcome).isEqualTo(ProcessingOutcome.DEAD_LETTER_FAILED);
        assertThat(queue.getAcknowledged()).isEmpty();
        assertThat(queue.getRejected()).containsExactly(delivery);
        assertThat(queue.pendingCount()).isEqualTo(1);
        assertThat(count("dlq.delivery.failed")).isEqualTo(1);
        assertThat(guard.tryClaim("abc-123")).isEqualTo(ClaimResult.CLAIMED);
    }

    @Test
    void shutdownAbandonsEventsWaitingOutABackoff() throws Exception {
        ObjectStorage failingSource = mock(ObjectStorage.class);
        when(failingSource.read(anyString(), anyString()))
                .thenThrow(new StorageNetworkException("connection reset"));
        ScheduledThreadPoolExecutor realScheduler = new ScheduledThreadPoolExecutor(1);
        orchestrator = newOrchestrator(failingSource, sink, realScheduler, ATTEMPT_TIMEOUT,
                new RetryPolicy(Duration.ofMinutes(1), Duration.ofMinutes(2), 3, false));

        QueuedEvent delivery = deliver(TransferEvents.builder("abc-123").payload());
        var outcome = orchestrator.processEvent(delivery);
        awaitTrue(() -> orchestrator.getStatistics().retries == 1);

        orchestrator.shutdown(Duration.ofSeconds(1));

        assertThat(outcome.get(WAIT_SECONDS, TimeUnit.SECONDS)).isEqualTo(ProcessingOutcome.ABANDONED);
        assertThat(queue.getRejected()).containsExactly(delivery);
        assertThat(queue.getAcknowledged()).isEmpty();
        assertThat(sink.getEntries()).isEmpty();
        assertThat(orchestrator.getInFlightCount()).isZero();
        assertThat(guard.tryClaim("abc-123")).isEqualTo(ClaimResult.CLAIMED);
        verify(failingSource, times(1)).read(anyString(), anyString());
    }

    @Test
    void deliveriesAfterShutdownAreRejected() throws Exception {
        orchestrator = newOrchestrator(localSource, sink, new RecordingScheduler(), ATTEMPT_TIMEOUT);
        QueuedEvent delivery = deliver(TransferEvents.builder("abc-123").payload());

        orchestrator.shutdown(Duration.ZERO);

        assertThat(orchestrator.processEvent(delivery).get()).isEqualTo(ProcessingOutcome.ABANDONED);
        assertThat(queue.getRejected()).containsExactly(delivery);
    }

    @Test
    void healthReflectsSuccessRateAndDeadLetters() throws Exception {
        orchestrator = newOrchestrator(localSource, sink, new RecordingScheduler(), ATTEMPT_TIMEOUT);

        WorkerHealth idle = orchestrator.healthSnapshot();
        assertThat(idle.status()).isEqualTo(WorkerHealth.HEALTHY);
        assertThat(idle.successRate()).isEqualTo(100.0);

        orchestrator.processEvent(deliver(TransferEvents.builder("ok-1").payload())).get(WAIT_SECONDS, TimeUnit.SECONDS);
        assertThat(orchestrator.healthSnapshot().isHealthy()).isTrue();

        orchestrator.processEvent(deliver(TransferEvents.builder("bad-1").source("aws_s3", "nope.csv").payload()))
                .get(WAIT_SECONDS, TimeUnit.SECONDS);

        WorkerHealth health = orchestrator.healthSnapshot();
        assertThat(health.status()).isEqualTo(WorkerHealth.DEGRADED);
        assertThat(health.processedCount()).isEqualTo(2);
        assertThat(health.dlqCount()).isEqualTo(1);
        assertThat(health.successRate()).isEqualTo(50.0);
        assertThat(health.inFlight()).isZero();
        assertThat(orchestrator.getStatistics().totalBytes).isEqualTo(CONTENT.length());
    }

    private TransferOrchestrator newOrchestrator(ObjectStorage source, DeadLetterSink deadLetterSink,
                                                 ScheduledExecutorService scheduler, Duration attemptTimeout) {
        return newOrchestrator(source, deadLetterSink, scheduler, attemptTimeout,
                new RetryPolicy(Duration.ofSeconds(1), Duration.ofSeconds(30), 3, false));
    }

    private TransferOrchestrator newOrchestrator(ObjectStorage source, DeadLetterSink deadLetterSink,
                                                 ScheduledExecutorService scheduler, Duration attemptTimeout,
                                                 RetryPolicy retryPolicy) {
        Map<CloudProvider, ObjectStorage> backends = new EnumMap<>(CloudProvider.class);
        backends.put(CloudProvider.AWS_S3, source);
        backends.put(CloudProvider.GCP_GCS, destination);

        MetricsRecorder metrics = new MetricsRecorder(registry);
        StructuredLogger log = new StructuredLogger();
        Clock clock = Clock.systemUTC();
        TransferExecutor executor = new TransferExecutor(new StorageResolver(backends), metrics);
        DeadLetterRouter router = new DeadLetterRouter(deadLetterSink, metrics, log, clock);

        return new TransferOrchestrator(new EventParser(), guard, executor, retryPolicy, router, queue,
                metrics, log, clock, attemptPool, scheduler, attemptTimeout, DEFERRAL_DELAY, 95.0);
    }

    private QueuedEvent deliver(String payload) throws InterruptedException {
        queue.publish(payload);
        return queue.receive(Duration.ZERO).orElseThrow();
    }

    private double count(String name) {
        return registry.find(name).counters().stream().mapToDouble(Counter::count).sum();
    }

    private static void sleepIgnoringInterrupts(Duration duration) {
        long deadline = System.nanoTime() + duration.toNanos();
        long remaining;
        while ((remaining = deadline - System.nanoTime()) > 0) {
            try {
                TimeUnit.NANOSECONDS.sleep(remaining);
            } catch (InterruptedException e) {
                // ignored
            }
        }
    }

    private static void awaitIgnoringInterrupts(CountDownLatch latch) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(WAIT_SECONDS);
        while (latch.getCount() > 0 && System.nanoTime() < deadline) {
            try {
                latch.await(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                // ignored
            }
        }
    }

    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(WAIT_SECONDS);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within " + WAIT_SECONDS + "s");
            }
            Thread.sleep(10);
        }
    }

    /**
     * Runs backoff waits immediately and records the requested delays. Attempt timeouts are kept.
     */
    private static final class RecordingScheduler extends ScheduledThreadPoolExecutor {
        final List<Duration> backoffs = new CopyOnWriteArrayList<>();

        RecordingScheduler() {
            super(1);
            setRemoveOnCancelPolicy(true);
        }

        @Override
        public ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit) {
            Duration requested = Duration.ofNanos(unit.toNanos(delay));
            if (isBackoff(requested)) {
                backoffs.add(requested);
                return super.schedule(command, 0, TimeUnit.MILLISECONDS);
            }
            return super.schedule(command, delay, unit);
        }

        private static boolean isBackoff(Duration requested) {
            return requested.compareTo(Duration.ofSeconds(1)) >= 0 && requested.compareTo(Duration.ofSeconds(30)) <= 0
                    && !requested.equals(ATTEMPT_TIMEOUT);
        }
    }
}
