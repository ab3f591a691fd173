package com.lbg.markets.surveillance.courier.service;

import com.lbg.markets.surveillance.courier.config.CourierConfiguration;
import com.lbg.markets.surveillance.courier.dto.OrchestratorStatistics;
import com.lbg.markets.surveillance.courier.service.queue.QueuedEvent;
import com.lbg.markets.surveillance.courier.service.queue.TransferQueue;
import io.quarkus.runtime.Startup;
import io.quarkus.scheduler.Scheduled;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Pulls deliveries off the queue and hands them to the orchestrator.
 * At most {@code max-in-flight} deliveries are being processed at any time.
 */
@ApplicationScoped
@Startup
public class TransferWorker {

    private static final Logger LOG = Logger.getLogger(TransferWorker.class);

    private final TransferQueue queue;
    private final TransferOrchestrator orchestrator;
    private final boolean enabled;
    private final String nodeName;
    private final Duration pollTimeout;
    private final Duration shutdownGrace;
    private final Duration leaseDuration;
    private final Semaphore inFlightPermits;

    private volatile boolean running = false;
    private volatile boolean started = false;
    private Thread dispatcher;

    @Inject
    public TransferWorker(TransferQueue queue, TransferOrchestrator orchestrator, CourierConfiguration config) {
        this(queue, orchestrator, config.worker().enabled(), config.nodeName(),
                config.worker().pollTimeout(), config.worker().shutdownGrace(), config.worker().maxInFlight(),
                config.queue().leaseDuration());
    }

    public TransferWorker(TransferQueue queue, TransferOrchestrator orchestrator, boolean enabled, String nodeName,
                          Duration pollTimeout, Duration shutdownGrace, int maxInFlight, Duration leaseDuration) {
        this.queue = queue;
        this.orchestrator = orchestrator;
        this.enabled = enabled;
        this.nodeName = nodeName;
        this.pollTimeout = pollTimeout;
        this.shutdownGrace = shutdownGrace;
        this.leaseDuration = leaseDuration;
        this.inFlightPermits = new Semaphore(maxInFlight);
    }

    @PostConstruct
    void init() {
        if (!enabled) {
            LOG.info("Transfer worker disabled");
            return;
        }
        start();
    }

    @PreDestroy
    void destroy() {
        stop();
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        started = true;
        dispatcher = new Thread(this::dispatchLoop, "courier-dispatcher");
        dispatcher.setDaemon(false);
        dispatcher.start();
        LOG.infof("Transfer worker started on node %s", nodeName);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        LOG.info("Stopping transfer worker");
        running = false;
        try {
            dispatcher.join(pollTimeout.toMillis() * 2);
            if (dispatcher.isAlive()) {
                dispatcher.interrupt();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        orchestrator.shutdown(shutdownGrace);
        LOG.info("Transfer worker stopped");
    }

    private void dispatchLoop() {
        LOG.debug("Dispatcher thread started");

        while (running) {
            try {
                if (!inFlightPermits.tryAcquire(pollTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    continue;
                }
                Optional<QueuedEvent> delivery = receive();
                if (delivery.isEmpty()) {
                    inFlightPermits.release();
                    continue;
                }
                orchestrator.processEvent(delivery.get())
                        .whenComplete((outcome, error) -> inFlightPermits.release());

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        LOG.debug("Dispatcher thread stopped");
    }

    private Optional<QueuedEvent> receive() throws InterruptedException {
        try {
            return queue.receive(pollTimeout);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to receive from transfer queue; retrying in %s", pollTimeout);
            Thread.sleep(pollTimeout.toMillis());
            return Optional.empty();
        }
    }

    /**
     * Keep deliveries that are still being processed, including those waiting out a backoff,
     * from being redelivered by the queue.
     */
    @Scheduled(every = "{courier.queue.lease-renewal-interval}")
    void renewLeases() {
        if (!running) {
            return;
        }
        for (QueuedEvent delivery : orchestrator.activeDeliveries()) {
            try {
                queue.extendLease(delivery, leaseDuration);
            } catch (RuntimeException e) {
                LOG.warnf(e, "Failed to extend lease of delivery %s", delivery.ackId());
            }
        }
    }

    @Scheduled(every = "{courier.stats.report-interval}")
    void reportStatistics() {
        if (!running) {
            return;
        }
        OrchestratorStatistics stats = orchestrator.getStatistics();
        LOG.infof("Worker stats - Processed: %d, Succeeded: %d, Failed: %d, DLQ: %d, Success rate: %.2f%%, "
                        + "Avg duration: %.3fs, In flight: %d",
                stats.totalProcessed, stats.totalSuccessful, stats.totalFailed, stats.deadLettered,
                stats.successRate, stats.avgDurationSeconds, stats.inFlight);
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * True unless the worker was started and has since stopped or lost its dispatcher thread.
     */
    public boolean isAlive() {
        if (!started) {
            return true;
        }
        Thread thread = dispatcher;
        return running && thread != null && thread.isAlive();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getNodeName() {
        return nodeName;
    }
}
