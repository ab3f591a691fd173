package com.lbg.markets.surveillance.courier.service.queue;

import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process queue. Rejected deliveries go back to the tail once their redelivery delay has passed.
 * Outstanding deliveries never expire, so leases need no extension.
 */
public class InMemoryTransferQueue implements TransferQueue {

    private static final Logger LOG = Logger.getLogger(InMemoryTransferQueue.class);

    private final DelayQueue<PendingDelivery> pending = new DelayQueue<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Map<String, QueuedEvent> outstanding = new ConcurrentHashMap<>();
    private final List<QueuedEvent> acknowledged = new CopyOnWriteArrayList<>();
    private final List<QueuedEvent> rejected = new CopyOnWriteArrayList<>();

    public QueuedEvent publish(String payload) {
        QueuedEvent event = new QueuedEvent(UUID.randomUUID().toString(), payload, 1);
        enqueue(event, Duration.ZERO);
        return event;
    }

    @Override
    public Optional<QueuedEvent> receive(Duration timeout) throws InterruptedException {
        PendingDelivery next = pending.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (next == null) {
            return Optional.empty();
        }
        outstanding.put(next.event.ackId(), next.event);
        return Optional.of(next.event);
    }

    @Override
    public void ack(QueuedEvent event) {
        if (outstanding.remove(event.ackId()) == null) {
            LOG.warnf("Ack for unknown delivery %s", event.ackId());
            return;
        }
        acknowledged.add(event);
    }

    @Override
    public void nack(QueuedEvent event, Duration redeliveryDelay) {
        if (outstanding.remove(event.ackId()) == null) {
            LOG.warnf("Nack for unknown delivery %s", event.ackId());
            return;
        }
        rejected.add(event);
        enqueue(new QueuedEvent(UUID.randomUUID().toString(), event.payload(), event.deliveryAttempt() + 1),
                redeliveryDelay);
    }

    @Override
    public void extendLease(QueuedEvent event, Duration lease) {
        if (!outstanding.containsKey(event.ackId())) {
            LOG.debugf("Lease extension for unknown delivery %s", event.ackId());
        }
    }

    public List<QueuedEvent> getAcknowledged() {
        return List.copyOf(acknowledged);
    }

    public List<QueuedEvent> getRejected() {
        return List.copyOf(rejected);
    }

    /**
     * Deliveries waiting to be received, including those whose redelivery delay has not passed yet.
     */
    public int pendingCount() {
        return pending.size();
    }

    public int outstandingCount() {
        return outstanding.size();
    }

    private void enqueue(QueuedEvent event, Duration delay) {
        pending.add(new PendingDelivery(event, System.nanoTime() + delay.toNanos(), sequence.getAndIncrement()));
    }

    private static final class PendingDelivery implements Delayed {
        private final QueuedEvent event;
        private final long dueNanos;
        private final long seq;

        PendingDelivery(QueuedEvent event, long dueNanos, long seq) {
            this.event = event;
            this.dueNanos = dueNanos;
            this.seq = seq;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(dueNanos - System.nanoTime(), TimeUnit.NANOSECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            PendingDelivery that = (PendingDelivery) other;
            int byDue = Long.compare(dueNanos, that.dueNanos);
            return byDue != 0 ? byDue : Long.compare(seq, that.seq);
        }
    }
}
