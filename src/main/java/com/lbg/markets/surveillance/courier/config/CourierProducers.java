package com.lbg.markets.surveillance.courier.config;

import com.lbg.markets.surveillance.courier.service.deadletter.DeadLetterSink;
import com.lbg.markets.surveillance.courier.service.deadletter.InMemoryDeadLetterSink;
import com.lbg.markets.surveillance.courier.service.deadletter.PubSubDeadLetterSink;
import com.lbg.markets.surveillance.courier.service.idempotency.IdempotencyGuard;
import com.lbg.markets.surveillance.courier.service.idempotency.InMemoryIdempotencyGuard;
import com.lbg.markets.surveillance.courier.service.queue.InMemoryTransferQueue;
import com.lbg.markets.surveillance.courier.service.queue.PubSubTransferQueue;
import com.lbg.markets.surveillance.courier.service.queue.TransferQueue;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;

/**
 * Chooses the queue, dead-letter sink and idempotency guard implementations from configuration.
 */
@ApplicationScoped
public class CourierProducers {

    private static final Logger LOG = Logger.getLogger(CourierProducers.class);

    @Produces
    @Singleton
    TransferQueue transferQueue(CourierConfiguration config) {
        if (config.queue().type() == CourierConfiguration.QueueType.PUBSUB) {
            CourierConfiguration.PubSubSubscriptionConfig pubsub = config.queue().pubsub()
                    .orElseThrow(() -> new IllegalStateException(
                            "courier.queue.type=pubsub requires courier.queue.pubsub.*"));
            try {
                return PubSubTransferQueue.create(pubsub);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to create Pub/Sub subscriber", e);
            }
        }
        LOG.info("Using in-memory transfer queue");
        return new InMemoryTransferQueue();
    }

    void closeTransferQueue(@Disposes TransferQueue queue) {
        if (queue instanceof PubSubTransferQueue pubsub) {
            pubsub.close();
        }
    }

    @Produces
    @Singleton
    DeadLetterSink deadLetterSink(CourierConfiguration config) {
        if (config.dlq().type() == CourierConfiguration.QueueType.PUBSUB) {
            CourierConfiguration.PubSubTopicConfig pubsub = config.dlq().pubsub()
                    .orElseThrow(() -> new IllegalStateException(
                            "courier.dlq.type=pubsub requires courier.dlq.pubsub.*"));
            try {
                return PubSubDeadLetterSink.create(pubsub);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to create dead-letter publisher", e);
            }
        }
        LOG.info("Using in-memory dead-letter sink");
        return new InMemoryDeadLetterSink();
    }

    void closeDeadLetterSink(@Disposes DeadLetterSink sink) {
        if (sink instanceof PubSubDeadLetterSink pubsub) {
            try {
                pubsub.close();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted closing dead-letter publisher");
            }
        }
    }

    @Produces
    @Singleton
    IdempotencyGuard idempotencyGuard() {
        return new InMemoryIdempotencyGuard();
    }

    @Produces
    @Singleton
    Clock clock() {
        return Clock.systemUTC();
    }
}
