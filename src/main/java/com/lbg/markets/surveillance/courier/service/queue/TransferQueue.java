package com.lbg.markets.surveillance.courier.service.queue;

import java.time.Duration;
import java.util.Optional;

/**
 * Source of transfer events with at-least-once delivery.
 * A delivery that is neither acknowledged nor rejected is eventually redelivered.
 */
public interface TransferQueue {

    /**
     * Wait up to {@code timeout} for the next delivery.
     */
    Optional<QueuedEvent> receive(Duration timeout) throws InterruptedException;

    /**
     * The delivery is fully handled and must not be redelivered.
     */
    void ack(QueuedEvent event);

    /**
     * The delivery was not handled and should be redelivered as soon as possible.
     */
    default void nack(QueuedEvent event) {
        nack(event, Duration.ZERO);
    }

    /**
     * The delivery was not handled and should be redelivered no earlier than {@code redeliveryDelay} from now.
     */
    void nack(QueuedEvent event, Duration redeliveryDelay);

    /**
     * Keep an outstanding delivery from being redelivered for another {@code lease}.
     */
    void extendLease(QueuedEvent event, Duration lease);
}
