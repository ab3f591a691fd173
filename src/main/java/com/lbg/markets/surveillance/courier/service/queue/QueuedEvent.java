package com.lbg.markets.surveillance.courier.service.queue;

/**
 * One delivery of a raw event payload.
 *
 * @param ackId           handle used to acknowledge or reject this delivery
 * @param payload         message body as received
 * @param deliveryAttempt 1 for the first delivery, incremented by redelivery where the queue tracks it
 */
public record QueuedEvent(String ackId, String payload, int deliveryAttempt) {
}
