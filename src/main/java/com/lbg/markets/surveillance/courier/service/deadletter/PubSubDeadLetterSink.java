package com.lbg.markets.surveillance.courier.service.deadletter;

import com.google.api.core.ApiFuture;
import com.google.cloud.pubsub.v1.Publisher;
import com.google.protobuf.ByteString;
import com.google.pubsub.v1.PubsubMessage;
import com.google.pubsub.v1.TopicName;
import com.lbg.markets.surveillance.courier.config.CourierConfiguration;
import com.lbg.markets.surveillance.courier.exception.DeadLetterDeliveryException;
import com.lbg.markets.surveillance.courier.model.DeadLetterEntry;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes dead-letter entries to a Pub/Sub topic as JSON.
 */
public class PubSubDeadLetterSink implements DeadLetterSink, AutoCloseable {

    private static final Logger LOG = Logger.getLogger(PubSubDeadLetterSink.class);

    private final Publisher publisher;
    private final Duration publishTimeout;

    public PubSubDeadLetterSink(Publisher publisher, Duration publishTimeout) {
        this.publisher = publisher;
        this.publishTimeout = publishTimeout;
    }

    public static PubSubDeadLetterSink create(CourierConfiguration.PubSubTopicConfig config) throws IOException {
        TopicName topicName = TopicName.of(config.projectId(), config.topic());
        Publisher publisher = Publisher.newBuilder(topicName).build();
        LOG.infof("Initialized dead-letter publisher for topic: %s", topicName);
        return new PubSubDeadLetterSink(publisher, config.publishTimeout());
    }

    @Override
    public void deliver(DeadLetterEntry entry) throws DeadLetterDeliveryException {
        PubsubMessage message = PubsubMessage.newBuilder()
                .setData(ByteString.copyFromUtf8(entry.toJson().toString()))
                .putAttributes("eventId", entry.originalEvent().eventId())
                .putAttributes("correlationId", entry.originalEvent().correlationId())
                .putAttributes("errorKind", entry.finalErrorKind().getWireName())
                .build();

        ApiFuture<String> future = publisher.publish(message);
        try {
            String messageId = future.get(publishTimeout.toMillis(), TimeUnit.MILLISECONDS);
            LOG.debugf("Published dead-letter entry for %s as message %s",
                    entry.originalEvent().eventId(), messageId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeadLetterDeliveryException("Interrupted publishing dead-letter entry", e);
        } catch (ExecutionException e) {
            throw new DeadLetterDeliveryException("Dead-letter publish failed: " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new DeadLetterDeliveryException("Dead-letter publish timed out after " + publishTimeout, e);
        }
    }

    @Override
    public void close() throws InterruptedException {
        publisher.shutdown();
        publisher.awaitTermination(10, TimeUnit.SECONDS);
    }
}
