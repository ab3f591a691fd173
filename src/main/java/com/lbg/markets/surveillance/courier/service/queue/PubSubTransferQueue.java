package com.lbg.markets.surveillance.courier.service.queue;

import com.google.cloud.pubsub.v1.stub.GrpcSubscriberStub;
import com.google.cloud.pubsub.v1.stub.SubscriberStub;
import com.google.cloud.pubsub.v1.stub.SubscriberStubSettings;
import com.google.pubsub.v1.AcknowledgeRequest;
import com.google.pubsub.v1.ModifyAckDeadlineRequest;
import com.google.pubsub.v1.ProjectSubscriptionName;
import com.google.pubsub.v1.PullRequest;
import com.google.pubsub.v1.PullResponse;
import com.google.pubsub.v1.ReceivedMessage;
import com.lbg.markets.surveillance.courier.config.CourierConfiguration;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Synchronous-pull Pub/Sub subscription. Messages pulled in a batch are buffered locally
 * and handed out one at a time. Rejection and lease extension both set the message's ack deadline;
 * a zero deadline makes it available for redelivery immediately.
 */
public class PubSubTransferQueue implements TransferQueue, AutoCloseable {

    private static final Logger LOG = Logger.getLogger(PubSubTransferQueue.class);
    static final int MAX_ACK_DEADLINE_SECONDS = 600;

    private final SubscriberStub subscriber;
    private final String subscription;
    private final int maxMessages;
    private final BlockingQueue<QueuedEvent> buffer = new LinkedBlockingQueue<>();

    public PubSubTransferQueue(SubscriberStub subscriber, String subscription, int maxMessages) {
        this.subscriber = subscriber;
        this.subscription = subscription;
        this.maxMessages = maxMessages;
    }

    public static PubSubTransferQueue create(CourierConfiguration.PubSubSubscriptionConfig config) throws IOException {
        SubscriberStubSettings settings = SubscriberStubSettings.newBuilder()
                .setTransportChannelProvider(SubscriberStubSettings.defaultGrpcTransportProviderBuilder().build())
                .build();
        String subscription = ProjectSubscriptionName.format(config.projectId(), config.subscription());
        LOG.infof("Pulling transfer events from subscription: %s", subscription);
        return new PubSubTransferQueue(GrpcSubscriberStub.create(settings), subscription, config.maxMessages());
    }

    @Override
    public Optional<QueuedEvent> receive(Duration timeout) throws InterruptedException {
        QueuedEvent buffered = buffer.poll();
        if (buffered != null) {
            return Optional.of(buffered);
        }

        PullRequest request = PullRequest.newBuilder()
                .setSubscription(subscription)
                .setMaxMessages(maxMessages)
                .build();
        PullResponse response = subscriber.pullCallable().call(request);
        for (ReceivedMessage message : response.getReceivedMessagesList()) {
            buffer.add(new QueuedEvent(message.getAckId(),
                    message.getMessage().getData().toStringUtf8(),
                    Math.max(1, message.getDeliveryAttempt())));
        }
        if (response.getReceivedMessagesCount() > 0) {
            LOG.debugf("Pulled %d messages from %s", response.getReceivedMessagesCount(), subscription);
        }
        return Optional.ofNullable(buffer.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    @Override
    public void ack(QueuedEvent event) {
        subscriber.acknowledgeCallable().call(AcknowledgeRequest.newBuilder()
                .setSubscription(subscription)
                .addAckIds(event.ackId())
                .build());
    }

    @Override
    public void nack(QueuedEvent event, Duration redeliveryDelay) {
        modifyAckDeadline(event, redeliveryDelay);
    }

    @Override
    public void extendLease(QueuedEvent event, Duration lease) {
        modifyAckDeadline(event, lease);
    }

    private void modifyAckDeadline(QueuedEvent event, Duration deadline) {
        subscriber.modifyAckDeadlineCallable().call(ModifyAckDeadlineRequest.newBuilder()
                .setSubscription(subscription)
                .addAckIds(event.ackId())
                .setAckDeadlineSeconds(ackDeadlineSeconds(deadline))
                .build());
    }

    static int ackDeadlineSeconds(Duration deadline) {
        long millis = Math.max(0, deadline.toMillis());
        long seconds = (millis + 999) / 1000;
        return (int) Math.min(MAX_ACK_DEADLINE_SECONDS, seconds);
    }

    @Override
    public void close() {
        subscriber.close();
    }
}
