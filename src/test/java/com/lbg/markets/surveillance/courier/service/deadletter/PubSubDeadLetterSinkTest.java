package com.lbg.markets.surveillance.courier.service.deadletter;

import com.google.api.core.ApiFutures;
import com.google.api.core.SettableApiFuture;
import com.google.cloud.pubsub.v1.Publisher;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.pubsub.v1.PubsubMessage;
import com.lbg.markets.surveillance.courier.TransferEvents;
import com.lbg.markets.surveillance.courier.exception.DeadLetterDeliveryException;
import com.lbg.markets.surveillance.courier.exception.ErrorKind;
import com.lbg.markets.surveillance.courier.model.DeadLetterEntry;
import com.lbg.markets.surveillance.courier.model.TransferEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PubSubDeadLetterSinkTest {

    @Mock
    Publisher publisher;

    private final TransferEvent event = TransferEvents.builder("abc-123").event();
    private final DeadLetterEntry entry = new DeadLetterEntry(event, List.of(), ErrorKind.SOURCE_NOT_FOUND,
            "missing", Instant.parse("2024-01-15T10:31:00Z"));

    @Test
    void publishesEntryAsJsonWithIdAttributes() throws Exception {
        when(publisher.publish(any())).thenReturn(ApiFutures.immediateFuture("msg-1"));

        new PubSubDeadLetterSink(publisher, Duration.ofSeconds(1)).deliver(entry);

        ArgumentCaptor<PubsubMessage> captor = ArgumentCaptor.forClass(PubsubMessage.class);
        verify(publisher).publish(captor.capture());
        PubsubMessage message = captor.getValue();
        JsonObject body = JsonParser.parseString(message.getData().toStringUtf8()).getAsJsonObject();
        assertThat(body.get("originalEvent").getAsString()).isEqualTo(event.rawPayload());
        assertThat(message.getAttributesMap())
                .containsEntry("eventId", "abc-123")
                .containsEntry("correlationId", "corr-1")
                .containsEntry("errorKind", "SourceNotFoundError");
    }

    @Test
    void publishFailureBecomesDeliveryException() {
        when(publisher.publish(any())).thenReturn(ApiFutures.immediateFailedFuture(new RuntimeException("denied")));

        assertThatThrownBy(() -> new PubSubDeadLetterSink(publisher, Duration.ofSeconds(1)).deliver(entry))
                .isInstanceOf(DeadLetterDeliveryException.class)
                .hasMessageContaining("denied");
    }

    @Test
    void publishTimeoutBecomesDeliveryException() {
        when(publisher.publish(any())).thenReturn(SettableApiFuture.create());

        assertThatThrownBy(() -> new PubSubDeadLetterSink(publisher, Duration.ofMillis(50)).deliver(entry))
                .isInstanceOf(DeadLetterDeliveryException.class)
                .hasMessageContaining("timed out");
    }
}
