package com.lbg.markets.surveillance.courier.model;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.lbg.markets.surveillance.courier.exception.ErrorKind;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Event that failed permanently, with its attempt history.
 * Owned by the dead-letter sink once delivered.
 *
 * @param originalEvent     the event exactly as received
 * @param attempts          one snapshot per executed attempt, in order
 * @param finalErrorKind    kind of the error that ended processing
 * @param finalErrorMessage message of the error that ended processing
 * @param routedAt          when the entry was built
 */
public record DeadLetterEntry(TransferEvent originalEvent,
                              List<AttemptSnapshot> attempts,
                              ErrorKind finalErrorKind,
                              String finalErrorMessage,
                              Instant routedAt) {

    public DeadLetterEntry {
        Objects.requireNonNull(originalEvent, "originalEvent");
        Objects.requireNonNull(finalErrorKind, "finalErrorKind");
        Objects.requireNonNull(routedAt, "routedAt");
        attempts = List.copyOf(attempts);
    }

    /**
     * JSON form for external sinks. The original event is carried as its verbatim wire payload.
     */
    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("eventId", originalEvent.eventId());
        json.addProperty("correlationId", originalEvent.correlationId());
        json.addProperty("originalEvent", originalEvent.toWireFormat());

        JsonArray history = new JsonArray();
        attempts.forEach(a -> history.add(a.toJson()));
        json.add("attempts", history);

        JsonObject finalError = new JsonObject();
        finalError.addProperty("kind", finalErrorKind.getWireName());
        if (finalErrorMessage != null) {
            finalError.addProperty("message", finalErrorMessage);
        }
        json.add("finalError", finalError);
        json.addProperty("routedAt", routedAt.toString());
        return json;
    }
}
