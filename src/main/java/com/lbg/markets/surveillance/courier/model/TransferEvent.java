package com.lbg.markets.surveillance.courier.model;

import com.google.gson.JsonObject;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable request to move one object from a source location to a destination location.
 * <p>
 * {@code eventId} identifies one logical transfer and is the deduplication key;
 * {@code correlationId} is a tracing key shared by related events and is not unique.
 * <p>
 * Events parsed from the wire keep the exact payload they were parsed from in
 * {@code rawPayload}, so that a dead-lettered event can be handed on unaltered.
 */
public record TransferEvent(String schemaVersion,
                            String eventId,
                            String correlationId,
                            Instant timestamp,
                            ObjectLocation source,
                            ObjectLocation destination,
                            TransferMetadata metadata,
                            String rawPayload) {

    public TransferEvent {
        Objects.requireNonNull(schemaVersion, "schemaVersion");
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(correlationId, "correlationId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(destination, "destination");
        metadata = metadata != null ? metadata : TransferMetadata.EMPTY;
    }

    /**
     * Wire form of this event. Returns the original payload when the event came off the wire.
     */
    public String toWireFormat() {
        return rawPayload != null ? rawPayload : toJson().toString();
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("schemaVersion", schemaVersion);
        json.addProperty("eventId", eventId);
        json.addProperty("correlationId", correlationId);
        json.addProperty("timestamp", timestamp.toString());
        json.add("source", source.toJson());
        json.add("destination", destination.toJson());
        json.add("metadata", metadata.toJson());
        return json;
    }

    @Override
    public String toString() {
        return "TransferEvent[" + eventId + " " + source + " -> " + destination + "]";
    }
}
