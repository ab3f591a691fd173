package com.lbg.markets.surveillance.courier.model;

import com.google.gson.JsonObject;
import com.lbg.markets.surveillance.courier.exception.ErrorKind;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable copy of an {@link AttemptRecord} taken when one attempt finished.
 *
 * @param attempt        1-based attempt number
 * @param state          state the record moved to after this attempt
 * @param errorKind      failure kind, null for a successful attempt
 * @param errorMessage   failure message, null for a successful attempt
 * @param nextRetryDelay backoff scheduled after this attempt, null unless retrying
 * @param startedAt      attempt start
 * @param duration       attempt wall time
 */
public record AttemptSnapshot(int attempt,
                              TransferState state,
                              ErrorKind errorKind,
                              String errorMessage,
                              Duration nextRetryDelay,
                              Instant startedAt,
                              Duration duration) {

    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("attempt", attempt);
        json.addProperty("state", state.name());
        if (errorKind != null) {
            json.addProperty("errorKind", errorKind.getWireName());
        }
        if (errorMessage != null) {
            json.addProperty("errorMessage", errorMessage);
        }
        if (nextRetryDelay != null) {
            json.addProperty("nextRetryDelaySeconds", nextRetryDelay.toMillis() / 1000.0);
        }
        json.addProperty("startedAt", startedAt.toString());
        json.addProperty("durationSeconds", duration.toNanos() / 1_000_000_000.0);
        return json;
    }
}
