package com.lbg.markets.surveillance.courier.model;

import com.google.gson.JsonObject;

import java.util.Objects;

/**
 * Optional transfer attributes.
 *
 * @param contentType    content type to apply at the destination, may be null
 * @param checksumSha256 expected lower-case hex SHA-256 of the object, may be null
 * @param maxRetries     attempt budget, null when the event did not set one
 * @param priority       priority hint
 */
public record TransferMetadata(String contentType,
                               String checksumSha256,
                               Integer maxRetries,
                               TransferPriority priority) {

    public static final TransferMetadata EMPTY = new TransferMetadata(null, null, null, TransferPriority.NORMAL);

    public TransferMetadata {
        Objects.requireNonNull(priority, "priority");
    }

    public boolean hasChecksum() {
        return checksumSha256 != null && !checksumSha256.isEmpty();
    }

    /**
     * Attempt budget for this event, falling back when the event did not set one.
     */
    public int maxRetriesOr(int fallback) {
        return maxRetries != null ? maxRetries : fallback;
    }

    JsonObject toJson() {
        JsonObject json = new JsonObject();
        if (contentType != null) {
            json.addProperty("contentType", contentType);
        }
        if (checksumSha256 != null) {
            json.addProperty("checksumSHA256", checksumSha256);
        }
        if (maxRetries != null) {
            json.addProperty("maxRetries", maxRetries);
        }
        json.addProperty("priority", priority.getWireName());
        return json;
    }
}
