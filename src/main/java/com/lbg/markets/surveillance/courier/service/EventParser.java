package com.lbg.markets.surveillance.courier.service;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.lbg.markets.surveillance.courier.exception.SchemaValidationException;
import com.lbg.markets.surveillance.courier.model.CloudProvider;
import com.lbg.markets.surveillance.courier.model.ObjectLocation;
import com.lbg.markets.surveillance.courier.model.TransferEvent;
import com.lbg.markets.surveillance.courier.model.TransferMetadata;
import com.lbg.markets.surveillance.courier.model.TransferPriority;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Validates and parses inbound JSON payloads into {@link TransferEvent}s.
 * All violations in a payload are collected before failing.
 */
@ApplicationScoped
public class EventParser {

    static final String SUPPORTED_SCHEMA_MAJOR = "1";

    private static final Pattern SHA256_HEX = Pattern.compile("[0-9a-fA-F]{64}");

    public TransferEvent parse(String payload) throws SchemaValidationException {
        if (payload == null || payload.isBlank()) {
            throw new SchemaValidationException(List.of("payload is empty"));
        }

        JsonObject root;
        try {
            JsonElement element = JsonParser.parseString(payload);
            if (!element.isJsonObject()) {
                throw new SchemaValidationException(List.of("payload is not a JSON object"));
            }
            root = element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new SchemaValidationException("payload is not valid JSON", e);
        }

        List<String> violations = new ArrayList<>();

        String schemaVersion = requiredString(root, "schemaVersion", violations);
        if (schemaVersion != null && !isSupportedVersion(schemaVersion)) {
            violations.add("schemaVersion " + schemaVersion + " is not supported");
        }
        String eventId = requiredString(root, "eventId", violations);
        String correlationId = requiredString(root, "correlationId", violations);
        Instant timestamp = parseTimestamp(requiredString(root, "timestamp", violations), violations);
        ObjectLocation source = parseLocation(root, "source", violations);
        ObjectLocation destination = parseLocation(root, "destination", violations);
        TransferMetadata metadata = parseMetadata(root, violations);

        if (!violations.isEmpty()) {
            throw new SchemaValidationException(violations);
        }

        return new TransferEvent(schemaVersion, eventId, correlationId, timestamp,
                source, destination, metadata, payload);
    }

    /**
     * Best-effort read of a top-level string field from a payload that failed validation,
     * so that the drop can still be logged against its ids.
     */
    public Optional<String> peekField(String payload, String field) {
        try {
            JsonElement element = JsonParser.parseString(payload);
            if (element.isJsonObject()) {
                JsonElement value = element.getAsJsonObject().get(field);
                if (value != null && value.isJsonPrimitive()) {
                    return Optional.of(value.getAsString());
                }
            }
        } catch (JsonParseException | IllegalStateException e) {
            return Optional.empty();
        }
        return Optional.empty();
    }

    private static boolean isSupportedVersion(String version) {
        return version.equals(SUPPORTED_SCHEMA_MAJOR) || version.startsWith(SUPPORTED_SCHEMA_MAJOR + ".");
    }

    private static Instant parseTimestamp(String value, List<String> violations) {
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            violations.add("timestamp is not an ISO-8601 date-time with offset: " + value);
            return null;
        }
    }

    private static ObjectLocation parseLocation(JsonObject root, String field, List<String> violations) {
        JsonObject location = requiredObject(root, field, violations);
        if (location == null) {
            return null;
        }

        String providerName = requiredString(location, "provider", violations, field + ".");
        String bucket = requiredString(location, "bucket", violations, field + ".");
        String key = requiredString(location, "key", violations, field + ".");
        String region = optionalString(location, "region", violations, field + ".");

        CloudProvider provider = null;
        if (providerName != null) {
            provider = CloudProvider.fromWireName(providerName).orElse(null);
            if (provider == null) {
                violations.add(field + ".provider " + providerName + " is not a known provider");
            }
        }

        if (provider == null || bucket == null || key == null) {
            return null;
        }
        return new ObjectLocation(provider, bucket, key, region);
    }

    private static TransferMetadata parseMetadata(JsonObject root, List<String> violations) {
        JsonElement element = root.get("metadata");
        if (element == null || element.isJsonNull()) {
            return TransferMetadata.EMPTY;
        }
        if (!element.isJsonObject()) {
            violations.add("metadata must be an object");
            return TransferMetadata.EMPTY;
        }
        JsonObject metadata = element.getAsJsonObject();

        String contentType = optionalString(metadata, "contentType", violations, "metadata.");

        String checksum = optionalString(metadata, "checksumSHA256", violations, "metadata.");
        if (checksum != null) {
            if (SHA256_HEX.matcher(checksum).matches()) {
                checksum = checksum.toLowerCase(Locale.ROOT);
            } else {
                violations.add("metadata.checksumSHA256 must be 64 hex characters");
                checksum = null;
            }
        }

        Integer maxRetries = null;
        JsonElement maxRetriesElement = metadata.get("maxRetries");
        if (maxRetriesElement != null && !maxRetriesElement.isJsonNull()) {
            maxRetries = positiveInt(maxRetriesElement);
            if (maxRetries == null) {
                violations.add("metadata.maxRetries must be a positive integer");
            }
        }

        TransferPriority priority = TransferPriority.NORMAL;
        String priorityName = optionalString(metadata, "priority", violations, "metadata.");
        if (priorityName != null) {
            Optional<TransferPriority> parsed = TransferPriority.fromWireName(priorityName);
            if (parsed.isPresent()) {
                priority = parsed.get();
            } else {
                violations.add("metadata.priority " + priorityName + " is not one of low, normal, high");
            }
        }

        return new TransferMetadata(contentType, checksum, maxRetries, priority);
    }

    private static Integer positiveInt(JsonElement element) {
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            return null;
        }
        try {
            int value = element.getAsJsonPrimitive().getAsBigDecimal().intValueExact();
            return value >= 1 ? value : null;
        } catch (ArithmeticException e) {
            return null;
        }
    }

    private static JsonObject requiredObject(JsonObject parent, String field, List<String> violations) {
        JsonElement element = parent.get(field);
        if (element == null || element.isJsonNull()) {
            violations.add(field + " is required");
            return null;
        }
        if (!element.isJsonObject()) {
            violations.add(field + " must be an object");
            return null;
        }
        return element.getAsJsonObject();
    }

    private static String requiredString(JsonObject parent, String field, List<String> violations) {
        return requiredString(parent, field, violations, "");
    }

    private static String requiredString(JsonObject parent, String field, List<String> violations,
                                         String path) {
        JsonElement element = parent.get(field);
        if (element == null || element.isJsonNull()) {
            violations.add(path + field + " is required");
            return null;
        }
        String value = stringValue(element);
        if (value == null) {
            violations.add(path + field + " must be a string");
            return null;
        }
        if (value.isBlank()) {
            violations.add(path + field + " must not be blank");
            return null;
        }
        return value;
    }

    private static String optionalString(JsonObject parent, String field, List<String> violations,
                                         String path) {
        JsonElement element = parent.get(field);
        if (element == null || element.isJsonNull()) {
            return null;
        }
        String value = stringValue(element);
        if (value == null) {
            violations.add(path + field + " must be a string");
        }
        return value;
    }

    private static String stringValue(JsonElement element) {
        if (element.isJsonPrimitive()) {
            JsonPrimitive primitive = element.getAsJsonPrimitive();
            if (primitive.isString()) {
                return primitive.getAsString();
            }
        }
        return null;
    }
}
