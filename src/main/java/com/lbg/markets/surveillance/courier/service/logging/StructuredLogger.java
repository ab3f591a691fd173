package com.lbg.markets.surveillance.courier.service.logging;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.lbg.markets.surveillance.courier.model.TransferEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Emits one JSON object per log line carrying the event's correlation and event ids.
 * <p>
 * Record shape: {@code timestamp, level, service, correlation_id, event_id, message}
 * followed by call-specific fields such as {@code attempt}, {@code duration_seconds},
 * {@code bytes_transferred} and {@code error_kind}.
 */
@ApplicationScoped
public class StructuredLogger {

    private static final Logger LOG = Logger.getLogger("com.lbg.markets.surveillance.courier.transfer");
    private static final String SERVICE_NAME = "courier";

    private final Logger logger;
    private final Clock clock;
    private final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

    @Inject
    public StructuredLogger() {
        this(LOG, Clock.systemUTC());
    }

    public StructuredLogger(Logger logger, Clock clock) {
        this.logger = logger;
        this.clock = clock;
    }

    public void info(TransferEvent event, String message, Map<String, ?> fields) {
        log(Logger.Level.INFO, event, message, fields, null);
    }

    public void warn(TransferEvent event, String message, Map<String, ?> fields) {
        log(Logger.Level.WARN, event, message, fields, null);
    }

    public void error(TransferEvent event, String message, Map<String, ?> fields) {
        log(Logger.Level.ERROR, event, message, fields, null);
    }

    public void error(TransferEvent event, String message, Map<String, ?> fields, Throwable error) {
        log(Logger.Level.ERROR, event, message, fields, error);
    }

    /**
     * Highest severity. Reserved for conditions that may have lost an event.
     */
    public void fatal(TransferEvent event, String message, Map<String, ?> fields, Throwable error) {
        log(Logger.Level.FATAL, event, message, fields, error);
    }

    /**
     * Log a record for a payload that never became an event. Ids are whatever could be salvaged.
     */
    public void warnUnparsed(String correlationId, String eventId, String message, Map<String, ?> fields) {
        emit(Logger.Level.WARN, correlationId, eventId, message, fields, null);
    }

    private void log(Logger.Level level, TransferEvent event, String message,
                     Map<String, ?> fields, Throwable error) {
        emit(level, event.correlationId(), event.eventId(), message, fields, error);
    }

    private void emit(Logger.Level level, String correlationId, String eventId, String message,
                      Map<String, ?> fields, Throwable error) {
        if (!logger.isEnabled(level)) {
            return;
        }
        logger.log(level, render(level, correlationId, eventId, message, fields), error);
    }

    String render(Logger.Level level, String correlationId, String eventId, String message,
                  Map<String, ?> fields) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("timestamp", clock.instant().toString());
        record.put("level", level.name());
        record.put("service", SERVICE_NAME);
        record.put("correlation_id", correlationId);
        record.put("event_id", eventId);
        record.put("message", message);
        if (fields != null) {
            fields.forEach((k, v) -> {
                if (v != null) {
                    record.putIfAbsent(k, v);
                }
            });
        }

        JsonObject json = new JsonObject();
        record.forEach((k, v) -> json.add(k, toJsonValue(v)));
        return gson.toJson(json);
    }

    private JsonElement toJsonValue(Object value) {
        if (value instanceof JsonElement element) {
            return element;
        }
        if (value instanceof Number || value instanceof Boolean || value instanceof String) {
            return gson.toJsonTree(value);
        }
        return value == null ? gson.toJsonTree(null) : gson.toJsonTree(value.toString());
    }
}
