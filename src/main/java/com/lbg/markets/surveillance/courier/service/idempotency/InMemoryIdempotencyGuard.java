package com.lbg.markets.surveillance.courier.service.idempotency;

import org.jboss.logging.Logger;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-lifetime idempotency guard. A restart forgets every completion.
 */
public class InMemoryIdempotencyGuard implements IdempotencyGuard {

    private static final Logger LOG = Logger.getLogger(InMemoryIdempotencyGuard.class);

    private enum EntryState {
        IN_FLIGHT,
        COMPLETED
    }

    private final Map<String, EntryState> entries = new ConcurrentHashMap<>();

    @Override
    public boolean hasProcessed(String eventId) {
        return entries.get(eventId) == EntryState.COMPLETED;
    }

    @Override
    public void markProcessed(String eventId) {
        entries.put(eventId, EntryState.COMPLETED);
    }

    @Override
    public ClaimResult tryClaim(String eventId) {
        EntryState previous = entries.putIfAbsent(eventId, EntryState.IN_FLIGHT);
        if (previous == null) {
            return ClaimResult.CLAIMED;
        }
        if (previous == EntryState.COMPLETED) {
            return ClaimResult.ALREADY_PROCESSED;
        }
        LOG.debugf("Event %s is already being processed", eventId);
        return ClaimResult.IN_FLIGHT;
    }

    @Override
    public void release(String eventId) {
        entries.remove(eventId, EntryState.IN_FLIGHT);
    }

    @Override
    public long processedCount() {
        return entries.values().stream()
                .filter(state -> state == EntryState.COMPLETED)
                .count();
    }
}
