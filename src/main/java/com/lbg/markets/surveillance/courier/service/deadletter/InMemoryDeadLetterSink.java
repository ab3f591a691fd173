package com.lbg.markets.surveillance.courier.service.deadletter;

import com.lbg.markets.surveillance.courier.model.DeadLetterEntry;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps dead-letter entries in memory for the lifetime of the process.
 */
public class InMemoryDeadLetterSink implements DeadLetterSink {

    private final List<DeadLetterEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public void deliver(DeadLetterEntry entry) {
        entries.add(entry);
    }

    public List<DeadLetterEntry> getEntries() {
        return List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }
}
