package com.lbg.markets.surveillance.courier.model;

import com.lbg.markets.surveillance.courier.exception.ErrorKind;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable retry bookkeeping for one in-flight event.
 * Owned by the orchestrator for the duration of processing and discarded on a terminal outcome.
 * Attempts of one event never overlap, but consecutive attempts may run on different threads,
 * so access is synchronized.
 */
public class AttemptRecord {

    private final String eventId;
    private final List<AttemptSnapshot> history = new ArrayList<>();

    private TransferState state = TransferState.PENDING;
    private int attempts = 0;
    private ErrorKind lastErrorKind;
    private String lastErrorMessage;
    private Duration nextRetryDelay;
    private Instant attemptStartedAt;

    public AttemptRecord(String eventId) {
        this.eventId = eventId;
    }

    /**
     * Move to ATTEMPTING and count the attempt.
     *
     * @return the 1-based number of the attempt being started
     */
    public synchronized int beginAttempt(Instant now) {
        moveTo(TransferState.ATTEMPTING);
        attempts++;
        nextRetryDelay = null;
        attemptStartedAt = now;
        return attempts;
    }

    public synchronized void recordSuccess(Instant now) {
        moveTo(TransferState.SUCCEEDED);
        lastErrorKind = null;
        lastErrorMessage = null;
        snapshot(now);
    }

    public synchronized void recordRetry(ErrorKind kind, String message, Duration delay, Instant now) {
        moveTo(TransferState.RETRYING);
        lastErrorKind = kind;
        lastErrorMessage = message;
        nextRetryDelay = delay;
        snapshot(now);
    }

    public synchronized void recordExhausted(ErrorKind kind, String message, Instant now) {
        moveTo(TransferState.EXHAUSTED);
        lastErrorKind = kind;
        lastErrorMessage = message;
        nextRetryDelay = null;
        snapshot(now);
    }

    private void moveTo(TransferState next) {
        state.validateTransition(next);
        state = next;
    }

    private void snapshot(Instant now) {
        Instant started = attemptStartedAt != null ? attemptStartedAt : now;
        history.add(new AttemptSnapshot(attempts, state, lastErrorKind, lastErrorMessage,
                nextRetryDelay, started, Duration.between(started, now)));
    }

    public String getEventId() {
        return eventId;
    }

    public synchronized TransferState getState() {
        return state;
    }

    public synchronized int getAttempts() {
        return attempts;
    }

    public synchronized ErrorKind getLastErrorKind() {
        return lastErrorKind;
    }

    public synchronized String getLastErrorMessage() {
        return lastErrorMessage;
    }

    public synchronized Duration getNextRetryDelay() {
        return nextRetryDelay;
    }

    /**
     * Ordered snapshots, one per finished attempt.
     */
    public synchronized List<AttemptSnapshot> getHistory() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }
}
