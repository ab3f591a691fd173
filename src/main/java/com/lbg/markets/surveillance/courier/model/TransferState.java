package com.lbg.markets.surveillance.courier.model;

import java.util.Set;

/**
 * Retry state machine for one event.
 * <pre>
 * PENDING -> ATTEMPTING -> SUCCEEDED
 *                       -> RETRYING -> ATTEMPTING
 *                       -> EXHAUSTED
 * </pre>
 */
public enum TransferState {

    /**
     * Claimed but no attempt started yet. Initial state.
     */
    PENDING("Pending", false),

    /**
     * An attempt is running.
     */
    ATTEMPTING("Attempting", false),

    /**
     * Last attempt failed with a retryable error; waiting out the backoff delay.
     */
    RETRYING("Retrying", false),

    /**
     * Transfer completed and verified. Terminal.
     */
    SUCCEEDED("Succeeded", true),

    /**
     * Attempt budget spent or fatal error hit. Terminal, event goes to the dead-letter queue.
     */
    EXHAUSTED("Exhausted", true);

    private final String displayName;
    private final boolean terminal;

    TransferState(String displayName, boolean terminal) {
        this.displayName = displayName;
        this.terminal = terminal;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public boolean canTransitionTo(TransferState next) {
        return switch (this) {
            case PENDING -> next == ATTEMPTING;
            case ATTEMPTING -> Set.of(SUCCEEDED, RETRYING, EXHAUSTED).contains(next);
            case RETRYING -> next == ATTEMPTING;
            case SUCCEEDED, EXHAUSTED -> false;
        };
    }

    /**
     * Validate a transition and throw if it is not allowed.
     */
    public void validateTransition(TransferState next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStateTransitionException(this, next);
        }
    }

    @Override
    public String toString() {
        return displayName;
    }
}
