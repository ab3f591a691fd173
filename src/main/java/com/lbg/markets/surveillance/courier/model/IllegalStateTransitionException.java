package com.lbg.markets.surveillance.courier.model;

/**
 * Exception thrown when an invalid state transition is attempted.
 */
public class IllegalStateTransitionException extends IllegalStateException {
    private final TransferState fromState;
    private final TransferState toState;

    public IllegalStateTransitionException(TransferState from, TransferState to) {
        super(String.format("Invalid state transition from %s to %s",
                from.getDisplayName(), to.getDisplayName()));
        this.fromState = from;
        this.toState = to;
    }

    public TransferState getFromState() {
        return fromState;
    }

    public TransferState getToState() {
        return toState;
    }
}
