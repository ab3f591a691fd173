package com.lbg.markets.surveillance.courier.model;

/**
 * How the orchestrator finished with one delivery.
 */
public enum ProcessingOutcome {

    /**
     * Transferred, recorded as processed, acknowledged.
     */
    SUCCEEDED(true),

    /**
     * Already processed earlier; acknowledged without side effects.
     */
    DUPLICATE(true),

    /**
     * Failed permanently; dead-letter entry delivered, acknowledged.
     */
    DEAD_LETTERED(true),

    /**
     * Payload was not a valid event; logged and acknowledged without retry.
     */
    DROPPED_MALFORMED(true),

    /**
     * Same event id is being processed by another worker; left for redelivery.
     */
    DEFERRED(false),

    /**
     * Dead-letter delivery failed; left for redelivery.
     */
    DEAD_LETTER_FAILED(false),

    /**
     * Abandoned during shutdown; left for redelivery.
     */
    ABANDONED(false);

    private final boolean acknowledged;

    ProcessingOutcome(boolean acknowledged) {
        this.acknowledged = acknowledged;
    }

    public boolean isAcknowledged() {
        return acknowledged;
    }
}
