package com.lbg.markets.surveillance.courier.service.idempotency;

/**
 * Result of trying to claim an event id for processing.
 */
public enum ClaimResult {

    /**
     * The caller now owns the event id and must either mark it processed or release it.
     */
    CLAIMED,

    /**
     * The event id already completed successfully.
     */
    ALREADY_PROCESSED,

    /**
     * Another caller currently owns the event id.
     */
    IN_FLIGHT
}
