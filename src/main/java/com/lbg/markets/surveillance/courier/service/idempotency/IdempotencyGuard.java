package com.lbg.markets.surveillance.courier.service.idempotency;

/**
 * Tracks which event ids have completed, so that a redelivered event is never transferred twice.
 * <p>
 * {@link #tryClaim(String)} is the atomic check: of any number of concurrent callers presenting
 * the same event id, at most one gets {@link ClaimResult#CLAIMED}. The owner ends its claim with
 * {@link #markProcessed(String)} on success or {@link #release(String)} on any other outcome.
 * <p>
 * Implementations must be safe for concurrent use. Durability is up to the implementation.
 */
public interface IdempotencyGuard {

    boolean hasProcessed(String eventId);

    /**
     * Record a successful transfer. Ends any claim held on the id.
     */
    void markProcessed(String eventId);

    ClaimResult tryClaim(String eventId);

    /**
     * Drop a claim without recording completion. Has no effect on a completed id.
     */
    void release(String eventId);

    long processedCount();
}
