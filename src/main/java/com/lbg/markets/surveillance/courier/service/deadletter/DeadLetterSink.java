package com.lbg.markets.surveillance.courier.service.deadletter;

import com.lbg.markets.surveillance.courier.exception.DeadLetterDeliveryException;
import com.lbg.markets.surveillance.courier.model.DeadLetterEntry;

/**
 * Destination for events that failed permanently. Implementations must be safe for concurrent use.
 */
public interface DeadLetterSink {

    /**
     * Deliver an entry. Returns only once the sink has accepted it.
     */
    void deliver(DeadLetterEntry entry) throws DeadLetterDeliveryException;
}
