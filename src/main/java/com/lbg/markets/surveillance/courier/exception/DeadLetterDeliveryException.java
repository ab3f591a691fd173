package com.lbg.markets.surveillance.courier.exception;

/**
 * A dead-letter entry could not be handed to the dead-letter sink.
 */
public class DeadLetterDeliveryException extends Exception {

    public DeadLetterDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
