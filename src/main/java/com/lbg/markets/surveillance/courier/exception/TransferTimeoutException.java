package com.lbg.markets.surveillance.courier.exception;

import java.time.Duration;

/**
 * A transfer attempt did not finish within the attempt timeout.
 */
public class TransferTimeoutException extends TransferException {

    private final Duration timeout;

    public TransferTimeoutException(Duration timeout) {
        super(ErrorKind.TIMEOUT, "Transfer attempt timed out after " + timeout);
        this.timeout = timeout;
    }

    public TransferTimeoutException(String message) {
        super(ErrorKind.TIMEOUT, message);
        this.timeout = null;
    }

    public TransferTimeoutException(String message, Throwable cause) {
        super(ErrorKind.TIMEOUT, message, cause);
        this.timeout = null;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
