package com.lbg.markets.surveillance.courier.exception;

public class RateLimitedException extends TransferException {

    public RateLimitedException(String message, Throwable cause) {
        super(ErrorKind.RATE_LIMITED, message, cause);
    }
}
