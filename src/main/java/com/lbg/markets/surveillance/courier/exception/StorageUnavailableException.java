package com.lbg.markets.surveillance.courier.exception;

/**
 * Storage backend reported itself unavailable (5xx class responses).
 */
public class StorageUnavailableException extends TransferException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(ErrorKind.SERVICE_UNAVAILABLE, message, cause);
    }
}
