package com.lbg.markets.surveillance.courier.exception;

/**
 * Connection or I/O failure talking to a storage backend.
 */
public class StorageNetworkException extends TransferException {

    public StorageNetworkException(String message) {
        super(ErrorKind.NETWORK, message);
    }

    public StorageNetworkException(String message, Throwable cause) {
        super(ErrorKind.NETWORK, message, cause);
    }
}
