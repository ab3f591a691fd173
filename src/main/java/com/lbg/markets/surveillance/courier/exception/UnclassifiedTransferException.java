package com.lbg.markets.surveillance.courier.exception;

/**
 * Wraps a failure that has no explicit classification.
 */
public class UnclassifiedTransferException extends TransferException {

    public UnclassifiedTransferException(String message, Throwable cause) {
        super(ErrorKind.UNCLASSIFIED, message, cause);
    }
}
