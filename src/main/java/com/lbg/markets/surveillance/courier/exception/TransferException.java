package com.lbg.markets.surveillance.courier.exception;

import java.util.Objects;

/**
 * Base class for every failure a transfer attempt can surface.
 */
public abstract class TransferException extends Exception {

    private final ErrorKind kind;

    protected TransferException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    protected TransferException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind getKind() {
        return kind;
    }
}
