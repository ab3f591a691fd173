package com.lbg.markets.surveillance.courier.exception;

public class SourceNotFoundException extends TransferException {

    public SourceNotFoundException(String bucket, String key) {
        this(bucket, key, null);
    }

    public SourceNotFoundException(String bucket, String key, Throwable cause) {
        super(ErrorKind.SOURCE_NOT_FOUND, "Object not found: " + bucket + "/" + key, cause);
    }
}
