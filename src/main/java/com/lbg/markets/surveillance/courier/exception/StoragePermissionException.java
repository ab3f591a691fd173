package com.lbg.markets.surveillance.courier.exception;

public class StoragePermissionException extends TransferException {

    public StoragePermissionException(String message) {
        super(ErrorKind.PERMISSION_DENIED, message);
    }

    public StoragePermissionException(String message, Throwable cause) {
        super(ErrorKind.PERMISSION_DENIED, message, cause);
    }
}
