package com.lbg.markets.surveillance.courier.exception;

import com.lbg.markets.surveillance.courier.model.CloudProvider;

public class UnsupportedProviderException extends TransferException {

    public UnsupportedProviderException(CloudProvider provider) {
        super(ErrorKind.UNSUPPORTED_PROVIDER, "No storage backend configured for provider: " + provider);
    }
}
