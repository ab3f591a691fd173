package com.lbg.markets.surveillance.courier.exception;

/**
 * Error taxonomy for transfer processing.
 * Each kind carries the name written to logs and dead-letter entries and its default classification.
 */
public enum ErrorKind {

    /**
     * Payload does not match the event schema. Dropped before any attempt.
     */
    SCHEMA_VALIDATION("SchemaValidationError", FailureClassification.FATAL),

    SOURCE_NOT_FOUND("SourceNotFoundError", FailureClassification.FATAL),

    PERMISSION_DENIED("PermissionError", FailureClassification.FATAL),

    /**
     * Transferred bytes do not hash to the checksum in the event metadata.
     */
    CHECKSUM_MISMATCH("ChecksumMismatchError", FailureClassification.FATAL),

    /**
     * Event names a provider this deployment has no storage backend for.
     */
    UNSUPPORTED_PROVIDER("UnsupportedProviderError", FailureClassification.FATAL),

    NETWORK("NetworkError", FailureClassification.RETRYABLE),

    TIMEOUT("TimeoutError", FailureClassification.RETRYABLE),

    RATE_LIMITED("RateLimitError", FailureClassification.RETRYABLE),

    SERVICE_UNAVAILABLE("ServiceUnavailableError", FailureClassification.RETRYABLE),

    /**
     * Anything not explicitly classified. Retried so that events are never silently lost.
     */
    UNCLASSIFIED("UnclassifiedError", FailureClassification.RETRYABLE);

    private final String wireName;
    private final FailureClassification defaultClassification;

    ErrorKind(String wireName, FailureClassification defaultClassification) {
        this.wireName = wireName;
        this.defaultClassification = defaultClassification;
    }

    public String getWireName() {
        return wireName;
    }

    public FailureClassification getDefaultClassification() {
        return defaultClassification;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
