package com.lbg.markets.surveillance.courier.exception;

import java.util.List;

/**
 * Inbound payload does not describe a valid transfer event.
 */
public class SchemaValidationException extends TransferException {

    private final List<String> violations;

    public SchemaValidationException(List<String> violations) {
        super(ErrorKind.SCHEMA_VALIDATION, "Schema validation failed: " + String.join(", ", violations));
        this.violations = List.copyOf(violations);
    }

    public SchemaValidationException(String violation, Throwable cause) {
        super(ErrorKind.SCHEMA_VALIDATION, "Schema validation failed: " + violation, cause);
        this.violations = List.of(violation);
    }

    public List<String> getViolations() {
        return violations;
    }
}
