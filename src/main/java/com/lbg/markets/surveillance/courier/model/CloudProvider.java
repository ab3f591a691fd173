package com.lbg.markets.surveillance.courier.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Storage providers an event may name as source or destination.
 */
public enum CloudProvider {

    AWS_S3("aws_s3"),
    GCP_GCS("gcp_gcs"),

    /**
     * Local filesystem, used for development and simulation.
     */
    LOCAL("local");

    private final String wireName;

    CloudProvider(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Resolve a provider from its wire name, case-insensitive.
     */
    public static Optional<CloudProvider> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(p -> p.wireName.equalsIgnoreCase(value.trim()))
                .findFirst();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
