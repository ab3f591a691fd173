package com.lbg.markets.surveillance.courier.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Priority hint carried in event metadata. Informational only; events are not reordered.
 */
public enum TransferPriority {

    LOW("low"),
    NORMAL("normal"),
    HIGH("high");

    private final String wireName;

    TransferPriority(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<TransferPriority> fromWireName(String value) {
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
