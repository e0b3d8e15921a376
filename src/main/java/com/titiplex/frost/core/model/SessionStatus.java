package com.titiplex.frost.core.model;

import java.util.Locale;

public enum SessionStatus {
    PENDING,
    NONCE_COLLECTION,
    SIGNING,
    AGGREGATING,
    COMPLETED,
    FAILED,
    EXPIRED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SessionStatus fromDb(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == EXPIRED;
    }
}
