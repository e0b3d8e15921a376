package com.titiplex.frost.core.model;

import java.util.Locale;

public enum ApprovalStatus {
    PENDING, APPROVED, REJECTED, EXPIRED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ApprovalStatus fromDb(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
