package com.titiplex.frost.core.model;

import java.util.Locale;

public enum FederationRole {
    GUARDIAN, STEWARD, ADULT, OFFSPRING, PRIVATE;

    public static FederationRole parse(String s) {
        return valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
