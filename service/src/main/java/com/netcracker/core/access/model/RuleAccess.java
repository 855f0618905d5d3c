package com.netcracker.core.access.model;

import java.util.Locale;

public enum RuleAccess {
    ALLOW("Allow"),
    DENY("Deny");

    private final String value;

    RuleAccess(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static RuleAccess fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Rule access is empty");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
