package com.netcracker.core.access.model;

import java.util.Locale;

public enum RuleDirection {
    INBOUND("Inbound"),
    OUTBOUND("Outbound");

    private final String value;

    RuleDirection(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static RuleDirection fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Rule direction is empty");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
