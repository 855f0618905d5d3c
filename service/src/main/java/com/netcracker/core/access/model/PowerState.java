package com.netcracker.core.access.model;

import java.util.Locale;

public enum PowerState {
    RUNNING,
    STOPPED,
    DEALLOCATED,
    STARTING,
    UNKNOWN;

    /**
     * Maps a provider display status such as {@code "VM running"} or a status code
     * such as {@code "PowerState/deallocated"}.
     */
    public static PowerState fromStatus(String status) {
        if (status == null || status.isBlank()) {
            return UNKNOWN;
        }
        String normalized = status.trim().toLowerCase(Locale.ROOT);
        int separator = Math.max(normalized.lastIndexOf('/'), normalized.lastIndexOf(' '));
        String state = separator >= 0 ? normalized.substring(separator + 1) : normalized;
        return switch (state) {
            case "running" -> RUNNING;
            case "stopped" -> STOPPED;
            case "deallocated" -> DEALLOCATED;
            case "starting" -> STARTING;
            default -> UNKNOWN;
        };
    }
}
