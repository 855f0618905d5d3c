package com.netcracker.core.access.model;

import lombok.Builder;

import java.util.List;
import java.util.Objects;

/**
 * A security rule of a group. Single-value and multi-value provider fields are
 * merged into the prefix and port lists.
 */
@Builder(toBuilder = true)
public record SecurityRule(String name,
                           int priority,
                           RuleDirection direction,
                           RuleAccess access,
                           String protocol,
                           List<String> sourcePrefixes,
                           List<String> sourcePortRanges,
                           List<String> destinationPrefixes,
                           List<String> destinationPorts,
                           String description) {

    /**
     * Provider default rules start here; they can be neither changed nor deleted.
     */
    public static final int SYSTEM_PRIORITY_FLOOR = 65000;
    public static final String ANY = "*";

    public SecurityRule {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(access, "access");
        name = name == null ? "" : name;
        protocol = protocol == null || protocol.isBlank() ? ANY : protocol;
        sourcePrefixes = sourcePrefixes == null ? List.of() : List.copyOf(sourcePrefixes);
        sourcePortRanges = sourcePortRanges == null ? List.of(ANY) : List.copyOf(sourcePortRanges);
        destinationPrefixes = destinationPrefixes == null ? List.of(ANY) : List.copyOf(destinationPrefixes);
        destinationPorts = destinationPorts == null ? List.of() : List.copyOf(destinationPorts);
        description = description == null ? "" : description;
    }

    public boolean isCustom() {
        return priority < SYSTEM_PRIORITY_FLOOR;
    }

    public String describeSources() {
        return sourcePrefixes.isEmpty() ? "?" : String.join(", ", sourcePrefixes);
    }

    public String describePorts() {
        return destinationPorts.isEmpty() ? "?" : String.join(", ", destinationPorts);
    }
}
