package com.netcracker.core.access.client.azure;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed Azure resource id such as
 * {@code /subscriptions/{sub}/resourceGroups/{rg}/providers/Microsoft.Network/virtualNetworks/{vnet}/subnets/{subnet}}.
 * Segment types are matched case-insensitively.
 */
public final class AzureResourceId {
    private static final String PREFIX = "/subscriptions/";

    private final String id;
    private final Map<String, String> segments;
    private final String name;

    private AzureResourceId(String id, Map<String, String> segments, String name) {
        this.id = id;
        this.segments = segments;
        this.name = name;
    }

    public static boolean isValid(String id) {
        return id != null && id.startsWith(PREFIX) && id.length() > PREFIX.length();
    }

    public static AzureResourceId parse(String id) {
        if (!isValid(id)) {
            throw new IllegalArgumentException("Invalid resource ID format. It should start with '/subscriptions/': " + id);
        }
        String[] parts = id.substring(1).split("/");
        Map<String, String> segments = new LinkedHashMap<>();
        for (int i = 0; i + 1 < parts.length; i += 2) {
            segments.put(parts[i].toLowerCase(Locale.ROOT), parts[i + 1]);
        }
        return new AzureResourceId(id, segments, parts[parts.length - 1]);
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public Optional<String> segment(String type) {
        return Optional.ofNullable(segments.get(type.toLowerCase(Locale.ROOT)));
    }

    public String resourceGroup() {
        return require("resourceGroups");
    }

    public String virtualNetwork() {
        return require("virtualNetworks");
    }

    public String require(String type) {
        return segment(type).orElseThrow(() -> new IllegalArgumentException("Resource id has no '%s' segment: %s".formatted(type, id)));
    }

    @Override
    public String toString() {
        return id;
    }
}
