package com.netcracker.core.access.model;

import java.util.List;
import java.util.Objects;

/**
 * Snapshot of a virtual machine fetched for a single operation.
 */
public record Target(String id,
                     String name,
                     String resourceGroup,
                     String location,
                     OsMetadata os,
                     List<String> networkInterfaceIds) {

    public Target {
        Objects.requireNonNull(id, "id");
        name = name == null || name.isBlank() ? lastSegment(id) : name;
        resourceGroup = resourceGroup == null ? "" : resourceGroup;
        location = location == null ? "" : location;
        os = os == null ? OsMetadata.EMPTY : os;
        networkInterfaceIds = networkInterfaceIds == null ? List.of() : List.copyOf(networkInterfaceIds);
    }

    private static String lastSegment(String id) {
        int idx = id.lastIndexOf('/');
        return idx >= 0 ? id.substring(idx + 1) : id;
    }
}
