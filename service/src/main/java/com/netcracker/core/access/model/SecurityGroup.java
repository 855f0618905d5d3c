package com.netcracker.core.access.model;

import java.util.Objects;

/**
 * Network security group. Identity is the resource id.
 */
public record SecurityGroup(String id, String name, String resourceGroup, String location) {

    public SecurityGroup {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(resourceGroup, "resourceGroup");
        location = location == null ? "" : location;
    }
}
