package com.netcracker.core.access.model;

import java.util.Optional;

public record Subnet(String id, String name, String virtualNetwork, String resourceGroup, String securityGroupId) {

    public Subnet {
        name = name == null ? "" : name;
        virtualNetwork = virtualNetwork == null ? "" : virtualNetwork;
        resourceGroup = resourceGroup == null ? "" : resourceGroup;
    }

    public Optional<String> attachedGroupId() {
        return Optional.ofNullable(securityGroupId).filter(id -> !id.isBlank());
    }
}
