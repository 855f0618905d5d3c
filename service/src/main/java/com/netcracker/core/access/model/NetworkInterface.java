package com.netcracker.core.access.model;

import java.util.List;
import java.util.Optional;

public record NetworkInterface(String id,
                               String name,
                               String resourceGroup,
                               String securityGroupId,
                               List<IpConfiguration> ipConfigurations,
                               boolean primary) {

    public NetworkInterface {
        name = name == null ? "" : name;
        resourceGroup = resourceGroup == null ? "" : resourceGroup;
        ipConfigurations = ipConfigurations == null ? List.of() : List.copyOf(ipConfigurations);
    }

    public Optional<String> attachedGroupId() {
        return Optional.ofNullable(securityGroupId).filter(id -> !id.isBlank());
    }
}
