package com.netcracker.core.access.model;

import java.util.Optional;

public record IpConfiguration(String name, String subnetId, String publicAddressId, boolean primary) {

    public IpConfiguration {
        name = name == null ? "" : name;
    }

    public Optional<String> subnet() {
        return Optional.ofNullable(subnetId).filter(id -> !id.isBlank());
    }

    public Optional<String> publicAddress() {
        return Optional.ofNullable(publicAddressId).filter(id -> !id.isBlank());
    }
}
