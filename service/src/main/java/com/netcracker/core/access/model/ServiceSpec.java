package com.netcracker.core.access.model;

import java.util.Objects;

/**
 * Service, port and protocol that must be reachable on a target.
 */
public record ServiceSpec(OsType osType, ServiceKind service, int port, String protocol) {
    public static final String TCP = "Tcp";

    public ServiceSpec {
        Objects.requireNonNull(osType, "osType");
        Objects.requireNonNull(service, "service");
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Port must be in range 1-65535: " + port);
        }
        protocol = protocol == null ? TCP : protocol;
    }

    public ServiceSpec(OsType osType, ServiceKind service, int port) {
        this(osType, service, port, TCP);
    }

    public String portAsString() {
        return String.valueOf(port);
    }
}
