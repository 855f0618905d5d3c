package com.netcracker.core.access.model;

/**
 * Remote-access service opened for a target. The default port is used unless
 * the caller supplies an override.
 */
public enum ServiceKind {
    SSH(22),
    RDP(3389);

    private final int defaultPort;

    ServiceKind(int defaultPort) {
        this.defaultPort = defaultPort;
    }

    public int defaultPort() {
        return defaultPort;
    }

    public static ServiceKind forOs(OsType osType) {
        return osType == OsType.WINDOWS ? RDP : SSH;
    }
}
