package com.netcracker.core.access.client.net;

public enum ProbeFailure {
    REFUSED("Connection refused"),
    TIMED_OUT("Connection timed out"),
    NO_ROUTE("No route to host"),
    HOST_DOWN("Host is down"),
    NETWORK_UNREACHABLE("Network unreachable"),
    UNRESOLVED("DNS resolution failed"),
    OTHER("Socket error");

    private final String description;

    ProbeFailure(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
