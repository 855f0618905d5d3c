package com.netcracker.core.access.client.net;

import java.time.Duration;

public interface TcpProbe {

    /**
     * Attempts one TCP handshake. Never throws for network failures; they are reported in the result.
     */
    ProbeResult connect(String host, int port, Duration timeout);
}
