package com.netcracker.core.access.client.net;

import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.NoRouteToHostException;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Locale;

@ApplicationScoped
@Slf4j
public class SocketTcpProbe implements TcpProbe {

    @Override
    public ProbeResult connect(String host, int port, Duration timeout) {
        long start = System.nanoTime();
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), (int) timeout.toMillis());
            Duration latency = Duration.ofNanos(System.nanoTime() - start);
            log.debug("TCP handshake with {}:{} took {} ms", host, port, latency.toMillis());
            return ProbeResult.succeeded(latency);
        } catch (IOException e) {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            ProbeFailure failure = classify(e);
            log.debug("TCP handshake with {}:{} failed: {}", host, port, failure, e);
            if (failure == ProbeFailure.TIMED_OUT) {
                return ProbeResult.failed(failure, elapsed, "no answer after %ds".formatted(timeout.toSeconds()));
            }
            return ProbeResult.failed(failure, elapsed, e.getMessage());
        }
    }

    static ProbeFailure classify(IOException e) {
        if (e instanceof SocketTimeoutException) {
            return ProbeFailure.TIMED_OUT;
        }
        if (e instanceof UnknownHostException) {
            return ProbeFailure.UNRESOLVED;
        }
        if (e instanceof NoRouteToHostException) {
            return hostDownOr(e, ProbeFailure.NO_ROUTE);
        }
        String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        if (message.contains("network is unreachable") || message.contains("network unreachable")) {
            return ProbeFailure.NETWORK_UNREACHABLE;
        }
        if (e instanceof ConnectException) {
            if (message.contains("timed out")) {
                return ProbeFailure.TIMED_OUT;
            }
            return hostDownOr(e, ProbeFailure.REFUSED);
        }
        return ProbeFailure.OTHER;
    }

    private static ProbeFailure hostDownOr(IOException e, ProbeFailure fallback) {
        String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        return message.contains("host is down") ? ProbeFailure.HOST_DOWN : fallback;
    }
}
