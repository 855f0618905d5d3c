package com.netcracker.core.access.client.net;

import java.time.Duration;
import java.util.Optional;

/**
 * Outcome of a single TCP handshake attempt. {@code failure} is {@code null} on success.
 */
public record ProbeResult(boolean success, Duration latency, ProbeFailure failure, String message) {

    public static ProbeResult succeeded(Duration latency) {
        return new ProbeResult(true, latency, null, "TCP handshake succeeded (%d ms)".formatted(latency.toMillis()));
    }

    public static ProbeResult failed(ProbeFailure failure, Duration elapsed, String detail) {
        String message = detail == null || detail.isBlank()
                ? failure.description()
                : "%s: %s".formatted(failure.description(), detail);
        return new ProbeResult(false, elapsed, failure, message);
    }

    public Optional<ProbeFailure> failureCause() {
        return Optional.ofNullable(failure);
    }
}
