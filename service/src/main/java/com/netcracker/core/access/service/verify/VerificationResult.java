package com.netcracker.core.access.service.verify;

import com.netcracker.core.access.client.net.ProbeFailure;
import com.netcracker.core.access.model.PowerStatus;

import java.time.Duration;
import java.util.Optional;

/**
 * Terminal state of a connectivity check. {@code address}, {@code latency} and
 * {@code failure} are set only when the state machine got far enough to produce them.
 */
public record VerificationResult(VerificationState state,
                                 PowerStatus powerStatus,
                                 String address,
                                 int port,
                                 Duration latency,
                                 ProbeFailure failure,
                                 String reason,
                                 boolean startedByOperator) {

    public VerificationResult {
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal verification state: " + state);
        }
    }

    public boolean isReachable() {
        return state == VerificationState.REACHABLE;
    }

    public Optional<String> resolvedAddress() {
        return Optional.ofNullable(address);
    }

    public Optional<Duration> roundTrip() {
        return Optional.ofNullable(latency);
    }
}
