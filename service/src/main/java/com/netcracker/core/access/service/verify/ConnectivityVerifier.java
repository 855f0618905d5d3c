package com.netcracker.core.access.service.verify;

import com.netcracker.core.access.client.ResourceProviderClient;
import com.netcracker.core.access.client.ResourceProviderException;
import com.netcracker.core.access.client.net.ProbeFailure;
import com.netcracker.core.access.client.net.ProbeResult;
import com.netcracker.core.access.client.net.TcpProbe;
import com.netcracker.core.access.client.prompt.OperatorPrompt;
import com.netcracker.core.access.configuration.AccessManagerConfig;
import com.netcracker.core.access.model.IpConfiguration;
import com.netcracker.core.access.model.NetworkInterface;
import com.netcracker.core.access.model.PowerState;
import com.netcracker.core.access.model.PowerStatus;
import com.netcracker.core.access.model.ServiceSpec;
import com.netcracker.core.access.model.Target;
import com.netcracker.core.access.service.AccessManagerException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Checks whether a target's service port answers from outside.
 * <pre>
 * CHECKING_POWER -> NOT_RUNNING
 *                -> RESOLVING_ADDRESS -> PROBING -> REACHABLE | UNREACHABLE
 *                                     -> UNREACHABLE (no public address)
 * </pre>
 * A stopped target may be started on operator request; the machine then re-enters
 * CHECKING_POWER once. No rule is modified and the probe is attempted only once.
 */
@ApplicationScoped
@Slf4j
public class ConnectivityVerifier {
    private static final Set<PowerState> STARTABLE = EnumSet.of(PowerState.STOPPED, PowerState.DEALLOCATED);
    private static final int START_BUDGET = 1;

    private final ResourceProviderClient provider;
    private final TcpProbe probe;
    private final OperatorPrompt prompt;
    private final SettleWait settleWait;
    private final Duration probeTimeout;
    private final Duration settleDelay;

    @Inject
    public ConnectivityVerifier(ResourceProviderClient provider, TcpProbe probe, OperatorPrompt prompt, AccessManagerConfig config) {
        this(provider, probe, prompt, SettleWait.SLEEP, config.probe().timeout(), config.verify().startSettleDelay());
    }

    ConnectivityVerifier(ResourceProviderClient provider,
                         TcpProbe probe,
                         OperatorPrompt prompt,
                         SettleWait settleWait,
                         Duration probeTimeout,
                         Duration settleDelay) {
        this.provider = provider;
        this.probe = probe;
        this.prompt = prompt;
        this.settleWait = settleWait;
        this.probeTimeout = probeTimeout;
        this.settleDelay = settleDelay;
    }

    public VerificationResult verify(Target target, ServiceSpec serviceSpec) {
        Run run = new Run(target, serviceSpec);
        VerificationState state = VerificationState.CHECKING_POWER;
        while (!state.isTerminal()) {
            log.debug("Verification of '{}': {}", target.name(), state);
            state = switch (state) {
                case CHECKING_POWER -> checkPower(run);
                case RESOLVING_ADDRESS -> resolveAddress(run);
                case PROBING -> probe(run);
                default -> throw new IllegalStateException("Unexpected state " + state);
            };
        }
        VerificationResult result = run.result(state);
        log.info("Connectivity of '{}' on {} port {}: {}{}", target.name(), serviceSpec.service(), serviceSpec.port(),
                state, result.reason() == null ? "" : " - " + result.reason());
        return result;
    }

    private VerificationState checkPower(Run run) {
        PowerStatus status = provider.getPowerState(run.target.id());
        run.powerStatus = status;
        log.info("Target '{}' power state: {} (provisioning: {})", run.target.name(), status.displayStatus(), status.provisioningState());
        if (status.isRunning()) {
            return VerificationState.RESOLVING_ADDRESS;
        }

        run.reason = "Target is not running (%s). TCP connectivity test skipped.".formatted(status.displayStatus());
        if (!STARTABLE.contains(status.state()) || run.startsLeft == 0) {
            return VerificationState.NOT_RUNNING;
        }
        if (!prompt.askYesNo("Target '%s' is %s. Start it now?".formatted(run.target.name(), status.displayStatus()))) {
            log.info("Start of '{}' declined", run.target.name());
            return VerificationState.NOT_RUNNING;
        }

        run.startsLeft--;
        try {
            log.info("Starting target '{}'...", run.target.name());
            provider.startTarget(run.target.id());
        } catch (ResourceProviderException e) {
            log.error("Failed to start target '{}'", run.target.name(), e);
            run.reason = "Failed to start target: " + e.getMessage();
            return VerificationState.NOT_RUNNING;
        }
        run.started = true;
        log.info("Target '{}' started. Waiting {}s before re-checking...", run.target.name(), settleDelay.toSeconds());
        try {
            settleWait.await(settleDelay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AccessManagerException("Interrupted while waiting for '%s' to start".formatted(run.target.name()), e);
        }
        run.reason = null;
        return VerificationState.CHECKING_POWER;
    }

    private VerificationState resolveAddress(Run run) {
        Optional<String> address = findInterfaceAddress(run.target).or(() -> findAggregateAddress(run.target));
        if (address.isEmpty()) {
            run.reason = "No public IP address found for target '%s'".formatted(run.target.name());
            return VerificationState.UNREACHABLE;
        }
        run.address = address.get();
        return VerificationState.PROBING;
    }

    private Optional<String> findInterfaceAddress(Target target) {
        for (String interfaceId : target.networkInterfaceIds()) {
            NetworkInterface nic = provider.getInterface(interfaceId);
            for (IpConfiguration ipConfiguration : nic.ipConfigurations()) {
                Optional<String> publicAddressId = ipConfiguration.publicAddress();
                if (publicAddressId.isEmpty()) {
                    continue;
                }
                try {
                    Optional<String> address = provider.getPublicAddress(publicAddressId.get());
                    if (address.isPresent()) {
                        log.debug("Public IP found on interface '{}', config '{}'", nic.name(), ipConfiguration.name());
                        return address;
                    }
                    log.info("Public IP resource on interface '{}' has no address assigned", nic.name());
                } catch (ResourceProviderException e) {
                    log.warn("Failed to query public IP resource for interface '{}': {}", nic.name(), e.getMessage());
                }
            }
        }
        return Optional.empty();
    }

    private Optional<String> findAggregateAddress(Target target) {
        log.debug("Falling back to aggregate public IP lookup for '{}'", target.name());
        try {
            return provider.findAnyPublicAddress(target.id());
        } catch (ResourceProviderException e) {
            log.warn("Aggregate public IP lookup for '{}' failed: {}", target.name(), e.getMessage());
            return Optional.empty();
        }
    }

    private VerificationState probe(Run run) {
        int port = run.serviceSpec.port();
        log.info("Testing TCP handshake to {}:{} (timeout {}s)", run.address, port, probeTimeout.toSeconds());
        ProbeResult result = probe.connect(run.address, port, probeTimeout);
        run.latency = result.latency();
        if (result.success()) {
            return VerificationState.REACHABLE;
        }
        run.failure = result.failure();
        run.reason = result.message();
        return VerificationState.UNREACHABLE;
    }

    private static final class Run {
        private final Target target;
        private final ServiceSpec serviceSpec;
        private int startsLeft = START_BUDGET;
        private boolean started;
        private PowerStatus powerStatus;
        private String address;
        private Duration latency;
        private ProbeFailure failure;
        private String reason;

        private Run(Target target, ServiceSpec serviceSpec) {
            this.target = target;
            this.serviceSpec = serviceSpec;
        }

        private VerificationResult result(VerificationState state) {
            return new VerificationResult(state, powerStatus, address, serviceSpec.port(), latency, failure, reason, started);
        }
    }
}
