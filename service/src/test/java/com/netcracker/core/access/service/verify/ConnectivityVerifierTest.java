package com.netcracker.core.access.service.verify;

import com.netcracker.core.access.client.ResourceProviderClient;
import com.netcracker.core.access.client.ResourceProviderException;
import com.netcracker.core.access.client.net.ProbeFailure;
import com.netcracker.core.access.client.net.ProbeResult;
import com.netcracker.core.access.client.net.TcpProbe;
import com.netcracker.core.access.client.prompt.OperatorPrompt;
import com.netcracker.core.access.model.IpConfiguration;
import com.netcracker.core.access.model.NetworkInterface;
import com.netcracker.core.access.model.OsMetadata;
import com.netcracker.core.access.model.OsType;
import com.netcracker.core.access.model.PowerState;
import com.netcracker.core.access.model.PowerStatus;
import com.netcracker.core.access.model.ServiceKind;
import com.netcracker.core.access.model.ServiceSpec;
import com.netcracker.core.access.model.Target;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ConnectivityVerifierTest {
    private static final String VM_ID = "/subscriptions/sub/resourceGroups/rg/providers/Microsoft.Compute/virtualMachines/web-1";
    private static final String NIC_ID = "/subscriptions/sub/resourceGroups/rg/providers/Microsoft.Network/networkInterfaces/web-1-nic";
    private static final String PIP_ID = "/subscriptions/sub/resourceGroups/rg/providers/Microsoft.Network/publicIPAddresses/web-1-ip";
    private static final ServiceSpec SSH = new ServiceSpec(OsType.LINUX, ServiceKind.SSH, 22);
    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final Duration SETTLE = Duration.ofSeconds(10);

    private ResourceProviderClient provider;
    private TcpProbe probe;
    private OperatorPrompt prompt;
    private List<Duration> waits;
    private ConnectivityVerifier verifier;
    private final Target target = new Target(VM_ID, "web-1", "rg", "westeurope", OsMetadata.EMPTY, List.of(NIC_ID));

    @BeforeEach
    void setUp() {
        provider = mock(ResourceProviderClient.class);
        probe = mock(TcpProbe.class);
        prompt = mock(OperatorPrompt.class);
        waits = new ArrayList<>();
        verifier = new ConnectivityVerifier(provider, probe, prompt, waits::add, TIMEOUT, SETTLE);
        when(provider.getInterface(NIC_ID)).thenReturn(new NetworkInterface(NIC_ID, "web-1-nic", "rg", null,
                List.of(new IpConfiguration("ipconfig1", null, PIP_ID, true)), true));
    }

    @Test
    void runningTargetWithOpenPortIsReachable() {
        when(provider.getPowerState(VM_ID)).thenReturn(running());
        when(provider.getPublicAddress(PIP_ID)).thenReturn(Optional.of("20.1.2.3"));
        when(probe.connect("20.1.2.3", 22, TIMEOUT)).thenReturn(ProbeResult.succeeded(Duration.ofMillis(42)));

        VerificationResult result = verifier.verify(target, SSH);

        assertEquals(VerificationState.REACHABLE, result.state());
        assertEquals("20.1.2.3", result.address());
        assertEquals(Duration.ofMillis(42), result.latency());
        verify(provider, never()).findAnyPublicAddress(anyString());
    }

    @Test
    void probeFailureIsTerminalWithCause() {
        when(provider.getPowerState(VM_ID)).thenReturn(running());
        when(provider.getPublicAddress(PIP_ID)).thenReturn(Optional.of("20.1.2.3"));
        when(probe.connect("20.1.2.3", 22, TIMEOUT))
                .thenReturn(ProbeResult.failed(ProbeFailure.REFUSED, Duration.ofMillis(3), null));

        VerificationResult result = verifier.verify(target, SSH);

        assertEquals(VerificationState.UNREACHABLE, result.state());
        assertEquals(ProbeFailure.REFUSED, result.failure());
        assertThat(result.reason()).isEqualTo("Connection refused");
        verify(probe, times(1)).connect(anyString(), anyInt(), any());
    }

    @Test
    void aggregateLookupIsUsedWhenInterfacesHaveNoAddress() {
        when(provider.getPowerState(VM_ID)).thenReturn(running());
        when(provider.getPublicAddress(PIP_ID)).thenThrow(new ResourceProviderException("not found"));
        when(provider.findAnyPublicAddress(VM_ID)).thenReturn(Optional.of("20.9.9.9"));
        when(probe.connect("20.9.9.9", 22, TIMEOUT)).thenReturn(ProbeResult.succeeded(Duration.ofMillis(5)));

        VerificationResult result = verifier.verify(target, SSH);

        assertThat(result.isReachable()).isTrue();
        assertEquals("20.9.9.9", result.address());
    }

    @Test
    void missingAddressIsUnreachableNotAnError() {
        when(provider.getPowerState(VM_ID)).thenReturn(running());
        when(provider.getPublicAddress(PIP_ID)).thenReturn(Optional.empty());
        when(provider.findAnyPublicAddress(VM_ID)).thenReturn(Optional.empty());

        VerificationResult result = verifier.verify(target, SSH);

        assertEquals(VerificationState.UNREACHABLE, result.state());
        assertThat(result.reason()).contains("No public IP address");
        verifyNoInteractions(probe);
    }

    @Test
    void declinedStartEndsInNotRunning() {
        when(provider.getPowerState(VM_ID)).thenReturn(new PowerStatus(PowerState.DEALLOCATED, "VM deallocated", "Succeeded"));
        when(prompt.askYesNo(anyString())).thenReturn(false);

        VerificationResult result = verifier.verify(target, SSH);

        assertEquals(VerificationState.NOT_RUNNING, result.state());
        assertThat(result.startedByOperator()).isFalse();
        verify(provider, never()).startTarget(anyString());
        verifyNoInteractions(probe);
    }

    @Test
    void acceptedStartRestartsOnceAfterSettling() {
        when(provider.getPowerState(VM_ID))
                .thenReturn(new PowerStatus(PowerState.STOPPED, "VM stopped", "Succeeded"))
                .thenReturn(running());
        when(prompt.askYesNo(anyString())).thenReturn(true);
        when(provider.getPublicAddress(PIP_ID)).thenReturn(Optional.of("20.1.2.3"));
        when(probe.connect("20.1.2.3", 22, TIMEOUT)).thenReturn(ProbeResult.succeeded(Duration.ofMillis(30)));

        VerificationResult result = verifier.verify(target, SSH);

        assertThat(result.isReachable()).isTrue();
        assertThat(result.startedByOperator()).isTrue();
        assertThat(waits).containsExactly(SETTLE);
        verify(provider).startTarget(VM_ID);
    }

    @Test
    void startIsOfferedOnlyOncePerRun() {
        when(provider.getPowerState(VM_ID)).thenReturn(new PowerStatus(PowerState.DEALLOCATED, "VM deallocated", "Succeeded"));
        when(prompt.askYesNo(anyString())).thenReturn(true);

        VerificationResult result = verifier.verify(target, SSH);

        assertEquals(VerificationState.NOT_RUNNING, result.state());
        verify(provider, times(1)).startTarget(VM_ID);
        verify(provider, times(2)).getPowerState(VM_ID);
        verify(prompt, times(1)).askYesNo(anyString());
    }

    @Test
    void transitionalStateIsNotStartable() {
        when(provider.getPowerState(VM_ID)).thenReturn(new PowerStatus(PowerState.STARTING, "VM starting", "Updating"));

        VerificationResult result = verifier.verify(target, SSH);

        assertEquals(VerificationState.NOT_RUNNING, result.state());
        verifyNoInteractions(prompt);
    }

    private static PowerStatus running() {
        return new PowerStatus(PowerState.RUNNING, "VM running", "Succeeded");
    }
}
