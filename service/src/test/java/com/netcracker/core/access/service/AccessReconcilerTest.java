package com.netcracker.core.access.service;

import com.netcracker.core.access.client.ResourceProviderClient;
import com.netcracker.core.access.client.ResourceProviderException;
import com.netcracker.core.access.model.OsMetadata;
import com.netcracker.core.access.model.OsType;
import com.netcracker.core.access.model.PowerState;
import com.netcracker.core.access.model.PowerStatus;
import com.netcracker.core.access.model.SecurityGroup;
import com.netcracker.core.access.model.SecurityRule;
import com.netcracker.core.access.model.ServiceKind;
import com.netcracker.core.access.model.ServiceSpec;
import com.netcracker.core.access.model.Target;
import com.netcracker.core.access.service.classify.ServiceClassifier;
import com.netcracker.core.access.service.classify.ServicePorts;
import com.netcracker.core.access.service.planner.AccessOutcome;
import com.netcracker.core.access.service.planner.AccessPlanner;
import com.netcracker.core.access.service.planner.DeduplicationResult;
import com.netcracker.core.access.service.planner.RuleCleaner;
import com.netcracker.core.access.service.planner.RuleRemovalResult;
import com.netcracker.core.access.service.report.BatchReport;
import com.netcracker.core.access.service.report.GroupReport;
import com.netcracker.core.access.service.report.TargetReport;
import com.netcracker.core.access.service.rules.PriorityExhaustedException;
import com.netcracker.core.access.service.rules.PriorityRange;
import com.netcracker.core.access.service.topology.AttachmentPoint;
import com.netcracker.core.access.service.topology.GuardingGroup;
import com.netcracker.core.access.service.topology.TopologyResolver;
import com.netcracker.core.access.service.verify.ConnectivityVerifier;
import com.netcracker.core.access.service.verify.VerificationResult;
import com.netcracker.core.access.service.verify.VerificationState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.netcracker.core.access.model.RuleFixtures.allow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AccessReconcilerTest {
    private static final String RG = "/subscriptions/sub/resourceGroups/rg";
    private static final String VM1 = RG + "/providers/Microsoft.Compute/virtualMachines/web-1";
    private static final String VM2 = RG + "/providers/Microsoft.Compute/virtualMachines/web-2";
    private static final String NIC = RG + "/providers/Microsoft.Network/networkInterfaces/nic";
    private static final SecurityGroup NIC_GROUP = new SecurityGroup(RG + "/providers/Microsoft.Network/networkSecurityGroups/nic-nsg",
            "nic-nsg", "rg", "westeurope");
    private static final SecurityGroup SUBNET_GROUP = new SecurityGroup(RG + "/providers/Microsoft.Network/networkSecurityGroups/subnet-nsg",
            "subnet-nsg", "rg", "westeurope");
    private static final ServiceSpec SSH = new ServiceSpec(OsType.LINUX, ServiceKind.SSH, 22);

    private ResourceProviderClient provider;
    private TopologyResolver topologyResolver;
    private AccessPlanner planner;
    private RuleCleaner ruleCleaner;
    private ConnectivityVerifier verifier;
    private AccessReconciler reconciler;

    @BeforeEach
    void setUp() {
        provider = mock(ResourceProviderClient.class);
        topologyResolver = mock(TopologyResolver.class);
        planner = mock(AccessPlanner.class);
        ruleCleaner = mock(RuleCleaner.class);
        verifier = mock(ConnectivityVerifier.class);
        reconciler = new AccessReconciler(provider, new ServiceClassifier(), topologyResolver, planner, ruleCleaner, verifier);
    }

    @Test
    void grantProcessesEveryGuardingGroup() {
        Target target = target(VM1, "web-1");
        when(provider.getTarget(VM1)).thenReturn(target);
        when(topologyResolver.resolveGuardingGroups(target)).thenReturn(List.of(
                new GuardingGroup(NIC_GROUP, AttachmentPoint.INTERFACE, "nic", false),
                new GuardingGroup(SUBNET_GROUP, AttachmentPoint.SUBNET, "default", true)));
        SecurityRule covering = allow("AllowAll", 100, "*", "*");
        SecurityRule created = allow("Allow-SSH-198-51-100-7-1", 101, "198.51.100.7/32", "22");
        when(planner.ensureAccess(NIC_GROUP, "198.51.100.7", SSH, "web-1")).thenReturn(AccessOutcome.builder()
                .group(NIC_GROUP).deduplication(DeduplicationResult.NONE).coveringRule(covering).build());
        when(planner.ensureAccess(SUBNET_GROUP, "198.51.100.7", SSH, "web-1")).thenReturn(AccessOutcome.builder()
                .group(SUBNET_GROUP).deduplication(DeduplicationResult.NONE).createdRule(created).build());

        BatchReport report = reconciler.grant(List.of(VM1), "198.51.100.7", ServicePorts.DEFAULTS, false);

        assertThat(report.hasFailures()).isFalse();
        TargetReport targetReport = report.targets().get(0);
        assertThat(targetReport.groups()).extracting(GroupReport::detail)
                .containsExactly("already allowed by 'AllowAll' (priority 100)",
                        "created 'Allow-SSH-198-51-100-7-1' (priority 101)");
        verify(verifier, never()).verify(any(), any());
    }

    @Test
    void failingGroupDoesNotStopSiblingGroups() {
        Target target = target(VM1, "web-1");
        when(provider.getTarget(VM1)).thenReturn(target);
        when(topologyResolver.resolveGuardingGroups(target)).thenReturn(List.of(
                new GuardingGroup(NIC_GROUP, AttachmentPoint.INTERFACE, "nic", false),
                new GuardingGroup(SUBNET_GROUP, AttachmentPoint.SUBNET, "default", false)));
        when(planner.ensureAccess(eq(NIC_GROUP), any(), any(), any()))
                .thenThrow(new PriorityExhaustedException(PriorityRange.DEFAULT));
        when(planner.ensureAccess(eq(SUBNET_GROUP), any(), any(), any())).thenReturn(AccessOutcome.builder()
                .group(SUBNET_GROUP).deduplication(DeduplicationResult.NONE)
                .createdRule(allow("new", 100, "198.51.100.7/32", "22")).build());

        BatchReport report = reconciler.grant(List.of(VM1), "198.51.100.7", ServicePorts.DEFAULTS, false);

        TargetReport targetReport = report.targets().get(0);
        assertThat(targetReport.success()).isFalse();
        assertThat(targetReport.groups()).extracting(GroupReport::success).containsExactly(false, true);
        assertThat(targetReport.reason()).hasValueSatisfying(reason -> assertThat(reason).contains("nic-nsg"));
        verify(planner).ensureAccess(eq(SUBNET_GROUP), any(), any(), any());
    }

    @Test
    void providerFailureOnOneGroupDoesNotStopSiblingGroups() {
        RuleCleaner cleaner = new RuleCleaner(provider);
        AccessPlanner realPlanner = new AccessPlanner(provider, cleaner, PriorityRange.DEFAULT,
                Clock.fixed(Instant.ofEpochSecond(1_706_300_000L), ZoneOffset.UTC));
        AccessReconciler reconcilerWithPlanner = new AccessReconciler(provider, new ServiceClassifier(), topologyResolver,
                realPlanner, cleaner, verifier);
        Target target = target(VM1, "web-1");
        when(provider.getTarget(VM1)).thenReturn(target);
        when(topologyResolver.resolveGuardingGroups(target)).thenReturn(List.of(
                new GuardingGroup(NIC_GROUP, AttachmentPoint.INTERFACE, "nic", false),
                new GuardingGroup(SUBNET_GROUP, AttachmentPoint.SUBNET, "default", false)));
        when(provider.listRules(anyString(), eq("rg"))).thenReturn(List.of());
        when(provider.createRule(eq("nic-nsg"), eq("rg"), any()))
                .thenThrow(new ResourceProviderException("Azure CLI command failed: AuthorizationFailed"));
        when(provider.createRule(eq("subnet-nsg"), eq("rg"), any()))
                .thenAnswer(invocation -> invocation.getArgument(2));

        BatchReport report = reconcilerWithPlanner.grant(List.of(VM1), "198.51.100.7", ServicePorts.DEFAULTS, false);

        TargetReport targetReport = report.targets().get(0);
        assertThat(targetReport.success()).isFalse();
        assertThat(targetReport.groups()).extracting(GroupReport::groupName).containsExactly("nic-nsg", "subnet-nsg");
        assertThat(targetReport.groups()).extracting(GroupReport::success).containsExactly(false, true);
        assertThat(targetReport.groups().get(0).detail()).contains("AuthorizationFailed");
        assertThat(targetReport.groups().get(1).detail())
                .isEqualTo("created 'Allow-SSH-198-51-100-7-1706300000' (priority 100)");
        verify(provider).createRule(eq("subnet-nsg"), eq("rg"), any());
    }

    @Test
    void failingTargetDoesNotStopBatch() {
        Target second = target(VM2, "web-2");
        when(provider.getTarget(VM1)).thenThrow(new ResourceProviderException("Azure CLI command failed: ResourceNotFound"));
        when(provider.getTarget(VM2)).thenReturn(second);
        when(topologyResolver.resolveGuardingGroups(second)).thenReturn(List.of());

        BatchReport report = reconciler.grant(List.of(VM1, VM2), "198.51.100.7", ServicePorts.DEFAULTS, false);

        assertEquals(2, report.targets().size());
        assertEquals(1, report.succeeded());
        assertEquals(1, report.failed());
        assertThat(report.targets().get(0).reason()).contains("Azure CLI command failed: ResourceNotFound");
        assertThat(report.tally()).isEqualTo("grant: 2 target(s) processed, 1 succeeded, 1 failed");
    }

    @Test
    void grantWithVerificationAttachesResult() {
        Target target = target(VM1, "web-1");
        when(provider.getTarget(VM1)).thenReturn(target);
        when(topologyResolver.resolveGuardingGroups(target)).thenReturn(List.of());
        VerificationResult unreachable = new VerificationResult(VerificationState.NOT_RUNNING,
                new PowerStatus(PowerState.STOPPED, "VM stopped", "Succeeded"), null, 22, null, null, "Target is not running", false);
        when(verifier.verify(target, SSH)).thenReturn(unreachable);

        BatchReport report = reconciler.grant(List.of(VM1), "198.51.100.7", ServicePorts.DEFAULTS, true);

        assertThat(report.targets().get(0).verificationResult()).contains(unreachable);
        assertThat(report.hasFailures()).isFalse();
    }

    @Test
    void verifyFailsUnreachableTargets() {
        Target target = target(VM1, "web-1");
        when(provider.getTarget(VM1)).thenReturn(target);
        when(verifier.verify(target, SSH)).thenReturn(new VerificationResult(VerificationState.UNREACHABLE,
                null, null, 22, null, null, "No public IP address found", false));

        BatchReport report = reconciler.verify(List.of(VM1), ServicePorts.DEFAULTS);

        assertThat(report.hasFailures()).isTrue();
        assertThat(report.targets().get(0).reason()).hasValueSatisfying(reason -> assertThat(reason).contains("No public IP"));
        verify(topologyResolver, never()).resolveGuardingGroups(any());
    }

    @Test
    void cleanupAndRemoveRulesUseExistingGroupsOnly() {
        Target target = target(VM1, "web-1");
        when(provider.getTarget(VM1)).thenReturn(target);
        when(topologyResolver.findGuardingGroups(target)).thenReturn(List.of(
                new GuardingGroup(NIC_GROUP, AttachmentPoint.INTERFACE, "nic", false)));
        when(ruleCleaner.removeDuplicates(NIC_GROUP)).thenReturn(DeduplicationResult.NONE);
        when(ruleCleaner.removeAllCustomRules(NIC_GROUP))
                .thenReturn(new RuleRemovalResult(List.of(allow("a", 100, "*", "22")), List.of()));

        BatchReport cleanup = reconciler.cleanup(List.of(VM1));
        BatchReport removal = reconciler.removeRules(List.of(VM1));

        assertThat(cleanup.targets().get(0).groups()).extracting(GroupReport::detail).containsExactly("no duplicate rules");
        assertThat(removal.targets().get(0).groups()).extracting(GroupReport::detail).containsExactly("removed 1 custom rule(s)");
        verify(topologyResolver, never()).resolveGuardingGroups(any());
    }

    private static Target target(String id, String name) {
        return new Target(id, name, "rg", "westeurope", new OsMetadata(false, true, "Linux", "", "", ""), List.of(NIC));
    }
}
