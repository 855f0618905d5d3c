package com.netcracker.core.access.service;

import com.netcracker.core.access.client.ResourceProviderClient;
import com.netcracker.core.access.model.SecurityGroup;
import com.netcracker.core.access.model.SecurityRule;
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
import com.netcracker.core.access.service.topology.GuardingGroup;
import com.netcracker.core.access.service.topology.TopologyResolver;
import com.netcracker.core.access.service.verify.ConnectivityVerifier;
import com.netcracker.core.access.service.verify.VerificationResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Runs an operation over a list of targets. Targets are processed one after another and
 * independently: a failing target is recorded in the report and the batch moves on.
 */
@ApplicationScoped
@Slf4j
public class AccessReconciler {
    private final ResourceProviderClient provider;
    private final ServiceClassifier classifier;
    private final TopologyResolver topologyResolver;
    private final AccessPlanner planner;
    private final RuleCleaner ruleCleaner;
    private final ConnectivityVerifier verifier;

    @Inject
    public AccessReconciler(ResourceProviderClient provider,
                            ServiceClassifier classifier,
                            TopologyResolver topologyResolver,
                            AccessPlanner planner,
                            RuleCleaner ruleCleaner,
                            ConnectivityVerifier verifier) {
        this.provider = provider;
        this.classifier = classifier;
        this.topologyResolver = topologyResolver;
        this.planner = planner;
        this.ruleCleaner = ruleCleaner;
        this.verifier = verifier;
    }

    /**
     * Opens the target's remote-access port for {@code sourceAddress} on every guarding group,
     * creating groups where none is attached. Optionally verifies connectivity afterwards.
     */
    public BatchReport grant(List<String> targetIds, String sourceAddress, ServicePorts ports, boolean verifyAfter) {
        return run("grant", targetIds, target -> grantTarget(target, sourceAddress, ports, verifyAfter));
    }

    public BatchReport verify(List<String> targetIds, ServicePorts ports) {
        return run("verify", targetIds, target -> {
            ServiceSpec serviceSpec = classifier.classify(target, ports);
            VerificationResult result = verifier.verify(target, serviceSpec);
            return new TargetReport(target.id(), target.name(), serviceSpec, List.of(), result,
                    result.isReachable() ? null : result.state() + ": " + result.reason());
        });
    }

    /**
     * Removes duplicate rules from every group already guarding the target. Creates nothing.
     */
    public BatchReport cleanup(List<String> targetIds) {
        return run("cleanup", targetIds, target -> {
            List<GroupReport> groups = new ArrayList<>();
            for (GuardingGroup guarding : findExisting(target)) {
                SecurityGroup group = guarding.group();
                try {
                    DeduplicationResult result = ruleCleaner.removeDuplicates(group);
                    groups.add(toGroupReport(guarding, result));
                } catch (AccessManagerException e) {
                    log.error("Cleanup of security group '{}' failed", group.name(), e);
                    groups.add(GroupReport.failed(group.name(), guarding.describe(), e.getMessage()));
                }
            }
            return new TargetReport(target.id(), target.name(), null, groups, null, null);
        });
    }

    /**
     * Deletes every custom rule from every group already guarding the target.
     */
    public BatchReport removeRules(List<String> targetIds) {
        return run("remove-rules", targetIds, target -> {
            List<GroupReport> groups = new ArrayList<>();
            for (GuardingGroup guarding : findExisting(target)) {
                SecurityGroup group = guarding.group();
                try {
                    RuleRemovalResult result = ruleCleaner.removeAllCustomRules(group);
                    String detail = "removed %d custom rule(s)".formatted(result.removed().size());
                    groups.add(result.hasFailures()
                            ? GroupReport.failed(group.name(), guarding.describe(),
                            detail + ", %d deletion(s) failed".formatted(result.failed().size()))
                            : GroupReport.succeeded(group.name(), guarding.describe(), detail));
                } catch (AccessManagerException e) {
                    log.error("Removing rules from security group '{}' failed", group.name(), e);
                    groups.add(GroupReport.failed(group.name(), guarding.describe(), e.getMessage()));
                }
            }
            return new TargetReport(target.id(), target.name(), null, groups, null, null);
        });
    }

    private TargetReport grantTarget(Target target, String sourceAddress, ServicePorts ports, boolean verifyAfter) {
        ServiceSpec serviceSpec = classifier.classify(target, ports);
        log.info("Target '{}': {} -> {} port {}", target.name(), serviceSpec.osType(), serviceSpec.service(), serviceSpec.port());
        if (target.networkInterfaceIds().isEmpty()) {
            return new TargetReport(target.id(), target.name(), serviceSpec, List.of(), null, "No network interfaces found");
        }

        List<GroupReport> groups = new ArrayList<>();
        for (GuardingGroup guarding : topologyResolver.resolveGuardingGroups(target)) {
            SecurityGroup group = guarding.group();
            try {
                AccessOutcome outcome = planner.ensureAccess(group, sourceAddress, serviceSpec, target.name());
                groups.add(toGroupReport(guarding, outcome));
            } catch (AccessManagerException e) {
                log.error("Failed to ensure access in security group '{}' for '{}'", group.name(), target.name(), e);
                groups.add(GroupReport.failed(group.name(), guarding.describe(), e.getMessage()));
            }
        }

        VerificationResult verification = verifyAfter ? verifier.verify(target, serviceSpec) : null;
        return new TargetReport(target.id(), target.name(), serviceSpec, groups, verification, null);
    }

    private List<GuardingGroup> findExisting(Target target) {
        List<GuardingGroup> groups = topologyResolver.findGuardingGroups(target);
        if (groups.isEmpty()) {
            log.info("No security groups found for '{}'", target.name());
        }
        return groups;
    }

    private BatchReport run(String operation, List<String> targetIds, Function<Target, TargetReport> action) {
        List<TargetReport> reports = new ArrayList<>();
        int index = 0;
        for (String targetId : targetIds) {
            index++;
            log.info("[{}/{}] {} {}", index, targetIds.size(), operation, targetId);
            reports.add(runTarget(targetId, action));
        }
        BatchReport report = new BatchReport(operation, reports);
        if (report.hasFailures()) {
            log.warn(report.tally());
        } else {
            log.info(report.tally());
        }
        return report;
    }

    private TargetReport runTarget(String targetId, Function<Target, TargetReport> action) {
        String name = targetId;
        try {
            Target target = provider.getTarget(targetId);
            name = target.name();
            return action.apply(target);
        } catch (RuntimeException e) {
            log.error("Processing of target '{}' failed", name, e);
            return TargetReport.failed(targetId, name, e.getMessage());
        }
    }

    private static GroupReport toGroupReport(GuardingGroup guarding, AccessOutcome outcome) {
        SecurityGroup group = outcome.group();
        StringBuilder detail = new StringBuilder();
        DeduplicationResult deduplication = outcome.deduplication();
        if (!deduplication.removed().isEmpty()) {
            detail.append("removed %d duplicate(s); ".formatted(deduplication.removed().size()));
        }
        if (deduplication.hasFailures()) {
            detail.append("%d duplicate deletion(s) failed; ".formatted(deduplication.failed().size()));
        }
        if (outcome.skipped()) {
            SecurityRule covering = outcome.coveringRule();
            detail.append("already allowed by '%s' (priority %d)".formatted(covering.name(), covering.priority()));
        } else {
            SecurityRule created = outcome.createdRule();
            detail.append("created '%s' (priority %d)".formatted(created.name(), created.priority()));
            outcome.shadowedBy().ifPresent(deny -> detail.append("; deny rule '%s' (priority %d) matches first"
                    .formatted(deny.name(), deny.priority())));
        }
        return GroupReport.succeeded(group.name(), guarding.describe(), detail.toString());
    }

    private static GroupReport toGroupReport(GuardingGroup guarding, DeduplicationResult result) {
        String detail = result.removed().isEmpty()
                ? "no duplicate rules"
                : "removed %d duplicate(s)".formatted(result.removed().size());
        if (result.hasFailures()) {
            return GroupReport.failed(guarding.group().name(), guarding.describe(),
                    detail + ", %d deletion(s) failed".formatted(result.failed().size()));
        }
        return GroupReport.succeeded(guarding.group().name(), guarding.describe(), detail);
    }
}
