package com.netcracker.core.access.service.planner;

import com.netcracker.core.access.client.ResourceProviderClient;
import com.netcracker.core.access.model.RuleAccess;
import com.netcracker.core.access.model.RuleDirection;
import com.netcracker.core.access.model.SecurityGroup;
import com.netcracker.core.access.model.SecurityRule;
import com.netcracker.core.access.model.ServiceSpec;
import com.netcracker.core.access.service.rules.CoverageResult;
import com.netcracker.core.access.service.rules.PriorityAllocator;
import com.netcracker.core.access.service.rules.PriorityRange;
import com.netcracker.core.access.service.rules.RuleMatcher;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Makes sure one group allows a source address to reach a service port.
 * <p>
 * Steps, each required before the next:
 * <ol>
 *     <li>remove duplicate rules (best-effort)</li>
 *     <li>re-read the rules</li>
 *     <li>stop if an allow rule already covers the request</li>
 *     <li>otherwise create an allow rule at the lowest free priority</li>
 * </ol>
 * Re-running against a satisfied group changes nothing beyond deduplication.
 */
@ApplicationScoped
@Slf4j
public class AccessPlanner {
    private final ResourceProviderClient provider;
    private final RuleCleaner ruleCleaner;
    private final PriorityRange priorityRange;
    private final Clock clock;

    @Inject
    public AccessPlanner(ResourceProviderClient provider, RuleCleaner ruleCleaner, PriorityRange priorityRange, Clock clock) {
        this.provider = provider;
        this.ruleCleaner = ruleCleaner;
        this.priorityRange = priorityRange;
        this.clock = clock;
    }

    public AccessOutcome ensureAccess(SecurityGroup group, String sourceAddress, ServiceSpec serviceSpec, String targetName) {
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(sourceAddress, "sourceAddress");
        Objects.requireNonNull(serviceSpec, "serviceSpec");
        log.info("Security group '{}' ({}): open {} port {} for {} target '{}'", group.name(), group.resourceGroup(),
                serviceSpec.service(), serviceSpec.port(), serviceSpec.osType(), targetName);

        DeduplicationResult deduplication = ruleCleaner.removeDuplicates(group);

        List<SecurityRule> rules = provider.listRules(group.name(), group.resourceGroup());
        CoverageResult coverage = RuleMatcher.findCoveringRule(rules, sourceAddress, serviceSpec.port());
        AccessOutcome.AccessOutcomeBuilder outcome = AccessOutcome.builder()
                .group(group)
                .deduplication(deduplication);

        if (coverage.isGranted()) {
            SecurityRule covering = coverage.rule();
            log.info("{} access already allowed by existing rule '{}' (priority {}): {} -> {}", serviceSpec.service(),
                    covering.name(), covering.priority(), covering.describeSources(), covering.describePorts());
            return outcome.coveringRule(covering).build();
        }
        if (coverage.isBlocked()) {
            SecurityRule deny = coverage.rule();
            log.warn("Deny rule '{}' (priority {}) in '{}' matches {}:{} before any allow rule",
                    deny.name(), deny.priority(), group.name(), sourceAddress, serviceSpec.port());
            outcome.shadowingRule(deny);
        }

        int priority = PriorityAllocator.nextFreePriority(rules, priorityRange);
        SecurityRule rule = buildRule(sourceAddress, serviceSpec, targetName, priority);
        log.info("Adding rule '{}' | priority: {} | source: {} | port: {}", rule.name(), priority,
                rule.describeSources(), serviceSpec.port());
        SecurityRule created = provider.createRule(group.name(), group.resourceGroup(), rule);
        log.info("{} rule added to '{}' for {}:{}", serviceSpec.service(), group.name(), sourceAddress, serviceSpec.port());
        return outcome.createdRule(created).build();
    }

    SecurityRule buildRule(String sourceAddress, ServiceSpec serviceSpec, String targetName, int priority) {
        String name = "Allow-%s-%s-%d".formatted(serviceSpec.service(), sanitize(sourceAddress), clock.instant().getEpochSecond());
        String description = "Allow %s from %s to %s VM '%s' (port %d) - auto-added".formatted(
                serviceSpec.service(), sourceAddress, osLabel(serviceSpec), targetName, serviceSpec.port());
        return SecurityRule.builder()
                .name(name)
                .priority(priority)
                .direction(RuleDirection.INBOUND)
                .access(RuleAccess.ALLOW)
                .protocol(serviceSpec.protocol())
                .sourcePrefixes(List.of(hostPrefix(sourceAddress)))
                .sourcePortRanges(List.of(SecurityRule.ANY))
                .destinationPrefixes(List.of(SecurityRule.ANY))
                .destinationPorts(List.of(serviceSpec.portAsString()))
                .description(description)
                .build();
    }

    static String hostPrefix(String address) {
        return address.indexOf(':') >= 0 ? address + "/128" : address + "/32";
    }

    static String sanitize(String address) {
        return address.replaceAll("[^A-Za-z0-9]", "-");
    }

    private static String osLabel(ServiceSpec serviceSpec) {
        return switch (serviceSpec.osType()) {
            case WINDOWS -> "Windows";
            case LINUX -> "Linux";
        };
    }
}
