package com.netcracker.core.access.service.planner;

import com.netcracker.core.access.client.ResourceProviderClient;
import com.netcracker.core.access.client.ResourceProviderException;
import com.netcracker.core.access.model.SecurityGroup;
import com.netcracker.core.access.model.SecurityRule;
import com.netcracker.core.access.service.rules.DuplicateRule;
import com.netcracker.core.access.service.rules.DuplicateRuleFinder;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Deletes rules from a live group. Deletions are best-effort: a failed delete is
 * recorded and the remaining deletions still run. Listing failures propagate.
 */
@ApplicationScoped
@Slf4j
public class RuleCleaner {
    private final ResourceProviderClient provider;

    @Inject
    public RuleCleaner(ResourceProviderClient provider) {
        this.provider = provider;
    }

    public DeduplicationResult removeDuplicates(SecurityGroup group) {
        List<SecurityRule> rules = provider.listRules(group.name(), group.resourceGroup());
        List<DuplicateRule> duplicates = DuplicateRuleFinder.findDuplicates(rules);
        if (duplicates.isEmpty()) {
            log.info("No duplicate rules in security group '{}'", group.name());
            return DeduplicationResult.NONE;
        }

        log.warn("Found {} duplicate rule(s) in '{}'", duplicates.size(), group.name());
        List<DuplicateRule> removed = new ArrayList<>();
        List<FailedDeletion> failed = new ArrayList<>();
        for (DuplicateRule duplicate : duplicates) {
            SecurityRule rule = duplicate.removed();
            try {
                provider.deleteRule(group.name(), group.resourceGroup(), rule.name());
                log.info("Removed '{}' (priority {}), duplicate of '{}' (priority {})",
                        rule.name(), rule.priority(), duplicate.keptInstead().name(), duplicate.keptInstead().priority());
                removed.add(duplicate);
            } catch (ResourceProviderException e) {
                log.warn("Failed to remove duplicate rule '{}' from '{}': {}", rule.name(), group.name(), e.getMessage());
                failed.add(new FailedDeletion(rule, e.getMessage()));
            }
        }
        return new DeduplicationResult(removed, failed);
    }

    /**
     * Deletes every custom rule of the group. Provider default rules are never touched.
     */
    public RuleRemovalResult removeAllCustomRules(SecurityGroup group) {
        List<SecurityRule> custom = provider.listRules(group.name(), group.resourceGroup()).stream()
                .filter(SecurityRule::isCustom)
                .toList();
        if (custom.isEmpty()) {
            log.info("No custom rules found in security group '{}'. Nothing to remove.", group.name());
            return new RuleRemovalResult(List.of(), List.of());
        }

        log.warn("Removing {} custom rule(s) from '{}'", custom.size(), group.name());
        List<SecurityRule> removed = new ArrayList<>();
        List<FailedDeletion> failed = new ArrayList<>();
        for (SecurityRule rule : custom) {
            try {
                provider.deleteRule(group.name(), group.resourceGroup(), rule.name());
                log.info("Removed '{}' | pri:{} | {} | {} | src:{} | port:{}", rule.name(), rule.priority(),
                        rule.direction().value(), rule.access().value(), rule.describeSources(), rule.describePorts());
                removed.add(rule);
            } catch (ResourceProviderException e) {
                log.warn("Failed to remove rule '{}' from '{}': {}", rule.name(), group.name(), e.getMessage());
                failed.add(new FailedDeletion(rule, e.getMessage()));
            }
        }
        return new RuleRemovalResult(removed, failed);
    }
}
