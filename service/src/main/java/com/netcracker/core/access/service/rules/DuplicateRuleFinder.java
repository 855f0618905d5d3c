package com.netcracker.core.access.service.rules;

import com.netcracker.core.access.model.SecurityRule;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class DuplicateRuleFinder {
    private static final Comparator<SecurityRule> PRECEDENCE = Comparator
            .comparingInt(SecurityRule::priority)
            .thenComparing(SecurityRule::name);

    private DuplicateRuleFinder() {
    }

    /**
     * Groups custom rules by {@link RuleSignature}; in every group with more than one member the rule
     * with the lowest priority number survives and the others are returned for removal.
     */
    public static List<DuplicateRule> findDuplicates(Collection<SecurityRule> rules) {
        Map<RuleSignature, List<SecurityRule>> bySignature = new LinkedHashMap<>();
        for (SecurityRule rule : rules) {
            if (rule.isCustom()) {
                bySignature.computeIfAbsent(RuleSignature.of(rule), signature -> new ArrayList<>()).add(rule);
            }
        }

        List<DuplicateRule> duplicates = new ArrayList<>();
        for (List<SecurityRule> group : bySignature.values()) {
            if (group.size() < 2) {
                continue;
            }
            List<SecurityRule> ordered = group.stream().sorted(PRECEDENCE).toList();
            SecurityRule kept = ordered.get(0);
            for (SecurityRule duplicate : ordered.subList(1, ordered.size())) {
                duplicates.add(new DuplicateRule(duplicate, kept));
            }
        }
        return duplicates;
    }
}
