package com.netcracker.core.access.service.rules;

import com.netcracker.core.access.model.SecurityRule;

import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

public final class PriorityAllocator {

    private PriorityAllocator() {
    }

    public static int nextFreePriority(Collection<SecurityRule> existingRules) {
        return nextFreePriority(existingRules, PriorityRange.DEFAULT);
    }

    /**
     * Returns the lowest priority of the range that no custom rule uses.
     *
     * @throws PriorityExhaustedException if every priority of the range is taken
     */
    public static int nextFreePriority(Collection<SecurityRule> existingRules, PriorityRange range) {
        Set<Integer> used = existingRules.stream()
                .filter(SecurityRule::isCustom)
                .map(SecurityRule::priority)
                .collect(Collectors.toSet());
        for (int priority = range.min(); priority <= range.max(); priority++) {
            if (!used.contains(priority)) {
                return priority;
            }
        }
        throw new PriorityExhaustedException(range);
    }
}
