package com.netcracker.core.access.service.rules;

import com.netcracker.core.access.model.SecurityRule;

/**
 * Inclusive range of priorities a custom rule may take.
 */
public record PriorityRange(int min, int max) {
    public static final PriorityRange DEFAULT = new PriorityRange(100, 4096);

    public PriorityRange {
        if (min < 1 || min > max) {
            throw new IllegalArgumentException("Invalid priority range: " + min + "-" + max);
        }
        if (max >= SecurityRule.SYSTEM_PRIORITY_FLOOR) {
            throw new IllegalArgumentException("Priority range overlaps provider default rules: " + max);
        }
    }
}
