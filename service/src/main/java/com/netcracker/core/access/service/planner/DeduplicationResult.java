package com.netcracker.core.access.service.planner;

import com.netcracker.core.access.service.rules.DuplicateRule;

import java.util.List;

/**
 * Duplicates removed from a group and the deletions that failed. Failed deletions do not stop the others.
 */
public record DeduplicationResult(List<DuplicateRule> removed, List<FailedDeletion> failed) {
    public static final DeduplicationResult NONE = new DeduplicationResult(List.of(), List.of());

    public DeduplicationResult {
        removed = List.copyOf(removed);
        failed = List.copyOf(failed);
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }
}
