package com.netcracker.core.access.service.planner;

import com.netcracker.core.access.model.SecurityRule;

import java.util.List;

public record RuleRemovalResult(List<SecurityRule> removed, List<FailedDeletion> failed) {

    public RuleRemovalResult {
        removed = List.copyOf(removed);
        failed = List.copyOf(failed);
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }
}
