package com.netcracker.core.access.service.report;

import java.util.List;

public record BatchReport(String operation, List<TargetReport> targets) {

    public BatchReport {
        targets = List.copyOf(targets);
    }

    public long succeeded() {
        return targets.stream().filter(TargetReport::success).count();
    }

    public long failed() {
        return targets.size() - succeeded();
    }

    public boolean hasFailures() {
        return failed() > 0;
    }

    public String tally() {
        return "%s: %d target(s) processed, %d succeeded, %d failed".formatted(operation, targets.size(), succeeded(), failed());
    }
}
