package com.netcracker.core.access.service.report;

import com.netcracker.core.access.model.ServiceSpec;
import com.netcracker.core.access.service.verify.VerificationResult;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one target within a batch. A target fails when it could not be processed
 * at all or when any of its groups failed.
 */
public record TargetReport(String targetId,
                           String targetName,
                           ServiceSpec serviceSpec,
                           List<GroupReport> groups,
                           VerificationResult verification,
                           String failureReason) {

    public TargetReport {
        groups = groups == null ? List.of() : List.copyOf(groups);
    }

    public static TargetReport failed(String targetId, String targetName, String reason) {
        return new TargetReport(targetId, targetName, null, List.of(), null, reason);
    }

    public boolean success() {
        return failureReason == null && groups.stream().allMatch(GroupReport::success);
    }

    public Optional<String> reason() {
        if (failureReason != null) {
            return Optional.of(failureReason);
        }
        return groups.stream()
                .filter(group -> !group.success())
                .findFirst()
                .map(group -> "%s: %s".formatted(group.groupName(), group.detail()));
    }

    public Optional<VerificationResult> verificationResult() {
        return Optional.ofNullable(verification);
    }
}
