package com.netcracker.core.access.service.planner;

import com.netcracker.core.access.model.SecurityGroup;
import com.netcracker.core.access.model.SecurityRule;
import lombok.Builder;

import java.util.Optional;

/**
 * Result of planning access on one group. Exactly one of {@code coveringRule} and
 * {@code createdRule} is set. {@code shadowingRule} is a deny rule that evaluated
 * before any allow for the requested source and port.
 */
@Builder
public record AccessOutcome(SecurityGroup group,
                            DeduplicationResult deduplication,
                            SecurityRule coveringRule,
                            SecurityRule createdRule,
                            SecurityRule shadowingRule) {

    public boolean skipped() {
        return coveringRule != null;
    }

    public Optional<SecurityRule> created() {
        return Optional.ofNullable(createdRule);
    }

    public Optional<SecurityRule> shadowedBy() {
        return Optional.ofNullable(shadowingRule);
    }
}
