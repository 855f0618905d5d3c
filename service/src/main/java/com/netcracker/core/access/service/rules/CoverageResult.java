package com.netcracker.core.access.service.rules;

import com.netcracker.core.access.model.SecurityRule;

import java.util.Optional;

/**
 * Outcome of evaluating a group's rules against a requested source and port.
 * For {@link Status#GRANTED} the rule is the allowing rule, for {@link Status#BLOCKED}
 * it is the deny rule that shadows any later allow.
 */
public record CoverageResult(Status status, SecurityRule rule) {

    public enum Status {
        GRANTED,
        BLOCKED,
        NOT_COVERED
    }

    private static final CoverageResult NOT_COVERED = new CoverageResult(Status.NOT_COVERED, null);

    public static CoverageResult granted(SecurityRule rule) {
        return new CoverageResult(Status.GRANTED, rule);
    }

    public static CoverageResult blocked(SecurityRule rule) {
        return new CoverageResult(Status.BLOCKED, rule);
    }

    public static CoverageResult notCovered() {
        return NOT_COVERED;
    }

    public boolean isGranted() {
        return status == Status.GRANTED;
    }

    public boolean isBlocked() {
        return status == Status.BLOCKED;
    }

    public Optional<SecurityRule> matchedRule() {
        return Optional.ofNullable(rule);
    }
}
