package com.netcracker.core.access.service.rules;

import com.netcracker.core.access.model.SecurityRule;

/**
 * A rule marked for removal because {@code keptInstead} has the same signature and a lower priority number.
 */
public record DuplicateRule(SecurityRule removed, SecurityRule keptInstead) {
}
