package com.netcracker.core.access.service.planner;

import com.netcracker.core.access.model.SecurityRule;

public record FailedDeletion(SecurityRule rule, String reason) {
}
