package com.netcracker.core.access.model;

import java.util.List;

public final class RuleFixtures {

    private RuleFixtures() {
    }

    public static SecurityRule allow(String name, int priority, String source, String port) {
        return inbound(name, priority, RuleAccess.ALLOW, source, port);
    }

    public static SecurityRule deny(String name, int priority, String source, String port) {
        return inbound(name, priority, RuleAccess.DENY, source, port);
    }

    public static SecurityRule inbound(String name, int priority, RuleAccess access, String source, String port) {
        return SecurityRule.builder()
                .name(name)
                .priority(priority)
                .direction(RuleDirection.INBOUND)
                .access(access)
                .protocol("Tcp")
                .sourcePrefixes(List.of(source))
                .destinationPorts(List.of(port))
                .build();
    }
}
