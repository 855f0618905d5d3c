package com.netcracker.core.access.service.rules;

import com.netcracker.core.access.model.RuleAccess;
import com.netcracker.core.access.model.RuleDirection;
import com.netcracker.core.access.model.SecurityRule;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Order-independent identity of a rule. Name, priority and description are not part of it,
 * so two rules with equal signatures grant or deny exactly the same traffic.
 */
public record RuleSignature(RuleDirection direction,
                            RuleAccess access,
                            String protocol,
                            Set<String> sources,
                            Set<String> sourcePorts,
                            Set<String> destinations,
                            Set<String> destinationPorts) {

    public static RuleSignature of(SecurityRule rule) {
        return new RuleSignature(
                rule.direction(),
                rule.access(),
                rule.protocol().trim().toLowerCase(Locale.ROOT),
                normalize(rule.sourcePrefixes()),
                normalize(rule.sourcePortRanges()),
                normalize(rule.destinationPrefixes()),
                normalize(rule.destinationPorts())
        );
    }

    private static Set<String> normalize(Collection<String> values) {
        Set<String> normalized = new TreeSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                normalized.add(value.trim().toLowerCase(Locale.ROOT));
            }
        }
        return Set.copyOf(normalized);
    }
}
