package com.netcracker.core.access.service.rules;

import com.netcracker.core.access.model.RuleAccess;
import com.netcracker.core.access.model.RuleDirection;
import com.netcracker.core.access.model.SecurityRule;
import org.apache.commons.net.util.SubnetUtils;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Coverage checks of rule source prefixes and destination port specs.
 * <p>
 * Malformed prefixes and port ranges never raise; they simply do not cover.
 */
public final class RuleMatcher {
    // case-sensitive: "internet" and "ANY" are not wildcards
    private static final Set<String> UNIVERSAL_SOURCES = Set.of("*", "Internet", "Any");
    private static final Set<String> INBOUND_PROTOCOLS = Set.of("tcp", "*");
    private static final Pattern IPV6_LITERAL = Pattern.compile("^[0-9a-fA-F:.]+$");

    private RuleMatcher() {
    }

    public static boolean portCovers(String rulePortSpec, int targetPort) {
        return portCovers(rulePortSpec, String.valueOf(targetPort));
    }

    public static boolean portCovers(String rulePortSpec, String targetPort) {
        if (rulePortSpec == null || rulePortSpec.isBlank() || targetPort == null) {
            return false;
        }
        String spec = rulePortSpec.trim();
        String port = targetPort.trim();
        if (SecurityRule.ANY.equals(spec) || spec.equals(port)) {
            return true;
        }
        int dash = spec.indexOf('-');
        if (dash < 0) {
            return false;
        }
        try {
            int low = Integer.parseInt(spec.substring(0, dash).trim());
            int high = Integer.parseInt(spec.substring(dash + 1).trim());
            int value = Integer.parseInt(port);
            return low <= value && value <= high;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    public static boolean sourceCovers(String ruleSourcePrefix, String targetAddress) {
        if (ruleSourcePrefix == null || ruleSourcePrefix.isBlank() || targetAddress == null || targetAddress.isBlank()) {
            return false;
        }
        String prefix = ruleSourcePrefix.trim();
        String address = targetAddress.trim();
        if (UNIVERSAL_SOURCES.contains(prefix) || prefix.equals(address) || prefix.equals(address + "/32")) {
            return true;
        }
        if (prefix.indexOf('/') < 0) {
            return false;
        }
        try {
            return isInNetwork(prefix, address);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * True for a single IPv4 or IPv6 address literal. Prefixes, host names and blanks are rejected.
     */
    public static boolean isHostAddress(String value) {
        if (value == null || value.isBlank() || value.indexOf('/') >= 0) {
            return false;
        }
        String address = value.trim();
        try {
            if (address.indexOf(':') >= 0) {
                parseIpv6Literal(address);
            } else {
                new SubnetUtils(address + "/32");
            }
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Simulates firewall evaluation: inbound TCP (or any-protocol) custom rules are walked in
     * ascending priority and the first rule matching both source and port decides.
     */
    public static CoverageResult findCoveringRule(Collection<SecurityRule> rules, String sourceAddress, int port) {
        List<SecurityRule> ordered = rules.stream()
                .filter(SecurityRule::isCustom)
                .sorted(Comparator.comparingInt(SecurityRule::priority))
                .toList();

        for (SecurityRule rule : ordered) {
            if (rule.direction() != RuleDirection.INBOUND) {
                continue;
            }
            if (!INBOUND_PROTOCOLS.contains(rule.protocol().toLowerCase(Locale.ROOT))) {
                continue;
            }
            boolean sourceMatched = rule.sourcePrefixes().stream()
                    .anyMatch(prefix -> sourceCovers(prefix, sourceAddress));
            if (!sourceMatched) {
                continue;
            }
            boolean portMatched = rule.destinationPorts().stream()
                    .anyMatch(spec -> portCovers(spec, port));
            if (!portMatched) {
                continue;
            }
            return rule.access() == RuleAccess.ALLOW
                    ? CoverageResult.granted(rule)
                    : CoverageResult.blocked(rule);
        }
        return CoverageResult.notCovered();
    }

    private static boolean isInNetwork(String cidr, String address) {
        int slash = cidr.indexOf('/');
        String network = cidr.substring(0, slash);
        if (network.indexOf(':') >= 0 || address.indexOf(':') >= 0) {
            return isInIpv6Network(network, cidr.substring(slash + 1), address);
        }
        SubnetUtils subnet = new SubnetUtils(cidr);
        subnet.setInclusiveHostCount(true);
        if (subnet.getInfo().getNetmask().equals("0.0.0.0")) {
            // /0 spans every address; only the address itself needs to be valid
            new SubnetUtils(address + "/32");
            return true;
        }
        return subnet.getInfo().isInRange(address);
    }

    private static boolean isInIpv6Network(String network, String prefixLengthPart, String address) {
        byte[] networkBytes = parseIpv6Literal(network);
        byte[] addressBytes = parseIpv6Literal(address);
        if (networkBytes.length != addressBytes.length) {
            return false;
        }
        int prefixLength = Integer.parseInt(prefixLengthPart.trim());
        if (prefixLength < 0 || prefixLength > networkBytes.length * 8) {
            throw new IllegalArgumentException("Invalid prefix length: " + prefixLength);
        }
        int fullBytes = prefixLength / 8;
        int remainingBits = prefixLength % 8;
        for (int i = 0; i < fullBytes; i++) {
            if (networkBytes[i] != addressBytes[i]) {
                return false;
            }
        }
        if (remainingBits == 0) {
            return true;
        }
        int mask = (0xFF << (8 - remainingBits)) & 0xFF;
        return (networkBytes[fullBytes] & mask) == (addressBytes[fullBytes] & mask);
    }

    private static byte[] parseIpv6Literal(String value) {
        // a literal never triggers a name lookup; anything else is rejected before InetAddress sees it
        if (value.indexOf(':') < 0 || !IPV6_LITERAL.matcher(value).matches()) {
            throw new IllegalArgumentException("Not an IPv6 literal: " + value);
        }
        try {
            return InetAddress.getByName(value).getAddress();
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("Not an IPv6 literal: " + value, e);
        }
    }
}
