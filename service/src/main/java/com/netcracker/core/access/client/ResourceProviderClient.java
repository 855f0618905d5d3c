package com.netcracker.core.access.client;

import com.netcracker.core.access.model.NetworkInterface;
import com.netcracker.core.access.model.PowerStatus;
import com.netcracker.core.access.model.SecurityGroup;
import com.netcracker.core.access.model.SecurityRule;
import com.netcracker.core.access.model.Subnet;
import com.netcracker.core.access.model.Target;

import java.util.List;
import java.util.Optional;

/**
 * Control-plane operations used by the access manager.
 * <p>
 * Every call is blocking and fetches fresh data. Failures are reported as
 * {@link ResourceProviderException}; an empty result means "no data".
 */
public interface ResourceProviderClient {

    /**
     * Makes sure subsequent calls are authorized, refreshing credentials when needed.
     */
    void ensureAuthenticated();

    Target getTarget(String targetId);

    List<Target> listTargets();

    NetworkInterface getInterface(String interfaceId);

    Subnet getSubnet(String subnetId);

    SecurityGroup getGroup(String groupId);

    SecurityGroup createGroup(String name, String resourceGroup, String location);

    void attachGroupToInterface(String interfaceId, String groupId);

    void attachGroupToSubnet(String subnetId, String groupId);

    List<SecurityRule> listRules(String groupName, String resourceGroup);

    SecurityRule createRule(String groupName, String resourceGroup, SecurityRule rule);

    void deleteRule(String groupName, String resourceGroup, String ruleName);

    PowerStatus getPowerState(String targetId);

    void startTarget(String targetId);

    /**
     * Resolves the address currently bound to a public address resource.
     */
    Optional<String> getPublicAddress(String publicAddressId);

    /**
     * Aggregated public address lookup for a target, used when per-interface resolution finds nothing.
     */
    Optional<String> findAnyPublicAddress(String targetId);
}
