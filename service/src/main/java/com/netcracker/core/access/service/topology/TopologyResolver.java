package com.netcracker.core.access.service.topology;

import com.netcracker.core.access.client.ResourceProviderClient;
import com.netcracker.core.access.client.ResourceProviderException;
import com.netcracker.core.access.model.IpConfiguration;
import com.netcracker.core.access.model.NetworkInterface;
import com.netcracker.core.access.model.SecurityGroup;
import com.netcracker.core.access.model.Subnet;
import com.netcracker.core.access.model.Target;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the security groups guarding a target: the group attached to each network interface
 * and the groups attached to the subnets of the interface's IP configurations.
 * <p>
 * {@link #resolveGuardingGroups(Target)} creates and attaches a group wherever one is missing.
 * Creation is not rolled back: if attaching a freshly created group fails, the group stays
 * orphaned and {@link PartialProvisioningException} is raised. A later run creates a new group.
 */
@ApplicationScoped
@Slf4j
public class TopologyResolver {
    private static final String GROUP_NAME_TEMPLATE = "nsg-%s-%s-%d";

    private final ResourceProviderClient provider;
    private final Clock clock;

    @Inject
    public TopologyResolver(ResourceProviderClient provider, Clock clock) {
        this.provider = provider;
        this.clock = clock;
    }

    public List<GuardingGroup> resolveGuardingGroups(Target target) {
        return traverse(target, true);
    }

    /**
     * Same traversal as {@link #resolveGuardingGroups(Target)} without creating anything.
     */
    public List<GuardingGroup> findGuardingGroups(Target target) {
        return traverse(target, false);
    }

    private List<GuardingGroup> traverse(Target target, boolean provision) {
        Map<String, GuardingGroup> groups = new LinkedHashMap<>();
        Set<String> checkedSubnets = new HashSet<>();

        for (String interfaceId : target.networkInterfaceIds()) {
            NetworkInterface nic = provider.getInterface(interfaceId);
            Optional<String> nicGroupId = nic.attachedGroupId();
            if (nicGroupId.isPresent()) {
                add(groups, new GuardingGroup(provider.getGroup(nicGroupId.get()), AttachmentPoint.INTERFACE, nic.name(), false));
            } else if (provision) {
                log.warn("No security group found on interface '{}'. Auto-creating...", nic.name());
                SecurityGroup created = createAndAttach(
                        groupName(target.name(), "nic"), nic.resourceGroup(), target.location(), nic.name(),
                        groupId -> provider.attachGroupToInterface(nic.id(), groupId));
                add(groups, new GuardingGroup(created, AttachmentPoint.INTERFACE, nic.name(), true));
            } else {
                log.debug("Interface '{}' has no security group", nic.name());
            }

            for (String subnetId : subnetIds(nic)) {
                if (!checkedSubnets.add(subnetId.toLowerCase(Locale.ROOT))) {
                    continue;
                }
                Subnet subnet = provider.getSubnet(subnetId);
                Optional<String> subnetGroupId = subnet.attachedGroupId();
                if (subnetGroupId.isPresent()) {
                    add(groups, new GuardingGroup(provider.getGroup(subnetGroupId.get()), AttachmentPoint.SUBNET, subnet.name(), false));
                } else if (provision) {
                    log.warn("No security group found on subnet '{}'. Auto-creating...", subnet.name());
                    SecurityGroup created = createAndAttach(
                            groupName(subnet.name(), "subnet"), subnet.resourceGroup(), target.location(), subnet.name(),
                            groupId -> provider.attachGroupToSubnet(subnet.id(), groupId));
                    add(groups, new GuardingGroup(created, AttachmentPoint.SUBNET, subnet.name(), true));
                } else {
                    log.debug("Subnet '{}' has no security group", subnet.name());
                }
            }
        }
        return new ArrayList<>(groups.values());
    }

    private SecurityGroup createAndAttach(String name,
                                          String resourceGroup,
                                          String location,
                                          String attachTarget,
                                          GroupAttachment attachment) {
        log.info("Creating security group '{}' in resource group '{}' ({})", name, resourceGroup, location);
        SecurityGroup created = provider.createGroup(name, resourceGroup, location);
        try {
            attachment.attach(created.id());
        } catch (ResourceProviderException e) {
            log.error("Security group '{}' created but not attached to '{}'; it is left in place", name, attachTarget, e);
            throw new PartialProvisioningException(created, attachTarget, e);
        }
        log.info("Security group '{}' attached to '{}'", name, attachTarget);
        return created;
    }

    private String groupName(String base, String role) {
        return GROUP_NAME_TEMPLATE.formatted(base, role, clock.instant().getEpochSecond());
    }

    private static List<String> subnetIds(NetworkInterface nic) {
        return nic.ipConfigurations().stream()
                .map(IpConfiguration::subnet)
                .flatMap(Optional::stream)
                .distinct()
                .toList();
    }

    private static void add(Map<String, GuardingGroup> groups, GuardingGroup group) {
        groups.putIfAbsent(group.group().id().toLowerCase(Locale.ROOT), group);
    }

    @FunctionalInterface
    private interface GroupAttachment {
        void attach(String groupId);
    }
}
