package com.netcracker.core.access.client.azure;

import com.fasterxml.jackson.databind.JsonNode;
import com.netcracker.core.access.client.ResourceProviderClient;
import com.netcracker.core.access.client.ResourceProviderException;
import com.netcracker.core.access.client.azure.model.NetworkInterfaceDto;
import com.netcracker.core.access.client.azure.model.PowerStateDto;
import com.netcracker.core.access.client.azure.model.PublicIpAddressDto;
import com.netcracker.core.access.client.azure.model.SecurityGroupDto;
import com.netcracker.core.access.client.azure.model.SecurityRuleDto;
import com.netcracker.core.access.client.azure.model.SubnetDto;
import com.netcracker.core.access.client.azure.model.SubscriptionDto;
import com.netcracker.core.access.client.azure.model.VirtualMachineDto;
import com.netcracker.core.access.model.NetworkInterface;
import com.netcracker.core.access.model.PowerState;
import com.netcracker.core.access.model.PowerStatus;
import com.netcracker.core.access.model.SecurityGroup;
import com.netcracker.core.access.model.SecurityRule;
import com.netcracker.core.access.model.Subnet;
import com.netcracker.core.access.model.Target;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * {@link ResourceProviderClient} backed by the Azure CLI.
 */
@ApplicationScoped
@Slf4j
public class AzureCliResourceProvider implements ResourceProviderClient {
    private static final String POWER_STATE_QUERY = "{powerState: instanceView.statuses[?starts_with(code, 'PowerState/')].displayStatus | [0], "
            + "provisioningState: provisioningState}";
    private static final String AGGREGATE_ADDRESS_QUERY = "[0].virtualMachine.network.publicIpAddresses[0].ipAddress";
    private static final Set<String> NO_ADDRESS = Set.of("", "none", "null");

    private final AzureCliExecutor cli;

    @Inject
    public AzureCliResourceProvider(AzureCliExecutor cli) {
        this.cli = cli;
    }

    @Override
    public void ensureAuthenticated() {
        cli.ensureAuthenticated();
        SubscriptionDto subscription = cli.json(SubscriptionDto.class, "account", "show");
        if (subscription != null) {
            log.info("Subscription: {} ({})", subscription.name(), subscription.id());
        }
    }

    @Override
    public Target getTarget(String targetId) {
        VirtualMachineDto vm = require(cli.json(VirtualMachineDto.class, "vm", "show", "--ids", targetId), "VM", targetId);
        return AzureModelMapper.toTarget(vm);
    }

    @Override
    public List<Target> listTargets() {
        JsonNode vms = cli.json("vm", "list");
        List<Target> targets = new ArrayList<>();
        for (JsonNode vm : vms) {
            targets.add(AzureModelMapper.toTarget(cli.convert(vm, VirtualMachineDto.class)));
        }
        log.debug("Found {} VM(s) in subscription", targets.size());
        return targets;
    }

    @Override
    public NetworkInterface getInterface(String interfaceId) {
        NetworkInterfaceDto nic = require(cli.json(NetworkInterfaceDto.class, "network", "nic", "show", "--ids", interfaceId),
                "network interface", interfaceId);
        return AzureModelMapper.toInterface(nic);
    }

    @Override
    public Subnet getSubnet(String subnetId) {
        AzureResourceId id = parse(subnetId);
        SubnetDto subnet = require(cli.json(SubnetDto.class, "network", "vnet", "subnet", "show",
                "--resource-group", id.resourceGroup(),
                "--vnet-name", id.virtualNetwork(),
                "--name", id.name()), "subnet", subnetId);
        return AzureModelMapper.toSubnet(subnet, id);
    }

    @Override
    public SecurityGroup getGroup(String groupId) {
        SecurityGroupDto group = require(cli.json(SecurityGroupDto.class, "network", "nsg", "show", "--ids", groupId),
                "security group", groupId);
        return AzureModelMapper.toGroup(group);
    }

    @Override
    public SecurityGroup createGroup(String name, String resourceGroup, String location) {
        JsonNode result = cli.json("network", "nsg", "create",
                "--resource-group", resourceGroup,
                "--name", name,
                "--location", location);
        JsonNode created = result.has("NewNSG") ? result.get("NewNSG") : result;
        SecurityGroupDto group = created.isMissingNode() ? null : cli.convert(created, SecurityGroupDto.class);
        if (group == null || group.id() == null) {
            log.debug("Create response for '{}' has no id, reading the group back", name);
            group = require(cli.json(SecurityGroupDto.class, "network", "nsg", "show",
                    "--resource-group", resourceGroup, "--name", name), "security group", name);
        }
        log.info("Security group '{}' created", name);
        return AzureModelMapper.toGroup(group);
    }

    @Override
    public void attachGroupToInterface(String interfaceId, String groupId) {
        AzureResourceId id = parse(interfaceId);
        log.info("Attaching security group to NIC '{}'", id.name());
        cli.json("network", "nic", "update",
                "--resource-group", id.resourceGroup(),
                "--name", id.name(),
                "--network-security-group", groupId);
    }

    @Override
    public void attachGroupToSubnet(String subnetId, String groupId) {
        AzureResourceId id = parse(subnetId);
        log.info("Attaching security group to subnet '{}' in VNet '{}'", id.name(), id.virtualNetwork());
        cli.json("network", "vnet", "subnet", "update",
                "--resource-group", id.resourceGroup(),
                "--vnet-name", id.virtualNetwork(),
                "--name", id.name(),
                "--network-security-group", groupId);
    }

    @Override
    public List<SecurityRule> listRules(String groupName, String resourceGroup) {
        JsonNode rules = cli.json("network", "nsg", "rule", "list",
                "--resource-group", resourceGroup,
                "--nsg-name", groupName);
        List<SecurityRule> result = new ArrayList<>();
        for (JsonNode rule : rules) {
            SecurityRuleDto dto = cli.convert(rule, SecurityRuleDto.class);
            try {
                result.add(AzureModelMapper.toRule(dto));
            } catch (IllegalArgumentException e) {
                throw new ResourceProviderException("Unsupported rule '%s' in security group '%s': %s"
                        .formatted(dto.name(), groupName, e.getMessage()), e);
            }
        }
        return result;
    }

    @Override
    public SecurityRule createRule(String groupName, String resourceGroup, SecurityRule rule) {
        List<String> args = new ArrayList<>(List.of("network", "nsg", "rule", "create",
                "--resource-group", resourceGroup,
                "--nsg-name", groupName,
                "--name", rule.name(),
                "--priority", String.valueOf(rule.priority()),
                "--direction", rule.direction().value(),
                "--access", rule.access().value(),
                "--protocol", rule.protocol()));
        appendList(args, "--source-address-prefixes", rule.sourcePrefixes());
        appendList(args, "--source-port-ranges", rule.sourcePortRanges());
        appendList(args, "--destination-address-prefixes", rule.destinationPrefixes());
        appendList(args, "--destination-port-ranges", rule.destinationPorts());
        if (!rule.description().isEmpty()) {
            args.add("--description");
            args.add(rule.description());
        }
        SecurityRuleDto created = cli.json(SecurityRuleDto.class, args.toArray(String[]::new));
        return created == null || created.name() == null ? rule : AzureModelMapper.toRule(created);
    }

    @Override
    public void deleteRule(String groupName, String resourceGroup, String ruleName) {
        cli.run("network", "nsg", "rule", "delete",
                "--resource-group", resourceGroup,
                "--nsg-name", groupName,
                "--name", ruleName);
    }

    @Override
    public PowerStatus getPowerState(String targetId) {
        PowerStateDto state = cli.json(PowerStateDto.class, "vm", "get-instance-view", "--ids", targetId,
                "--query", POWER_STATE_QUERY);
        if (state == null) {
            return new PowerStatus(PowerState.UNKNOWN, null, null);
        }
        return new PowerStatus(PowerState.fromStatus(state.powerState()), state.powerState(), state.provisioningState());
    }

    @Override
    public void startTarget(String targetId) {
        cli.run("vm", "start", "--ids", targetId);
    }

    @Override
    public Optional<String> getPublicAddress(String publicAddressId) {
        PublicIpAddressDto address = cli.json(PublicIpAddressDto.class, "network", "public-ip", "show", "--ids", publicAddressId);
        if (address == null) {
            return Optional.empty();
        }
        Optional<String> value = address(address.ipAddress());
        if (value.isEmpty()) {
            log.debug("Public IP resource {} has no address (allocation: {})", publicAddressId, address.publicIpAllocationMethod());
        }
        return value;
    }

    @Override
    public Optional<String> findAnyPublicAddress(String targetId) {
        JsonNode address = cli.json("vm", "list-ip-addresses", "--ids", targetId, "--query", AGGREGATE_ADDRESS_QUERY);
        return address.isTextual() ? address(address.asText()) : Optional.empty();
    }

    private static Optional<String> address(String value) {
        if (value == null || NO_ADDRESS.contains(value.trim().toLowerCase(Locale.ROOT))) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }

    private static void appendList(List<String> args, String option, List<String> values) {
        if (values.isEmpty()) {
            return;
        }
        args.add(option);
        args.addAll(values);
    }

    private static AzureResourceId parse(String id) {
        try {
            return AzureResourceId.parse(id);
        } catch (IllegalArgumentException e) {
            throw new ResourceProviderException(e.getMessage(), e);
        }
    }

    private static <T> T require(T value, String kind, String id) {
        if (value == null) {
            throw new ResourceProviderException("Azure CLI returned no data for %s '%s'".formatted(kind, id));
        }
        return value;
    }
}
