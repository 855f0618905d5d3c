package com.netcracker.core.access.client.azure;

import com.netcracker.core.access.client.azure.model.NetworkInterfaceDto;
import com.netcracker.core.access.client.azure.model.ResourceRefDto;
import com.netcracker.core.access.client.azure.model.SecurityGroupDto;
import com.netcracker.core.access.client.azure.model.SecurityRuleDto;
import com.netcracker.core.access.client.azure.model.SubnetDto;
import com.netcracker.core.access.client.azure.model.VirtualMachineDto;
import com.netcracker.core.access.model.IpConfiguration;
import com.netcracker.core.access.model.NetworkInterface;
import com.netcracker.core.access.model.OsMetadata;
import com.netcracker.core.access.model.RuleAccess;
import com.netcracker.core.access.model.RuleDirection;
import com.netcracker.core.access.model.SecurityGroup;
import com.netcracker.core.access.model.SecurityRule;
import com.netcracker.core.access.model.Subnet;
import com.netcracker.core.access.model.Target;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps CLI output to domain records. Absent optional fields get defaults here so
 * the rest of the code never checks for nulls from the provider.
 */
final class AzureModelMapper {

    private AzureModelMapper() {
    }

    static Target toTarget(VirtualMachineDto vm) {
        OsMetadata os = toOsMetadata(vm);
        List<String> interfaceIds = Optional.ofNullable(vm.networkProfile())
                .map(VirtualMachineDto.NetworkProfile::networkInterfaces)
                .orElse(List.of())
                .stream()
                .map(ResourceRefDto::idOf)
                .filter(Objects::nonNull)
                .toList();
        return new Target(vm.id(), vm.name(), resourceGroupOf(vm.resourceGroup(), vm.id()), vm.location(), os, interfaceIds);
    }

    static OsMetadata toOsMetadata(VirtualMachineDto vm) {
        VirtualMachineDto.OsProfile profile = vm.osProfile();
        VirtualMachineDto.StorageProfile storage = vm.storageProfile();
        VirtualMachineDto.OsDisk disk = storage == null ? null : storage.osDisk();
        VirtualMachineDto.ImageReference image = storage == null ? null : storage.imageReference();
        return new OsMetadata(
                profile != null && profile.hasWindowsConfiguration(),
                profile != null && profile.hasLinuxConfiguration(),
                disk == null ? null : disk.osType(),
                image == null ? null : image.publisher(),
                image == null ? null : image.offer(),
                image == null ? null : image.sku());
    }

    static NetworkInterface toInterface(NetworkInterfaceDto nic) {
        List<NetworkInterfaceDto.IpConfigurationDto> configs = nic.ipConfigurations() == null ? List.of() : nic.ipConfigurations();
        List<IpConfiguration> ipConfigurations = configs.stream()
                .map(config -> new IpConfiguration(
                        config.name(),
                        ResourceRefDto.idOf(config.subnet()),
                        ResourceRefDto.idOf(config.publicIpAddress()),
                        Boolean.TRUE.equals(config.primary()) || configs.size() == 1))
                .toList();
        return new NetworkInterface(nic.id(), nic.name(), resourceGroupOf(nic.resourceGroup(), nic.id()),
                ResourceRefDto.idOf(nic.networkSecurityGroup()), ipConfigurations, Boolean.TRUE.equals(nic.primary()));
    }

    static Subnet toSubnet(SubnetDto subnet, AzureResourceId subnetId) {
        return new Subnet(
                subnet.id() == null ? subnetId.id() : subnet.id(),
                subnet.name() == null ? subnetId.name() : subnet.name(),
                subnetId.virtualNetwork(),
                subnet.resourceGroup() == null ? subnetId.resourceGroup() : subnet.resourceGroup(),
                ResourceRefDto.idOf(subnet.networkSecurityGroup()));
    }

    static SecurityGroup toGroup(SecurityGroupDto group) {
        AzureResourceId id = AzureResourceId.parse(group.id());
        return new SecurityGroup(group.id(),
                group.name() == null ? id.name() : group.name(),
                resourceGroupOf(group.resourceGroup(), group.id()),
                group.location());
    }

    static SecurityRule toRule(SecurityRuleDto rule) {
        return SecurityRule.builder()
                .name(rule.name())
                .priority(rule.priority() == null ? SecurityRule.SYSTEM_PRIORITY_FLOOR : rule.priority())
                .direction(RuleDirection.fromValue(rule.direction()))
                .access(RuleAccess.fromValue(rule.access()))
                .protocol(rule.protocol())
                .sourcePrefixes(merge(rule.sourceAddressPrefix(), rule.sourceAddressPrefixes()))
                .sourcePortRanges(mergeOrAny(rule.sourcePortRange(), rule.sourcePortRanges()))
                .destinationPrefixes(mergeOrAny(rule.destinationAddressPrefix(), rule.destinationAddressPrefixes()))
                .destinationPorts(merge(rule.destinationPortRange(), rule.destinationPortRanges()))
                .description(rule.description())
                .build();
    }

    static List<String> merge(String single, List<String> multiple) {
        List<String> values = new ArrayList<>();
        if (single != null && !single.isBlank()) {
            values.add(single);
        }
        if (multiple != null) {
            multiple.stream().filter(value -> value != null && !value.isBlank()).forEach(values::add);
        }
        return values;
    }

    private static List<String> mergeOrAny(String single, List<String> multiple) {
        List<String> values = merge(single, multiple);
        return values.isEmpty() ? List.of(SecurityRule.ANY) : values;
    }

    private static String resourceGroupOf(String reported, String id) {
        if (reported != null && !reported.isBlank()) {
            return reported;
        }
        return AzureResourceId.isValid(id) ? AzureResourceId.parse(id).segment("resourceGroups").orElse("") : "";
    }
}
