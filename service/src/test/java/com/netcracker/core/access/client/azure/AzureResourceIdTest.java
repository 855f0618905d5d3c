package com.netcracker.core.access.client.azure;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class AzureResourceIdTest {

    @Test
    void parsesSubnetId() {
        AzureResourceId id = AzureResourceId.parse(
                "/subscriptions/sub/resourceGroups/net-rg/providers/Microsoft.Network/virtualNetworks/vnet-1/subnets/default");

        assertEquals("net-rg", id.resourceGroup());
        assertEquals("vnet-1", id.virtualNetwork());
        assertEquals("default", id.name());
        assertThat(id.segment("subnets")).contains("default");
    }

    @Test
    void segmentTypesAreCaseInsensitive() {
        AzureResourceId id = AzureResourceId.parse(
                "/subscriptions/sub/resourcegroups/RG/providers/Microsoft.Network/networkSecurityGroups/web-nsg");

        assertEquals("RG", id.resourceGroup());
        assertThat(id.segment("NetworkSecurityGroups")).contains("web-nsg");
    }

    @Test
    void rejectsIdsOutsideSubscriptions() {
        assertThat(AzureResourceId.isValid("/resourceGroups/rg")).isFalse();
        assertThat(AzureResourceId.isValid("/subscriptions/")).isFalse();
        assertThatThrownBy(() -> AzureResourceId.parse("vm-1"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("/subscriptions/");
    }

    @Test
    void missingSegmentIsReported() {
        AzureResourceId id = AzureResourceId.parse("/subscriptions/sub/resourceGroups/rg");

        assertThatThrownBy(id::virtualNetwork).hasMessageContaining("virtualNetworks");
    }
}
