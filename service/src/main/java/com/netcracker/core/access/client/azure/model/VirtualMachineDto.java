package com.netcracker.core.access.client.azure.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record VirtualMachineDto(String id,
                                String name,
                                String resourceGroup,
                                String location,
                                OsProfile osProfile,
                                StorageProfile storageProfile,
                                NetworkProfile networkProfile) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OsProfile(JsonNode windowsConfiguration, JsonNode linuxConfiguration) {

        public boolean hasWindowsConfiguration() {
            return present(windowsConfiguration);
        }

        public boolean hasLinuxConfiguration() {
            return present(linuxConfiguration);
        }

        private static boolean present(JsonNode node) {
            return node != null && !node.isNull() && !node.isMissingNode();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StorageProfile(OsDisk osDisk, ImageReference imageReference) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OsDisk(String osType) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ImageReference(String publisher, String offer, String sku) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NetworkProfile(List<ResourceRefDto> networkInterfaces) {
    }
}
