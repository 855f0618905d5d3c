package com.netcracker.core.access.client.azure.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PublicIpAddressDto(@JsonAlias("IpAddress") String ipAddress, String publicIpAllocationMethod) {
}
