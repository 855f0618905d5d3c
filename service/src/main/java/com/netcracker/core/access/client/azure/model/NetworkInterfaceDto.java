package com.netcracker.core.access.client.azure.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record NetworkInterfaceDto(String id,
                                  String name,
                                  String resourceGroup,
                                  Boolean primary,
                                  ResourceRefDto networkSecurityGroup,
                                  List<IpConfigurationDto> ipConfigurations) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record IpConfigurationDto(String name,
                                     Boolean primary,
                                     ResourceRefDto subnet,
                                     @JsonAlias("publicIPAddress") ResourceRefDto publicIpAddress) {
    }
}
