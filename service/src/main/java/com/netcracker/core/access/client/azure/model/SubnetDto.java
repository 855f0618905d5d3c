package com.netcracker.core.access.client.azure.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SubnetDto(String id, String name, String resourceGroup, ResourceRefDto networkSecurityGroup) {
}
