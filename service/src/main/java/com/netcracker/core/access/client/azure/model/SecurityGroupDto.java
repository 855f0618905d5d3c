package com.netcracker.core.access.client.azure.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SecurityGroupDto(String id, String name, String resourceGroup, String location) {
}
