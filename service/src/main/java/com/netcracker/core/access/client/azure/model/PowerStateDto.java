package com.netcracker.core.access.client.azure.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Projection produced by the instance-view query.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PowerStateDto(String powerState, String provisioningState) {
}
