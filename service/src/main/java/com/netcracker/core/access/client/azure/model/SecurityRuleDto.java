package com.netcracker.core.access.client.azure.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Rule as returned by the CLI. Prefixes and ports come either as a single value or as a list.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SecurityRuleDto(String name,
                              Integer priority,
                              String direction,
                              String access,
                              String protocol,
                              String sourceAddressPrefix,
                              List<String> sourceAddressPrefixes,
                              String sourcePortRange,
                              List<String> sourcePortRanges,
                              String destinationAddressPrefix,
                              List<String> destinationAddressPrefixes,
                              String destinationPortRange,
                              List<String> destinationPortRanges,
                              String description) {
}
