package com.netcracker.core.access.client.azure.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ResourceRefDto(@JsonAlias("Id") String id) {

    public static String idOf(ResourceRefDto ref) {
        return ref == null ? null : ref.id();
    }
}
