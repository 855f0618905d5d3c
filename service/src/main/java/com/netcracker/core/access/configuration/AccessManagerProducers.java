package com.netcracker.core.access.configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netcracker.core.access.service.classify.ServicePorts;
import com.netcracker.core.access.service.rules.PriorityRange;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import java.time.Clock;

/**
 * Converts configuration into the explicit values passed to classification and planning.
 */
public class AccessManagerProducers {

    @Produces
    @Singleton
    public Clock systemClock() {
        return Clock.systemUTC();
    }

    @Produces
    @Singleton
    public ObjectMapper objectMapper() {
        return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Produces
    @Singleton
    public PriorityRange priorityRange(AccessManagerConfig config) {
        return new PriorityRange(config.priority().min(), config.priority().max());
    }

    @Produces
    @Singleton
    public ServicePorts defaultServicePorts(AccessManagerConfig config) {
        return new ServicePorts(config.ports().ssh(), config.ports().rdp());
    }
}
