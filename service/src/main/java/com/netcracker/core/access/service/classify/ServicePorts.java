package com.netcracker.core.access.service.classify;

import com.netcracker.core.access.model.ServiceKind;

/**
 * Port to open per service. Built once from configuration and command-line overrides
 * and passed explicitly to classification.
 */
public record ServicePorts(int ssh, int rdp) {
    public static final ServicePorts DEFAULTS = new ServicePorts(ServiceKind.SSH.defaultPort(), ServiceKind.RDP.defaultPort());

    public ServicePorts {
        validate("SSH", ssh);
        validate("RDP", rdp);
    }

    public int portFor(ServiceKind service) {
        return service == ServiceKind.RDP ? rdp : ssh;
    }

    public boolean isOverridden(ServiceKind service) {
        return portFor(service) != service.defaultPort();
    }

    public ServicePorts withOverrides(Integer sshOverride, Integer rdpOverride) {
        return new ServicePorts(sshOverride != null ? sshOverride : ssh, rdpOverride != null ? rdpOverride : rdp);
    }

    private static void validate(String service, int port) {
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("%s port %d is out of range. Must be 1-65535.".formatted(service, port));
        }
    }
}
