package com.netcracker.core.access.cli;

import com.netcracker.core.access.service.classify.ServicePorts;
import com.netcracker.core.access.service.rules.RuleMatcher;
import picocli.CommandLine;

final class CommandSupport {

    private CommandSupport() {
    }

    /**
     * Applies command-line port overrides; an out-of-range port is a usage error.
     */
    static ServicePorts ports(CommandLine commandLine, ServicePorts defaults, PortOptions options) {
        try {
            return defaults.withOverrides(options.sshPort, options.rdpPort);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(commandLine, e.getMessage(), e);
        }
    }

    static String sourceAddress(CommandLine commandLine, String value) {
        if (!RuleMatcher.isHostAddress(value)) {
            throw new CommandLine.ParameterException(commandLine,
                    "--ip must be a single IPv4 or IPv6 address, got '%s'".formatted(value));
        }
        return value.trim();
    }
}
