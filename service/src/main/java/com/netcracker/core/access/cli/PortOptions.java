package com.netcracker.core.access.cli;

import picocli.CommandLine.Option;

public class PortOptions {

    @Option(names = {"--ssh-port"}, paramLabel = "PORT", description = "SSH port to open on Linux VMs")
    Integer sshPort;

    @Option(names = {"--rdp-port"}, paramLabel = "PORT", description = "RDP port to open on Windows VMs")
    Integer rdpPort;
}
