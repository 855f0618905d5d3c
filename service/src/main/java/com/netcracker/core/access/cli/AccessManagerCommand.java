package com.netcracker.core.access.cli;

import io.quarkus.picocli.runtime.annotations.TopCommand;
import picocli.CommandLine.Command;

@TopCommand
@Command(
        name = "nsg-access",
        mixinStandardHelpOptions = true,
        description = "Manages SSH/RDP access rules in the network security groups guarding Azure VMs",
        subcommands = {
                GrantCommand.class,
                VerifyCommand.class,
                CleanupCommand.class,
                RemoveRulesCommand.class
        })
public class AccessManagerCommand {
}
