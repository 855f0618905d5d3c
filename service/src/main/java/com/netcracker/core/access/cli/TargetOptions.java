package com.netcracker.core.access.cli;

import picocli.CommandLine.Option;

public class TargetOptions {

    @Option(names = {"-r", "--resource-id"}, description = "Full resource id of a single VM")
    String resourceId;

    @Option(names = {"--all"}, description = "Process every VM in the current subscription")
    boolean all;
}
