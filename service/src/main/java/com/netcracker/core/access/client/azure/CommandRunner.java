package com.netcracker.core.access.client.azure;

import java.io.IOException;
import java.util.List;

public interface CommandRunner {

    /**
     * Runs a command and captures its output.
     *
     * @throws IOException if the executable cannot be started
     */
    CommandResult run(List<String> command) throws IOException, InterruptedException;

    /**
     * Runs a command attached to the current terminal and returns its exit code.
     */
    int runInteractive(List<String> command) throws IOException, InterruptedException;
}
