package com.netcracker.core.access.client.azure;

import jakarta.enterprise.context.ApplicationScoped;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

@ApplicationScoped
public class ProcessCommandRunner implements CommandRunner {

    @Override
    public CommandResult run(List<String> command) throws IOException, InterruptedException {
        return run(command, false);
    }

    @Override
    public int runInteractive(List<String> command) throws IOException, InterruptedException {
        return run(command, true).exitCode();
    }

    CommandResult run(List<String> command, boolean interactive) throws IOException, InterruptedException {
        ProcessBuilder builder = new ProcessBuilder(command);
        if (interactive) {
            builder.inheritIO();
        }
        Process process = start(builder);
        boolean completed = false;
        try {
            CommandResult result = interactive ? new CommandResult(process.waitFor(), "", "") : collect(command, process);
            completed = true;
            return result;
        } finally {
            if (!completed) {
                process.destroyForcibly();
            }
        }
    }

    Process start(ProcessBuilder builder) throws IOException {
        return builder.start();
    }

    private static CommandResult collect(List<String> command, Process process) throws IOException, InterruptedException {
        process.getOutputStream().close();
        // stderr is drained on another thread so a chatty command cannot block on a full pipe
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> read(process.getErrorStream()));
        String stdout;
        try {
            stdout = read(process.getInputStream());
        } catch (UncheckedIOException e) {
            throw new IOException("Failed to read output of " + command.get(0), e.getCause());
        }
        int exitCode = process.waitFor();
        try {
            return new CommandResult(exitCode, stdout, stderr.join());
        } catch (CompletionException e) {
            throw new IOException("Failed to read error output of " + command.get(0), e.getCause());
        }
    }

    private static String read(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
