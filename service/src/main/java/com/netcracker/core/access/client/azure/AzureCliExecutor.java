package com.netcracker.core.access.client.azure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.netcracker.core.access.client.ResourceProviderException;
import com.netcracker.core.access.client.azure.model.AccessTokenDto;
import com.netcracker.core.access.configuration.AccessManagerConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs Azure CLI commands and parses their JSON output.
 * <p>
 * A command that fails because the access token expired or is missing is retried once
 * after the token is refreshed. Every other failure raises {@link ResourceProviderException}.
 */
@ApplicationScoped
@Slf4j
public class AzureCliExecutor {
    private static final List<String> AUTH_ERROR_MARKERS = List.of("AADSTS", "az login", "expired");
    private static final int MAX_ERROR_OUTPUT = 200;

    private final CommandRunner runner;
    private final ObjectMapper objectMapper;
    private final String cliCommand;
    private final Duration tokenRefreshThreshold;
    private final Clock clock;

    @Inject
    public AzureCliExecutor(CommandRunner runner, ObjectMapper objectMapper, AccessManagerConfig config, Clock clock) {
        this(runner, objectMapper, config.azure().cliCommand(), config.azure().tokenRefreshThreshold(), clock);
    }

    AzureCliExecutor(CommandRunner runner, ObjectMapper objectMapper, String cliCommand, Duration tokenRefreshThreshold, Clock clock) {
        this.runner = runner;
        this.objectMapper = objectMapper;
        this.cliCommand = cliCommand;
        this.tokenRefreshThreshold = tokenRefreshThreshold;
        this.clock = clock;
    }

    /**
     * Runs a command with {@code --output json}. Empty output yields a missing node.
     */
    public JsonNode json(String... args) {
        List<String> arguments = new ArrayList<>(List.of(args));
        arguments.add("--output");
        arguments.add("json");
        return parse(execute(arguments));
    }

    public <T> T json(Class<T> type, String... args) {
        JsonNode node = json(args);
        return node.isMissingNode() || node.isNull() ? null : convert(node, type);
    }

    public <T> T convert(JsonNode node, Class<T> type) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new ResourceProviderException("Failed to map Azure CLI output to " + type.getSimpleName(), e);
        }
    }

    /**
     * Runs a command whose output is not needed and returns its trimmed stdout.
     */
    public String run(String... args) {
        return execute(List.of(args)).trim();
    }

    /**
     * Checks the current token and refreshes it if it is missing, unreadable or about to expire.
     */
    public void ensureAuthenticated() {
        log.info("Checking Azure CLI authentication...");
        CommandResult result = runCli(List.of("account", "get-access-token", "--output", "json"));
        if (!result.succeeded()) {
            refreshToken();
            return;
        }
        AccessTokenDto token;
        try {
            token = objectMapper.readValue(result.stdout(), AccessTokenDto.class);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable access token response. Refreshing...");
            refreshToken();
            return;
        }
        Optional<Instant> expiresAt = token.expiresAt();
        if (expiresAt.isPresent() && Duration.between(clock.instant(), expiresAt.get()).compareTo(tokenRefreshThreshold) < 0) {
            log.warn("Token expires soon. Refreshing...");
            refreshToken();
            return;
        }
        log.info("Authentication valid.");
    }

    /**
     * Refreshes the token silently, falling back to interactive login.
     */
    public void refreshToken() {
        log.info("Attempting to refresh Azure CLI token...");
        CommandResult result = runCli(List.of("account", "get-access-token", "--output", "json"));
        if (!result.succeeded()) {
            log.info("Token refresh failed. Initiating interactive login...");
            int exitCode;
            try {
                exitCode = runner.runInteractive(command(List.of("login")));
            } catch (IOException e) {
                throw cliMissing(e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ResourceProviderException("Interrupted during Azure login", e);
            }
            if (exitCode != 0) {
                throw new ResourceProviderException("Azure login failed. Please run 'az login' manually.");
            }
        }
        log.info("Token refreshed successfully.");
    }

    JsonNode parse(String stdout) {
        String output = stdout.trim();
        if (output.isEmpty()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(output);
        } catch (JsonProcessingException e) {
            return parseAfterPreamble(output, e);
        }
    }

    // the CLI sometimes prints warning lines before the JSON document
    private JsonNode parseAfterPreamble(String output, JsonProcessingException original) {
        String[] lines = output.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.startsWith("{") || line.startsWith("[")) {
                String json = String.join("\n", List.of(lines).subList(i, lines.length));
                try {
                    return objectMapper.readTree(json);
                } catch (JsonProcessingException e) {
                    throw new ResourceProviderException("Failed to parse JSON output: " + abbreviate(output), e);
                }
            }
        }
        throw new ResourceProviderException("Failed to parse JSON output: " + abbreviate(output), original);
    }

    private String execute(List<String> arguments) {
        CommandResult result = runCli(arguments);
        if (result.succeeded()) {
            return result.stdout();
        }
        String stderr = result.stderr().trim();
        if (!isAuthError(stderr)) {
            throw new ResourceProviderException("Azure CLI command failed: " + stderr);
        }
        log.warn("Access token expired or not found. Refreshing...");
        refreshToken();
        CommandResult retried = runCli(arguments);
        if (!retried.succeeded()) {
            throw new ResourceProviderException("Azure CLI command failed after refresh: " + retried.stderr().trim());
        }
        return retried.stdout();
    }

    private CommandResult runCli(List<String> arguments) {
        List<String> command = command(arguments);
        log.debug("Running {}", String.join(" ", command));
        try {
            return runner.run(command);
        } catch (IOException e) {
            throw cliMissing(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResourceProviderException("Interrupted while running " + String.join(" ", command), e);
        }
    }

    private List<String> command(List<String> arguments) {
        List<String> command = new ArrayList<>(arguments.size() + 1);
        command.add(cliCommand);
        command.addAll(arguments);
        return command;
    }

    private ResourceProviderException cliMissing(IOException e) {
        return new ResourceProviderException("Azure CLI ('%s') not found. Please install it first.".formatted(cliCommand), e);
    }

    static boolean isAuthError(String stderr) {
        return AUTH_ERROR_MARKERS.stream().anyMatch(stderr::contains);
    }

    private static String abbreviate(String output) {
        return output.length() <= MAX_ERROR_OUTPUT ? output : output.substring(0, MAX_ERROR_OUTPUT);
    }
}
