package com.netcracker.core.access.client.prompt;

import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;

/**
 * Prompt backed by standard input. End of input answers "no".
 */
@ApplicationScoped
@Slf4j
public class ConsolePrompt implements OperatorPrompt {
    private static final Set<String> YES = Set.of("y", "yes");

    private final BufferedReader reader;
    private final PrintStream out;

    public ConsolePrompt() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    ConsolePrompt(BufferedReader reader, PrintStream out) {
        this.reader = reader;
        this.out = out;
    }

    @Override
    public boolean askYesNo(String message) {
        String answer = readLine(message + " (y/n)");
        return answer != null && YES.contains(answer.trim().toLowerCase(Locale.ROOT));
    }

    @Override
    public String readLine(String message) {
        out.print(message + ": ");
        out.flush();
        try {
            String line = reader.readLine();
            if (line == null) {
                log.debug("No input available for prompt '{}'", message);
            }
            return line;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read operator input", e);
        }
    }
}
