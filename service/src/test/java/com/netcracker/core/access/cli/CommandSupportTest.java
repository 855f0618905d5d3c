package com.netcracker.core.access.cli;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class CommandSupportTest {
    private final CommandLine commandLine = new CommandLine(CommandLine.Model.CommandSpec.create());

    @Test
    void sourceAddressIsTrimmed() {
        assertEquals("198.51.100.7", CommandSupport.sourceAddress(commandLine, " 198.51.100.7 "));
        assertEquals("2001:db8::1", CommandSupport.sourceAddress(commandLine, "2001:db8::1"));
    }

    @Test
    void prefixOrJunkSourceIsUsageError() {
        assertThatThrownBy(() -> CommandSupport.sourceAddress(commandLine, "198.51.100.0/24"))
                .isInstanceOf(CommandLine.ParameterException.class)
                .hasMessageContaining("198.51.100.0/24");
        assertThatThrownBy(() -> CommandSupport.sourceAddress(commandLine, "my-laptop"))
                .isInstanceOf(CommandLine.ParameterException.class);
        assertThatThrownBy(() -> CommandSupport.sourceAddress(commandLine, " "))
                .isInstanceOf(CommandLine.ParameterException.class);
    }
}
