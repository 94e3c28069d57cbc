package com.taskwarden.pool;

import java.util.List;

/**
 * Executable plus leading arguments used to start the agent CLI.
 *
 * @param command executable name or absolute path
 * @param args    arguments placed before any mode-specific arguments
 */
public record CliCommand(String command, List<String> args) {

    public CliCommand {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("command must not be blank");
        }
        args = args != null ? List.copyOf(args) : List.of();
    }
}
