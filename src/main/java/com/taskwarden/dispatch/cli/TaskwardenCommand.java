package com.taskwarden.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command. Routes to subcommands: run, pool, health, serve.
 */
@Command(
        name = "taskwarden",
        mixinStandardHelpOptions = true,
        version = "Taskwarden 0.1.0",
        description = "Warm server pool and completion enforcement for agent CLI tasks",
        subcommands = {
                RunCommand.class,
                PoolCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TaskwardenCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
