package com.taskwarden.dispatch.cli;

import com.taskwarden.agent.TaskDriver;
import com.taskwarden.agent.TaskOutcome;
import com.taskwarden.core.events.EventBus;
import com.taskwarden.core.events.TaskwardenEvent;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * CLI command: taskwarden run "&lt;prompt&gt;"
 * <p>
 * Drives one agent task to completion, printing agent text and continuation prompts as
 * they happen. Exit code 0 only for a completed task.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run one agent task to completion")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Prompt for the agent")
    private String prompt;

    @Option(names = {"--task-id"}, description = "Task identifier (default: random)")
    private String taskId;

    @Option(names = {"--quiet", "-q"}, description = "Only print the final outcome")
    private boolean quiet;

    private final TaskDriver taskDriver;
    private final EventBus eventBus;

    public RunCommand(TaskDriver taskDriver, EventBus eventBus) {
        this.taskDriver = taskDriver;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        String id = taskId != null && !taskId.isBlank() ? taskId : "task-" + UUID.randomUUID();
        ConsoleOutput.info("Task " + id);

        EventBus.Subscription subscription = quiet ? null : eventBus.subscribe(id, RunCommand::print);
        TaskOutcome outcome;
        try {
            outcome = taskDriver.execute(id, prompt);
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }

        ConsoleOutput.outcome(outcome);
        return outcome.isSuccess() ? 0 : 1;
    }

    private static void print(TaskwardenEvent event) {
        switch (event.eventType()) {
            case "agent.text" -> ConsoleOutput.agent(event.message());
            case "completion.continuation", "completion.partial_continuation" -> {
                if (event.message().startsWith("Starting")) {
                    ConsoleOutput.continuation(event.message());
                }
            }
            case "completion.incomplete_todos" -> ConsoleOutput.warn(event.message());
            default -> {
            }
        }
    }
}
