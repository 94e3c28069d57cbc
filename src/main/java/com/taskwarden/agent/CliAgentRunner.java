package com.taskwarden.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Runs {@code <command> <args> run --format json [--attach url] [--session id] <prompt>}
 * as a local process, stdout and stderr merged.
 */
@Component
public class CliAgentRunner implements AgentRunner {

    private static final Logger log = LoggerFactory.getLogger(CliAgentRunner.class);

    private final AgentProperties properties;
    private final AgentCliRuntime runtime;

    public CliAgentRunner(AgentProperties properties, AgentCliRuntime runtime) {
        this.properties = properties;
        this.runtime = runtime;
    }

    @Override
    public AgentRun start(AgentRunRequest request) {
        List<String> command = buildCommand(properties.getCommand(), properties.getArgs(), request);
        log.debug("Starting agent run: {} ({} args)", command.get(0), command.size() - 1);

        runtime.beforeStart();
        var builder = new ProcessBuilder(command)
                .directory(runtime.workingDirectory().toFile())
                .redirectErrorStream(true);
        builder.environment().putAll(runtime.buildEnvironment());
        try {
            return new ProcessAgentRun(builder.start());
        } catch (IOException e) {
            throw new AgentRunException("Failed to start " + properties.getCommand() + ": " + e.getMessage(), e);
        }
    }

    static List<String> buildCommand(String executable, List<String> baseArgs, AgentRunRequest request) {
        var command = new ArrayList<String>();
        command.add(executable);
        if (baseArgs != null) {
            command.addAll(baseArgs);
        }
        command.addAll(List.of("run", "--format", "json"));
        if (request.attachUrl() != null) {
            command.addAll(List.of("--attach", request.attachUrl()));
        }
        if (request.sessionId() != null) {
            command.addAll(List.of("--session", request.sessionId()));
        }
        command.add(request.prompt());
        return command;
    }

    static final class ProcessAgentRun implements AgentRun {

        private final Process process;
        private final BufferedReader reader;

        ProcessAgentRun(Process process) {
            this.process = process;
            this.reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
        }

        @Override
        public Stream<String> lines() {
            return reader.lines();
        }

        @Override
        public int waitFor() {
            try {
                return process.waitFor();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
                throw new AgentRunException("Interrupted while waiting for the agent process", e);
            }
        }

        @Override
        public void close() {
            if (process.isAlive()) {
                process.destroy();
            }
            try {
                reader.close();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
