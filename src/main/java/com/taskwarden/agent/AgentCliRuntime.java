package com.taskwarden.agent;

import com.taskwarden.pool.CliCommand;
import com.taskwarden.pool.PoolRuntime;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Launch settings of the agent CLI, shared by the server pool and direct runs.
 */
@Component
public class AgentCliRuntime implements PoolRuntime {

    private final AgentProperties properties;

    public AgentCliRuntime(AgentProperties properties) {
        this.properties = properties;
    }

    @Override
    public CliCommand cliCommand() {
        return new CliCommand(properties.getCommand(), properties.getArgs());
    }

    @Override
    public Path workingDirectory() {
        return Path.of(properties.getWorkingDirectory()).toAbsolutePath().normalize();
    }

    @Override
    public Map<String, String> buildEnvironment() {
        Map<String, String> env = new LinkedHashMap<>();
        if (properties.getEnvironment() != null) {
            env.putAll(properties.getEnvironment());
        }
        return env;
    }

    @Override
    public void beforeStart() {
        try {
            Files.createDirectories(workingDirectory());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create working directory " + workingDirectory(), e);
        }
    }
}
