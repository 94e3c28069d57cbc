package com.taskwarden.agent;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * How to launch the external agent CLI, shared by pooled servers and direct runs.
 */
@Component
@ConfigurationProperties(prefix = "taskwarden.agent")
public class AgentProperties {

    private String command = "opencode";
    private List<String> args = new ArrayList<>();
    private String workingDirectory = ".";
    private Map<String, String> environment = new LinkedHashMap<>();

    public String getCommand() { return command; }
    public void setCommand(String command) { this.command = command; }
    public List<String> getArgs() { return args; }
    public void setArgs(List<String> args) { this.args = args; }
    public String getWorkingDirectory() { return workingDirectory; }
    public void setWorkingDirectory(String workingDirectory) { this.workingDirectory = workingDirectory; }
    public Map<String, String> getEnvironment() { return environment; }
    public void setEnvironment(Map<String, String> environment) { this.environment = environment; }
}
