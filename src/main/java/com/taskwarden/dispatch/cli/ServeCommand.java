package com.taskwarden.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: taskwarden serve
 * <p>
 * Runs Taskwarden as a long-lived HTTP server exposing pool and health endpoints. The web
 * server is enabled by {@link com.taskwarden.TaskwardenApplication#main} when "serve" is
 * among the arguments; {@link CliRunner} then skips picocli.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Taskwarden HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached via --help style invocations; serve mode bypasses picocli
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Taskwarden server running on port " + port);
        System.out.println();
        System.out.println("  Health:  http://localhost:" + port + "/api/v1/health");
        System.out.println("  Pools:   http://localhost:" + port + "/api/v1/pools");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
