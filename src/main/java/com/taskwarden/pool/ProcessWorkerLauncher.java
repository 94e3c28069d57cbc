package com.taskwarden.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.concurrent.CompletableFuture;

/**
 * Launches workers as local child processes via {@link ProcessBuilder}.
 *
 * <p>Output is discarded so the child can never block on a full pipe, and nothing
 * joins the child, so it does not keep the JVM alive.
 */
public class ProcessWorkerLauncher implements WorkerLauncher {

    private static final Logger log = LoggerFactory.getLogger(ProcessWorkerLauncher.class);

    @Override
    public LaunchedWorker launch(WorkerLaunchRequest request) {
        var commandLine = new ArrayList<String>();
        commandLine.add(request.command());
        commandLine.addAll(request.args());

        var builder = new ProcessBuilder(commandLine)
                .directory(request.workingDirectory().toFile())
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.DISCARD);
        builder.environment().putAll(request.environment());

        try {
            Process process = builder.start();
            log.debug("Started worker process pid={} ({})", process.pid(), String.join(" ", commandLine));
            return new LocalWorker(process);
        } catch (IOException e) {
            throw new WorkerStartupException("Failed to start " + request.command() + ": " + e.getMessage(), e);
        }
    }

    private static final class LocalWorker implements LaunchedWorker {

        private final Process process;
        private final CompletableFuture<Integer> exit;

        private LocalWorker(Process process) {
            this.process = process;
            this.exit = process.onExit().thenApply(Process::exitValue);
        }

        @Override
        public CompletableFuture<Integer> onExit() {
            return exit;
        }

        @Override
        public void kill(boolean forcibly) {
            if (!process.isAlive()) {
                return;
            }
            if (forcibly) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
            } else {
                process.destroy();
            }
        }
    }
}
