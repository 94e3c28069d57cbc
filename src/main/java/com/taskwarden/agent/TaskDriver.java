package com.taskwarden.agent;

import com.taskwarden.completion.CompletionCallbacks;
import com.taskwarden.completion.CompletionEnforcer;
import com.taskwarden.completion.CompletionEnforcerFactory;
import com.taskwarden.completion.StepFinishAction;
import com.taskwarden.core.events.EventBus;
import com.taskwarden.core.events.TaskwardenEvent;
import com.taskwarden.core.logging.MdcContext;
import com.taskwarden.core.metrics.TaskwardenMetrics;
import com.taskwarden.pool.PoolException;
import com.taskwarden.pool.ServerLease;
import com.taskwarden.pool.ServerPoolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Drives one agent task from the first prompt to a final {@link TaskOutcome}.
 *
 * <p>Leases a pooled server (or runs the CLI standalone when the pool hands out no lease),
 * streams the agent's events through a {@link CompletionSignalRouter}, and lets the
 * {@link CompletionEnforcer} decide after every process exit whether another turn is owed.
 * Continuation turns resume the same agent session on the same server.
 */
@Service
public class TaskDriver {

    private static final Logger log = LoggerFactory.getLogger(TaskDriver.class);

    private final ServerPoolRegistry pools;
    private final AgentRunner runner;
    private final AgentEventParser parser;
    private final CompletionEnforcerFactory enforcerFactory;
    private final EventBus eventBus;
    private final TaskwardenMetrics metrics;

    public TaskDriver(ServerPoolRegistry pools, AgentRunner runner, AgentEventParser parser,
                      CompletionEnforcerFactory enforcerFactory, EventBus eventBus, TaskwardenMetrics metrics) {
        this.pools = pools;
        this.runner = runner;
        this.parser = parser;
        this.enforcerFactory = enforcerFactory;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public TaskOutcome execute(String taskId, String prompt) {
        MdcContext.setTask(taskId);
        try {
            ServerLease lease = acquireLease();
            if (lease != null) {
                MdcContext.setWorker(pools.defaultPlatform(), lease.workerId());
            }
            log.info("Starting task ({})", lease != null ? lease.source().label() + " server " + lease.url() : "direct");

            TaskCallbacks callbacks = new TaskCallbacks(taskId);
            CompletionEnforcer enforcer = enforcerFactory.create(callbacks);
            CompletionSignalRouter router = new CompletionSignalRouter(enforcer);

            String error = null;
            try {
                error = drive(prompt, lease != null ? lease.url() : null, enforcer, router, callbacks);
            } catch (RuntimeException e) {
                Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                log.error("Task failed: {}", cause.getMessage(), cause);
                error = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            } finally {
                closeLease(lease, error != null);
            }

            TaskOutcome outcome = toOutcome(taskId, lease, enforcer, router, error);
            report(outcome);
            return outcome;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Runs agent turns until the enforcer stops asking for continuations.
     *
     * @return an error message, or null when the task ended normally
     */
    private String drive(String prompt, String attachUrl, CompletionEnforcer enforcer,
                         CompletionSignalRouter router, TaskCallbacks callbacks) {
        String currentPrompt = prompt;
        while (true) {
            callbacks.nextPrompt = null;
            boolean completedAtStep = false;
            int exitCode;

            try (AgentRun run = runner.start(new AgentRunRequest(currentPrompt, router.sessionId(), attachUrl))) {
                Iterator<String> lines = run.lines().iterator();
                while (lines.hasNext()) {
                    Optional<AgentEvent> parsed = parser.parse(lines.next());
                    if (parsed.isEmpty()) {
                        continue;
                    }
                    AgentEvent event = parsed.get();
                    if (event.type() == AgentEventType.TEXT && !enforcer.isInContinuation()) {
                        eventBus.publish(TaskwardenEvent.of("agent.text", callbacks.taskId, "agent",
                                event.text(), Map.of()));
                    }
                    if (router.route(event) == StepFinishAction.COMPLETE) {
                        completedAtStep = true;
                    }
                }
                exitCode = run.waitFor();
            }

            if (router.hasError()) {
                return router.errorMessage();
            }
            if (exitCode != 0) {
                enforcer.handleProcessExit(exitCode).join();
                return "Agent CLI exited with code " + exitCode;
            }
            if (completedAtStep) {
                return null;
            }

            enforcer.handleProcessExit(exitCode).join();
            if (callbacks.nextPrompt == null) {
                return null;
            }
            if (router.sessionId() == null) {
                return "No session ID available for session resumption";
            }
            currentPrompt = callbacks.nextPrompt;
            MdcContext.setAttempt(enforcer.getContinuationAttempts());
            log.info("Resuming session {} (continuation {})", router.sessionId(), enforcer.getContinuationAttempts());
        }
    }

    private ServerLease acquireLease() {
        try {
            return pools.getDefaultPool().acquire();
        } catch (PoolException e) {
            log.warn("No pooled server available, running the agent directly: {}", e.getMessage());
            return null;
        }
    }

    private void closeLease(ServerLease lease, boolean failed) {
        if (lease == null) {
            return;
        }
        if (failed) {
            log.info("Retiring server {} after a failed run", lease.url());
            lease.retire();
        } else {
            lease.release();
        }
    }

    private TaskOutcome toOutcome(String taskId, ServerLease lease, CompletionEnforcer enforcer,
                                  CompletionSignalRouter router, String error) {
        TaskStatus status;
        if (error != null) {
            status = TaskStatus.ERROR;
        } else {
            status = switch (enforcer.getState()) {
                case BLOCKED -> TaskStatus.BLOCKED;
                case MAX_RETRIES_REACHED -> TaskStatus.MAX_RETRIES;
                default -> TaskStatus.COMPLETED;
            };
        }
        String summary = enforcer.getDeclaration() != null ? enforcer.getDeclaration().summary() : null;
        return new TaskOutcome(taskId, status, enforcer.getState(), enforcer.getContinuationAttempts(),
                lease != null ? lease.source().label() : "direct", router.sessionId(), summary, error);
    }

    private void report(TaskOutcome outcome) {
        metrics.recordOutcome(outcome.finalState().name());
        metrics.recordContinuationDepth(outcome.continuationAttempts());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", outcome.status().name());
        payload.put("state", outcome.finalState().name());
        payload.put("continuationAttempts", outcome.continuationAttempts());
        payload.put("leaseSource", outcome.leaseSource());
        if (outcome.error() != null) payload.put("error", outcome.error());
        eventBus.publish(TaskwardenEvent.of("task.completed", outcome.taskId(), "driver",
                "Task finished: " + outcome.status(), payload));

        if (outcome.status() == TaskStatus.ERROR) {
            log.warn("Task finished with error: {}", outcome.error());
        } else {
            log.info("Task finished: {} ({} continuation(s))", outcome.status(), outcome.continuationAttempts());
        }
    }

    /**
     * Enforcer callbacks for one task. Continuations are recorded and started by the drive loop.
     */
    private final class TaskCallbacks implements CompletionCallbacks {

        private final String taskId;
        private String nextPrompt;

        private TaskCallbacks(String taskId) {
            this.taskId = taskId;
        }

        @Override
        public CompletableFuture<Void> onStartContinuation(String prompt) {
            nextPrompt = prompt;
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void onComplete() {
            log.debug("Enforcer finalized the task");
        }

        @Override
        public void onDebug(String category, String message, Map<String, Object> data) {
            Object kind = data != null ? data.get("kind") : null;
            if (kind != null) {
                metrics.recordContinuation(kind.toString());
            }
            eventBus.publish(TaskwardenEvent.of("completion." + category, taskId, "completion", message, data));
        }
    }
}
