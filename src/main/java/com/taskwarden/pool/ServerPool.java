package com.taskwarden.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Keeps a reserve of pre-started agent server processes so that a task can attach to a
 * warm server instead of paying the CLI's cold-start cost.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Hands out {@link ServerLease}s from the idle queue, or spawns a worker on demand</li>
 *   <li>Replenishes the idle queue in the background up to {@code minIdle}, never exceeding
 *       {@code maxTotal} tracked processes</li>
 *   <li>Backs off exponentially when background warmups keep failing</li>
 *   <li>Drops workers whose process exits, whatever state they were in</li>
 * </ul>
 *
 * <p>All registry and idle-queue mutations happen under a single lock. Slow steps (spawn,
 * port allocation, readiness polling) run outside it, so state is re-validated under the
 * lock after each of them. Capacity is reserved before a spawn starts, which keeps
 * {@code idle + inUse <= total <= maxTotal} true even with concurrent callers.
 */
public class ServerPool {

    private static final Logger log = LoggerFactory.getLogger(ServerPool.class);

    static final String HOST = "127.0.0.1";
    static final int MAX_FAILURE_STREAK = 8;
    static final long BASE_BACKOFF_MS = 1_000L;
    static final long MAX_BACKOFF_MS = 30_000L;

    private final String name;
    private final PoolInfrastructure infra;
    private final Object lock = new Object();

    private final Map<Integer, WorkerHandle> workers = new LinkedHashMap<>();
    private final Deque<WorkerHandle> idleQueue = new ArrayDeque<>();

    private final ExecutorService warmupExecutor;
    private final ScheduledExecutorService retryScheduler;

    private PoolRuntime runtime;
    private PoolOptions options;
    private int nextWorkerId = 1;
    private int warmingCount;
    private int reservedSlots;
    private int warmupFailureStreak;
    private int consecutiveWarmupFailures;
    private boolean warmupSuspended;
    private long warmupBackoffUntil;
    private ScheduledFuture<?> warmupRetry;
    private volatile boolean disposed;

    public ServerPool(String name, PoolRuntime runtime, PoolOptions options, PoolInfrastructure infra) {
        this.name = name;
        this.runtime = runtime;
        this.options = options != null ? options : PoolOptions.defaults();
        this.infra = infra;
        this.warmupExecutor = Executors.newCachedThreadPool(daemonThreads(name + "-warmup"));
        this.retryScheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads(name + "-retry"));
        ensureMinIdle();
    }

    public String name() {
        return name;
    }

    public PoolOptions options() {
        synchronized (lock) {
            return options;
        }
    }

    /**
     * Swaps the runtime collaborator and sizing options. Existing workers are kept; only
     * future spawns see the new runtime. Clears a warmup suspension.
     */
    public void updateConfig(PoolRuntime runtime, PoolOptions options) {
        synchronized (lock) {
            if (disposed) {
                return;
            }
            this.runtime = runtime;
            this.options = options != null ? options : PoolOptions.defaults();
            if (warmupSuspended) {
                log.info("[{}] Configuration updated, resuming warmups", name);
                clearWarmupFailures();
            }
        }
        ensureMinIdle();
    }

    /**
     * Leases a ready worker.
     *
     * @return a warm lease from the idle queue, a cold lease for a freshly spawned worker,
     *         or {@code null} when the pool is disabled or the spawn failed and cold-start
     *         fallback is allowed; the caller then starts the CLI directly
     * @throws PoolDisposedException if the pool was disposed
     * @throws PoolException         if the spawn failed and fallback is disabled
     */
    public ServerLease acquire() {
        WorkerHandle warm;
        synchronized (lock) {
            if (disposed) {
                throw new PoolDisposedException(name);
            }
            if (!options.enabled()) {
                return null;
            }
            pruneIdleQueue();
            warm = idleQueue.pollFirst();
            if (warm != null) {
                warm.setState(WorkerState.IN_USE);
            }
        }

        if (warm != null) {
            ensureMinIdle();
            return createLease(warm, LeaseSource.WARM);
        }

        try {
            reserveSlot();
            WorkerHandle cold = spawnReserved(WorkerState.IN_USE);
            synchronized (lock) {
                if (warmupSuspended) {
                    log.info("[{}] Cold start succeeded, resuming warmups", name);
                    clearWarmupFailures();
                }
            }
            ensureMinIdle();
            return createLease(cold, LeaseSource.COLD);
        } catch (PoolDisposedException e) {
            throw e;
        } catch (RuntimeException e) {
            boolean fallback;
            synchronized (lock) {
                fallback = options.coldStartFallback();
            }
            if (!fallback) {
                throw e;
            }
            if (e instanceof PoolCapacityException) {
                log.debug("[{}] {}; caller will start the CLI directly", name, e.getMessage());
            } else {
                log.warn("[{}] Falling back to direct CLI startup: {}", name, e.getMessage(), e);
            }
            notifyListener(l -> l.leaseAcquired(name, "fallback"));
            ensureMinIdle();
            return null;
        }
    }

    /**
     * Closes the pool for good: cancels pending warmup retries and force-kills every tracked worker.
     */
    public void dispose() {
        List<WorkerHandle> toKill;
        synchronized (lock) {
            if (disposed) {
                return;
            }
            disposed = true;
            if (warmupRetry != null) {
                warmupRetry.cancel(false);
                warmupRetry = null;
            }
            toKill = new ArrayList<>(workers.values());
            toKill.forEach(WorkerHandle::markDead);
            workers.clear();
            idleQueue.clear();
            warmingCount = 0;
        }
        retryScheduler.shutdownNow();
        warmupExecutor.shutdownNow();
        for (WorkerHandle handle : toKill) {
            killProcess(handle, true);
        }
        log.info("[{}] Disposed, killed {} worker(s)", name, toKill.size());
    }

    public boolean isDisposed() {
        return disposed;
    }

    public PoolSnapshot snapshot() {
        synchronized (lock) {
            int inUse = 0;
            int starting = 0;
            for (WorkerHandle handle : workers.values()) {
                if (handle.state() == WorkerState.IN_USE) inUse++;
                else if (handle.state() == WorkerState.STARTING) starting++;
            }
            return new PoolSnapshot(name, idleQueue.size(), inUse, starting, workers.size(),
                    warmingCount, reservedSlots, options.maxTotal(), options.minIdle(),
                    warmupFailureStreak, Math.max(0, warmupBackoffUntil - now()),
                    warmupSuspended, options.enabled(), disposed);
        }
    }

    // -- Leases ---------------------------------------------------------------

    private ServerLease createLease(WorkerHandle worker, LeaseSource source) {
        int workerId = worker.id();
        log.debug("[{}] Leased worker #{} ({}) at {}", name, workerId, source.label(), worker.url());
        notifyListener(l -> l.leaseAcquired(name, source.label()));
        return new ServerLease(workerId, worker.url(), source,
                () -> releaseWorker(workerId),
                () -> retireWorker(workerId));
    }

    void releaseWorker(int workerId) {
        synchronized (lock) {
            WorkerHandle worker = workers.get(workerId);
            if (worker != null && worker.isAlive() && worker.state() != WorkerState.IDLE) {
                worker.setState(WorkerState.IDLE);
                idleQueue.addLast(worker);
                log.debug("[{}] Worker #{} returned to idle queue", name, workerId);
            }
        }
        ensureMinIdle();
    }

    void retireWorker(int workerId) {
        WorkerHandle worker;
        synchronized (lock) {
            worker = workers.get(workerId);
        }
        if (worker != null) {
            log.debug("[{}] Retiring worker #{}", name, workerId);
            killWorker(worker, false);
        }
        ensureMinIdle();
    }

    private void pruneIdleQueue() {
        idleQueue.removeIf(worker -> !worker.isAlive()
                || workers.get(worker.id()) != worker
                || worker.state() != WorkerState.IDLE);
    }

    // -- Replenishment --------------------------------------------------------

    private void ensureMinIdle() {
        synchronized (lock) {
            if (disposed || !options.enabled()) {
                return;
            }
            while (shouldWarmAnotherWorker()) {
                warmingCount++;
                reservedSlots++;
                warmupExecutor.execute(this::runWarmup);
            }
        }
    }

    private boolean shouldWarmAnotherWorker() {
        if (warmupSuspended || warmupBackoffUntil > now()) {
            return false;
        }
        if (idleQueue.size() + warmingCount >= options.minIdle()) {
            return false;
        }
        return workers.size() + reservedSlots < options.maxTotal();
    }

    private void runWarmup() {
        try {
            spawnReserved(WorkerState.IDLE);
            synchronized (lock) {
                clearWarmupFailures();
            }
        } catch (RuntimeException e) {
            recordWarmupFailure(e);
        } finally {
            synchronized (lock) {
                warmingCount = Math.max(0, warmingCount - 1);
            }
        }
        afterWarmup();
    }

    private void afterWarmup() {
        synchronized (lock) {
            if (disposed) {
                return;
            }
            long retryDelay = warmupBackoffUntil - now();
            if (retryDelay > 0) {
                scheduleWarmupRetry(retryDelay);
                return;
            }
        }
        ensureMinIdle();
    }

    private void recordWarmupFailure(RuntimeException error) {
        if (disposed) {
            log.debug("[{}] Warmup abandoned during dispose: {}", name, error.getMessage());
            return;
        }
        int streak;
        long backoffMs;
        boolean suspendedNow = false;
        int consecutive;
        synchronized (lock) {
            warmupFailureStreak = Math.min(warmupFailureStreak + 1, MAX_FAILURE_STREAK);
            consecutiveWarmupFailures++;
            streak = warmupFailureStreak;
            consecutive = consecutiveWarmupFailures;
            backoffMs = backoffFor(streak);
            warmupBackoffUntil = now() + backoffMs;
            int limit = infra.maxWarmupFailures();
            if (limit > 0 && consecutive >= limit && !warmupSuspended) {
                warmupSuspended = true;
                suspendedNow = true;
            }
        }
        log.warn("[{}] Warm server startup failed. Retrying in {}ms: {}", name, backoffMs, error.getMessage());
        notifyListener(l -> l.warmupFailed(name, streak, backoffMs, error));
        if (suspendedNow) {
            log.error("[{}] Warmups suspended after {} consecutive failures; acquire() keeps cold-starting "
                    + "until a spawn succeeds or the configuration is updated", name, consecutive);
            notifyListener(l -> l.warmupSuspended(name, consecutive));
        }
    }

    private void scheduleWarmupRetry(long delayMs) {
        if (warmupRetry != null) {
            warmupRetry.cancel(false);
        }
        warmupRetry = retryScheduler.schedule(() -> {
            synchronized (lock) {
                warmupRetry = null;
            }
            if (!disposed) {
                ensureMinIdle();
            }
        }, delayMs, TimeUnit.MILLISECONDS);
    }

    private void clearWarmupFailures() {
        warmupFailureStreak = 0;
        consecutiveWarmupFailures = 0;
        warmupBackoffUntil = 0;
        warmupSuspended = false;
    }

    /**
     * Backoff after the given (already capped) failure streak: 1s, 2s, 4s ... capped at 30s.
     */
    static long backoffFor(int failureStreak) {
        int exponent = Math.max(0, failureStreak - 1);
        return Math.min((1L << exponent) * BASE_BACKOFF_MS, MAX_BACKOFF_MS);
    }

    // -- Spawning -------------------------------------------------------------

    private void reserveSlot() {
        synchronized (lock) {
            if (disposed) {
                throw new PoolDisposedException(name);
            }
            if (workers.size() + reservedSlots >= options.maxTotal()) {
                throw new PoolCapacityException(name, options.maxTotal());
            }
            reservedSlots++;
        }
    }

    /**
     * Spawns a worker into a slot already counted in {@code reservedSlots} and waits for it to
     * become ready. The reservation is converted into a registry entry or given back.
     */
    private WorkerHandle spawnReserved(WorkerState target) {
        WorkerHandle worker = null;
        PoolOptions spawnOptions;
        try {
            PoolRuntime spawnRuntime;
            synchronized (lock) {
                spawnRuntime = runtime;
                spawnOptions = options;
            }

            spawnRuntime.beforeStart();
            CliCommand cli = spawnRuntime.cliCommand();
            Map<String, String> environment = spawnEnvironment(spawnRuntime.buildEnvironment());
            int port = infra.portAllocator().allocate();

            var args = new ArrayList<>(cli.args());
            args.addAll(List.of("serve", "--hostname", HOST, "--port", String.valueOf(port)));
            LaunchedWorker process = infra.launcher().launch(new WorkerLaunchRequest(
                    cli.command(), args, spawnRuntime.workingDirectory(), environment));

            synchronized (lock) {
                reservedSlots = Math.max(0, reservedSlots - 1);
                worker = new WorkerHandle(nextWorkerId++, "http://" + HOST + ":" + port, process,
                        target == WorkerState.IDLE ? WorkerState.STARTING : target, now());
                if (disposed) {
                    worker.markDead();
                } else {
                    workers.put(worker.id(), worker);
                }
            }
        } finally {
            if (worker == null) {
                synchronized (lock) {
                    reservedSlots = Math.max(0, reservedSlots - 1);
                }
            }
        }

        if (!worker.isAlive()) {
            killProcess(worker, true);
            throw new PoolDisposedException(name);
        }

        int workerId = worker.id();
        worker.process().onExit().whenComplete((exitCode, error) -> {
            if (error != null) {
                handleWorkerError(workerId, unwrap(error));
            } else {
                handleWorkerExit(workerId, exitCode);
            }
        });

        try {
            waitForReady(worker, spawnOptions);
            synchronized (lock) {
                if (!worker.isAlive()) {
                    throw new WorkerStartupException(name + " worker exited during startup");
                }
                if (target == WorkerState.IDLE) {
                    worker.setState(WorkerState.IDLE);
                    idleQueue.addLast(worker);
                }
            }
        } catch (RuntimeException e) {
            killWorker(worker, true);
            throw e;
        }

        long startupMs = now() - worker.launchedAtMs();
        log.info("[{}] Worker #{} ready at {} in {}ms ({})", name, workerId, worker.url(), startupMs,
                target == WorkerState.IDLE ? "warm" : "cold");
        WorkerHandle ready = worker;
        notifyListener(l -> l.workerReady(name, workerId, ready.url(), startupMs));
        return worker;
    }

    private void waitForReady(WorkerHandle worker, PoolOptions spawnOptions) {
        long deadline = now() + spawnOptions.startupTimeoutMs();
        while (now() < deadline) {
            if (disposed) {
                throw new WorkerStartupException(name + " disposed while waiting for worker readiness");
            }
            Throwable failure = worker.startupFailure();
            if (failure != null) {
                throw new WorkerStartupException(name + " worker failed during startup: " + failure.getMessage(), failure);
            }
            if (!worker.isAlive()) {
                throw new WorkerStartupException(name + " worker exited during startup");
            }
            if (infra.healthProbe().isReady(worker.url())) {
                return;
            }
            try {
                Thread.sleep(infra.pollInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new WorkerStartupException(name + " interrupted while waiting for worker readiness", e);
            }
        }
        throw new WorkerStartupException(name + " worker startup timed out after "
                + spawnOptions.startupTimeoutMs() + "ms");
    }

    private static Map<String, String> spawnEnvironment(Map<String, String> overrides) {
        var environment = new LinkedHashMap<String, String>();
        if (overrides != null) {
            overrides.forEach((key, value) -> {
                if (key != null && value != null) {
                    environment.put(key, value);
                }
            });
        }
        return environment;
    }

    // -- Process exit / teardown ----------------------------------------------

    private void handleWorkerExit(int workerId, Integer exitCode) {
        WorkerHandle worker;
        synchronized (lock) {
            worker = workers.remove(workerId);
            if (worker == null) {
                return;
            }
            worker.markDead();
            idleQueue.remove(worker);
        }
        WorkerState lastState = worker.state();
        log.warn("[{}] Worker #{} exited with code {} while {}", name, workerId, exitCode, lastState);
        notifyListener(l -> l.workerExited(name, workerId, exitCode, lastState));
        if (!disposed) {
            ensureMinIdle();
        }
    }

    private void handleWorkerError(int workerId, Throwable error) {
        WorkerHandle worker;
        synchronized (lock) {
            worker = workers.remove(workerId);
            if (worker == null) {
                return;
            }
            worker.setStartupFailure(error);
            worker.markDead();
            idleQueue.remove(worker);
        }
        WorkerState lastState = worker.state();
        log.warn("[{}] Worker #{} process error while {}: {}", name, workerId, lastState, error.getMessage());
        notifyListener(l -> l.workerExited(name, workerId, null, lastState));
        if (!disposed) {
            ensureMinIdle();
        }
    }

    private void killWorker(WorkerHandle worker, boolean forcibly) {
        synchronized (lock) {
            if (!worker.isAlive()) {
                return;
            }
            worker.markDead();
            workers.remove(worker.id());
            idleQueue.remove(worker);
        }
        killProcess(worker, forcibly);
    }

    private void killProcess(WorkerHandle worker, boolean forcibly) {
        try {
            worker.process().kill(forcibly);
        } catch (RuntimeException e) {
            log.debug("[{}] Could not kill worker #{}: {}", name, worker.id(), e.getMessage());
        }
    }

    // -- Helpers --------------------------------------------------------------

    private long now() {
        return infra.clock().millis();
    }

    private void notifyListener(Consumer<PoolListener> notification) {
        try {
            notification.accept(infra.listener());
        } catch (RuntimeException e) {
            log.warn("[{}] Pool listener threw: {}", name, e.getMessage(), e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
