package com.taskwarden.pool;

/**
 * One spawned agent server tracked by a {@link ServerPool}.
 *
 * <p>All mutable fields are written under the owning pool's lock. A handle whose
 * {@code alive} flag is false is never placed in the idle queue.
 */
final class WorkerHandle {

    private final int id;
    private final String url;
    private final LaunchedWorker process;
    private final long launchedAtMs;

    private volatile WorkerState state;
    private volatile boolean alive = true;
    private volatile Throwable startupFailure;

    WorkerHandle(int id, String url, LaunchedWorker process, WorkerState state, long launchedAtMs) {
        this.id = id;
        this.url = url;
        this.process = process;
        this.state = state;
        this.launchedAtMs = launchedAtMs;
    }

    int id() { return id; }
    String url() { return url; }
    LaunchedWorker process() { return process; }
    long launchedAtMs() { return launchedAtMs; }

    WorkerState state() { return state; }
    void setState(WorkerState state) { this.state = state; }

    boolean isAlive() { return alive; }
    void markDead() { this.alive = false; }

    Throwable startupFailure() { return startupFailure; }
    void setStartupFailure(Throwable startupFailure) { this.startupFailure = startupFailure; }

    @Override
    public String toString() {
        return "worker#" + id + "(" + url + ", " + state + (alive ? "" : ", dead") + ")";
    }
}
