package com.taskwarden.pool;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-use right to one pooled worker.
 *
 * <p>Exactly one of {@link #release()} or {@link #retire()} takes effect; every later
 * call on the same lease is a no-op.
 */
public final class ServerLease {

    private final int workerId;
    private final String url;
    private final LeaseSource source;
    private final Runnable onRelease;
    private final Runnable onRetire;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    ServerLease(int workerId, String url, LeaseSource source, Runnable onRelease, Runnable onRetire) {
        this.workerId = workerId;
        this.url = url;
        this.source = source;
        this.onRelease = onRelease;
        this.onRetire = onRetire;
    }

    /** Base URL the agent CLI should attach to. */
    public String url() {
        return url;
    }

    public LeaseSource source() {
        return source;
    }

    public int workerId() {
        return workerId;
    }

    /** Returns the worker to the idle queue. */
    public void release() {
        if (closed.compareAndSet(false, true)) {
            onRelease.run();
        }
    }

    /** Kills the worker; use when its session state is no longer trustworthy. */
    public void retire() {
        if (closed.compareAndSet(false, true)) {
            onRetire.run();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public String toString() {
        return "ServerLease[" + source.label() + " " + url + (isClosed() ? ", closed" : "") + "]";
    }
}
