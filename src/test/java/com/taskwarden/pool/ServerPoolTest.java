package com.taskwarden.pool;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class ServerPoolTest {

    private FakeWorkerLauncher launcher;
    private AtomicBoolean ready;
    private RecordingListener listener;
    private final List<ServerPool> pools = new ArrayList<>();

    @BeforeEach
    void setUp() {
        launcher = new FakeWorkerLauncher();
        ready = new AtomicBoolean(true);
        listener = new RecordingListener();
    }

    @AfterEach
    void tearDown() {
        pools.forEach(ServerPool::dispose);
    }

    private ServerPool pool(int minIdle, int maxTotal, boolean fallback) {
        return pool(new PoolOptions(minIdle, maxTotal, fallback, 2_000, true), 0);
    }

    private ServerPool pool(PoolOptions options, int maxWarmupFailures) {
        var infra = new PoolInfrastructure(launcher, url -> ready.get(), new FakeWorkerLauncher.SequentialPorts(),
                Clock.systemUTC(), listener, Duration.ofMillis(10), maxWarmupFailures);
        var pool = new ServerPool("test", new TestRuntime(), options, infra);
        pools.add(pool);
        return pool;
    }

    private static void await(String what, BooleanSupplier condition) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Timed out waiting for " + what);
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted waiting for " + what);
            }
        }
    }

    private static void assertInvariant(PoolSnapshot s) {
        assertTrue(s.idle() + s.inUse() <= s.total(), "idle + inUse <= total: " + s);
        assertTrue(s.total() <= s.maxTotal(), "total <= maxTotal: " + s);
    }

    // -- Warm and cold leases -------------------------------------------------

    @Nested
    @DisplayName("acquire")
    class AcquireTests {

        @Test
        @DisplayName("hands out a warm worker once the background warmup is ready")
        void warmLeaseAfterWarmup() {
            var pool = pool(1, 2, true);
            await("warm worker", () -> pool.snapshot().idle() == 1);

            ServerLease lease = pool.acquire();

            assertNotNull(lease);
            assertEquals(LeaseSource.WARM, lease.source());
            assertEquals(launcher.workers.get(0).url(), lease.url());
            assertTrue(lease.url().startsWith("http://127.0.0.1:"));
            assertEquals(1, pool.snapshot().inUse());
            assertTrue(listener.leaseSources.contains("warm"));
        }

        @Test
        @DisplayName("replenishes the reserve after a warm lease is taken")
        void replenishesAfterWarmLease() {
            var pool = pool(1, 2, true);
            await("warm worker", () -> pool.snapshot().idle() == 1);

            pool.acquire();

            await("replacement warm worker", () -> pool.snapshot().idle() == 1);
            var snapshot = pool.snapshot();
            assertEquals(2, snapshot.total());
            assertEquals(1, snapshot.inUse());
            assertInvariant(snapshot);
        }

        @Test
        @DisplayName("acquire after release returns the same worker as a warm lease")
        void reusesReleasedWorker() {
            var pool = pool(1, 1, true);
            await("warm worker", () -> pool.snapshot().idle() == 1);

            ServerLease first = pool.acquire();
            first.release();
            ServerLease second = pool.acquire();

            assertEquals(first.workerId(), second.workerId());
            assertEquals(LeaseSource.WARM, second.source());
            assertEquals(1, launcher.workers.size());
        }

        @Test
        @DisplayName("spawns a cold worker when none is ready yet")
        void coldLeaseWhenNothingReady() throws Exception {
            ready.set(false);
            var pool = pool(1, 2, true);
            await("warmup spawn", () -> launcher.workers.size() == 1);

            CompletableFuture<ServerLease> pending = CompletableFuture.supplyAsync(pool::acquire);
            await("cold spawn", () -> launcher.workers.size() == 2);
            ready.set(true);
            ServerLease lease = pending.get(5, TimeUnit.SECONDS);

            assertNotNull(lease);
            assertEquals(LeaseSource.COLD, lease.source());
            assertEquals(launcher.workers.get(1).url(), lease.url());
            await("warm worker", () -> pool.snapshot().idle() == 1);
            assertInvariant(pool.snapshot());
        }

        @Test
        @DisplayName("passes server-mode arguments on a loopback port")
        void launchesServerMode() {
            var pool = pool(1, 1, true);
            await("warm worker", () -> pool.snapshot().idle() == 1);

            WorkerLaunchRequest request = launcher.requests.get(0);
            assertEquals("opencode", request.command());
            assertEquals(List.of("--print-logs", "serve", "--hostname", "127.0.0.1", "--port", "41000"),
                    request.args());
            assertEquals(Map.of("OPENCODE_CONFIG", "/tmp/config.json"), request.environment());
        }

        @Test
        @DisplayName("disabled pool returns null and never spawns")
        void disabledPool() {
            var pool = pool(new PoolOptions(1, 2, true, 2_000, false), 0);

            assertNull(pool.acquire());
            assertTrue(launcher.requests.isEmpty());
        }
    }

    // -- Failure handling -----------------------------------------------------

    @Nested
    @DisplayName("spawn failures")
    class FailureTests {

        @Test
        @DisplayName("fallback enabled: failed cold start yields null")
        void fallbackReturnsNull() {
            launcher.alwaysFail = true;
            var pool = pool(1, 2, true);

            assertNull(pool.acquire());
            assertTrue(listener.leaseSources.contains("fallback"));
        }

        @Test
        @DisplayName("fallback disabled: failed cold start propagates")
        void fallbackDisabledPropagates() {
            launcher.alwaysFail = true;
            var pool = pool(1, 2, false);

            assertThrows(WorkerStartupException.class, pool::acquire);
        }

        @Test
        @DisplayName("at capacity: null with fallback, PoolCapacityException without")
        void capacity() {
            var lenient = pool(1, 1, true);
            await("warm worker", () -> lenient.snapshot().idle() == 1);
            assertNotNull(lenient.acquire());
            assertNull(lenient.acquire());

            var strict = pool(1, 1, false);
            await("warm worker", () -> strict.snapshot().idle() == 1);
            assertNotNull(strict.acquire());
            var error = assertThrows(PoolCapacityException.class, strict::acquire);
            assertEquals(1, error.getMaxTotal());
        }

        @Test
        @DisplayName("readiness timeout kills the worker and fails the cold start")
        void startupTimeout() {
            ready.set(false);
            var pool = pool(new PoolOptions(1, 2, false, 150, true), 0);

            assertThrows(WorkerStartupException.class, pool::acquire);
            await("timed-out worker killed", () -> launcher.killedCount() >= 1);
            assertTrue(pool.snapshot().total() <= 1);
        }

        @Test
        @DisplayName("worker exiting during startup fails fast")
        void exitDuringStartup() {
            launcher.exitImmediately = true;
            var pool = pool(1, 1, false);

            long start = System.nanoTime();
            assertThrows(PoolException.class, pool::acquire);
            assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(2));
        }

        @Test
        @DisplayName("warmup failure backs off, then retries")
        void warmupBackoff() {
            launcher.failuresRemaining.set(1);
            var pool = pool(1, 2, true);

            await("first failure", () -> pool.snapshot().warmupFailureStreak() == 1);
            var snapshot = pool.snapshot();
            assertTrue(snapshot.backoffRemainingMs() > 0);
            assertTrue(snapshot.backoffRemainingMs() <= 1_000);
            assertEquals(1, listener.warmupFailures.size());

            await("retry after backoff", () -> pool.snapshot().idle() == 1);
            assertEquals(0, pool.snapshot().warmupFailureStreak());
        }

        @Test
        @DisplayName("warmups stop after the configured number of consecutive failures")
        void warmupSuspension() {
            launcher.alwaysFail = true;
            var pool = pool(new PoolOptions(1, 2, true, 2_000, true), 2);

            await("suspension", () -> pool.snapshot().warmupSuspended());
            assertEquals(List.of(2), listener.suspensions);
            int attempts = launcher.requests.size();

            launcher.alwaysFail = false;
            pool.updateConfig(new TestRuntime(), new PoolOptions(1, 2, true, 2_000, true));

            await("resumed warmup", () -> pool.snapshot().idle() == 1);
            assertFalse(pool.snapshot().warmupSuspended());
            assertTrue(launcher.requests.size() > attempts);
        }

        @Test
        @DisplayName("backoff doubles per failure and caps at 30s")
        void backoffSchedule() {
            assertEquals(1_000, ServerPool.backoffFor(1));
            assertEquals(2_000, ServerPool.backoffFor(2));
            assertEquals(16_000, ServerPool.backoffFor(5));
            assertEquals(30_000, ServerPool.backoffFor(6));
            assertEquals(30_000, ServerPool.backoffFor(ServerPool.MAX_FAILURE_STREAK));
        }
    }

    // -- Lease lifecycle ------------------------------------------------------

    @Nested
    @DisplayName("leases and worker lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("only the first release or retire takes effect")
        void leaseIsSingleUse() {
            var pool = pool(1, 1, true);
            await("warm worker", () -> pool.snapshot().idle() == 1);

            ServerLease lease = pool.acquire();
            lease.release();
            lease.release();
            lease.retire();

            assertTrue(lease.isClosed());
            assertFalse(launcher.workers.get(0).killed);
            assertEquals(1, pool.snapshot().idle());
            assertEquals(1, pool.snapshot().total());
        }

        @Test
        @DisplayName("retire kills the worker and a replacement is warmed")
        void retireKillsAndReplenishes() {
            var pool = pool(1, 1, true);
            await("warm worker", () -> pool.snapshot().idle() == 1);

            ServerLease lease = pool.acquire();
            lease.retire();

            assertTrue(launcher.workers.get(0).killed);
            assertFalse(launcher.workers.get(0).forcibly);
            await("replacement", () -> launcher.workers.size() == 2 && pool.snapshot().idle() == 1);
            assertEquals(1, pool.snapshot().total());
        }

        @Test
        @DisplayName("an idle worker that exits is dropped and replaced")
        void idleExitReplenishes() {
            var pool = pool(1, 1, true);
            await("warm worker", () -> pool.snapshot().idle() == 1);

            launcher.workers.get(0).crash(1);

            await("replacement", () -> launcher.workers.size() == 2 && pool.snapshot().idle() == 1);
            ServerLease lease = pool.acquire();
            assertEquals(launcher.workers.get(1).url(), lease.url());
            assertEquals(1, listener.exits.size());
        }

        @Test
        @DisplayName("a leased worker that crashes is deregistered; releasing its lease is a no-op")
        void inUseCrash() {
            var pool = pool(1, 1, true);
            await("warm worker", () -> pool.snapshot().idle() == 1);

            ServerLease lease = pool.acquire();
            launcher.workers.get(0).fail(new IllegalStateException("broken pipe"));
            await("deregistered", () -> listener.exits.size() == 1);
            lease.release();

            await("replacement", () -> pool.snapshot().idle() == 1);
            ServerLease next = pool.acquire();
            assertNotEquals(lease.workerId(), next.workerId());
        }

        @Test
        @DisplayName("dispose kills every worker and rejects further acquires")
        void disposeKillsAll() {
            var pool = pool(2, 3, true);
            await("two warm workers", () -> pool.snapshot().idle() == 2);
            pool.acquire();

            pool.dispose();

            assertTrue(pool.isDisposed());
            await("all workers killed", () -> launcher.workers.stream().allMatch(w -> w.killed && w.forcibly));
            assertThrows(PoolDisposedException.class, pool::acquire);
            var snapshot = pool.snapshot();
            assertTrue(snapshot.disposed());
            assertEquals(0, snapshot.total());
        }

        @Test
        @DisplayName("updateConfig grows the reserve without dropping workers")
        void updateConfigGrowsReserve() {
            var pool = pool(1, 1, true);
            await("warm worker", () -> pool.snapshot().idle() == 1);

            pool.updateConfig(new TestRuntime(), new PoolOptions(2, 3, true, 2_000, true));

            await("second warm worker", () -> pool.snapshot().idle() == 2);
            assertFalse(launcher.workers.get(0).killed);
            assertEquals(3, pool.options().maxTotal());
        }
    }

    @Test
    @DisplayName("concurrent acquire/release never exceeds maxTotal")
    void concurrentInvariant() throws Exception {
        var pool = pool(1, 3, true);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        var violations = new CopyOnWriteArrayList<PoolSnapshot>();
        var start = new CountDownLatch(1);
        try {
            List<CompletableFuture<Void>> tasks = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                tasks.add(CompletableFuture.runAsync(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    for (int i = 0; i < 10; i++) {
                        ServerLease lease = pool.acquire();
                        PoolSnapshot s = pool.snapshot();
                        if (s.idle() + s.inUse() > s.total() || s.total() > s.maxTotal()) {
                            violations.add(s);
                        }
                        if (lease != null) {
                            lease.release();
                        }
                    }
                }, executor));
            }
            start.countDown();
            CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new)).get(20, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        assertTrue(violations.isEmpty(), "invariant violated: " + violations);
        assertTrue(launcher.workers.size() <= 3);
        assertInvariant(pool.snapshot());
    }

    static class TestRuntime implements PoolRuntime {

        @Override
        public CliCommand cliCommand() {
            return new CliCommand("opencode", List.of("--print-logs"));
        }

        @Override
        public Path workingDirectory() {
            return Path.of(System.getProperty("java.io.tmpdir"));
        }

        @Override
        public Map<String, String> buildEnvironment() {
            return Map.of("OPENCODE_CONFIG", "/tmp/config.json");
        }
    }

    static class RecordingListener implements PoolListener {
        final List<String> leaseSources = new CopyOnWriteArrayList<>();
        final List<Integer> exits = new CopyOnWriteArrayList<>();
        final List<Integer> warmupFailures = new CopyOnWriteArrayList<>();
        final List<Integer> suspensions = new CopyOnWriteArrayList<>();

        @Override
        public void leaseAcquired(String poolName, String source) {
            leaseSources.add(source);
        }

        @Override
        public void workerExited(String poolName, int workerId, Integer exitCode, WorkerState lastState) {
            exits.add(workerId);
        }

        @Override
        public void warmupFailed(String poolName, int failureStreak, long backoffMs, Throwable error) {
            warmupFailures.add(failureStreak);
        }

        @Override
        public void warmupSuspended(String poolName, int consecutiveFailures) {
            suspensions.add(consecutiveFailures);
        }
    }
}
