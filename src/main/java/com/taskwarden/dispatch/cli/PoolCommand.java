package com.taskwarden.dispatch.cli;

import com.taskwarden.core.events.EventBus;
import com.taskwarden.pool.PoolException;
import com.taskwarden.pool.ServerLease;
import com.taskwarden.pool.ServerPool;
import com.taskwarden.pool.ServerPoolRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: taskwarden pool [--platform p] [--acquire]
 * <p>
 * Starts (or looks up) the pool for a platform and prints its snapshot. With
 * {@code --acquire} one lease is taken and released to show whether it was warm or cold;
 * the pool's own events (worker ready, exits, warmup failures) are echoed while it runs.
 */
@Command(name = "pool", mixinStandardHelpOptions = true, description = "Inspect the warm server pool")
@Component
public class PoolCommand implements Callable<Integer> {

    @Option(names = {"--platform", "-p"}, description = "Pool platform (default: this host's platform)")
    private String platform;

    @Option(names = {"--acquire", "-a"}, description = "Acquire and release one lease")
    private boolean acquire;

    private final ServerPoolRegistry registry;
    private final EventBus eventBus;

    public PoolCommand(ServerPoolRegistry registry, EventBus eventBus) {
        this.registry = registry;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        String name = platform != null && !platform.isBlank() ? platform : registry.defaultPlatform();
        // subscribe before the lookup: a fresh pool starts warming up as soon as it is created
        EventBus.Subscription poolEvents = acquire
                ? eventBus.subscribePool(name, event -> ConsoleOutput.info("[" + name + "] " + event.message()))
                : () -> { };
        ServerPool pool = registry.getPool(name);

        if (acquire) {
            ConsoleOutput.info("Acquiring a server from pool " + name + "...");
            try {
                ServerLease lease = pool.acquire();
                if (lease == null) {
                    ConsoleOutput.warn("No lease (pool disabled or spawn failed); tasks would start the CLI directly");
                } else {
                    ConsoleOutput.success("Got " + lease.source().label() + " server #" + lease.workerId()
                            + " at " + lease.url());
                    lease.release();
                }
            } catch (PoolException e) {
                ConsoleOutput.error("Acquire failed: " + e.getMessage());
                ConsoleOutput.poolSnapshot(pool.snapshot());
                return 1;
            } finally {
                poolEvents.unsubscribe();
            }
        }

        ConsoleOutput.poolSnapshot(pool.snapshot());
        return 0;
    }
}
