package com.taskwarden.pool;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;

/**
 * Finds a free loopback TCP port by binding an ephemeral socket and closing it again.
 *
 * <p>The port is only known to be free at the moment the probe socket closes; the
 * consumer is expected to bind it immediately.
 */
public class PortAllocator {

    public int allocate() {
        try (var probe = new ServerSocket()) {
            probe.setReuseAddress(true);
            probe.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
            int port = probe.getLocalPort();
            if (port <= 0) {
                throw new IllegalStateException("Probe socket reported no local port");
            }
            return port;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to allocate a local server port", e);
        }
    }
}
