package com.taskwarden.pool;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class HttpHealthProbeTest {

    @Test
    @DisplayName("2xx, 3xx and 4xx count as ready; 5xx does not")
    void readyStatusRange() {
        assertTrue(HttpHealthProbe.isReadyStatus(200));
        assertTrue(HttpHealthProbe.isReadyStatus(302));
        assertTrue(HttpHealthProbe.isReadyStatus(404));
        assertTrue(HttpHealthProbe.isReadyStatus(499));
        assertFalse(HttpHealthProbe.isReadyStatus(500));
        assertFalse(HttpHealthProbe.isReadyStatus(503));
        assertFalse(HttpHealthProbe.isReadyStatus(199));
    }

    @Test
    @DisplayName("connection refused is reported as not ready")
    void refusedConnection() throws Exception {
        int port;
        try (var socket = new ServerSocket()) {
            socket.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
            port = socket.getLocalPort();
        }

        var probe = new HttpHealthProbe(Duration.ofMillis(500));

        assertFalse(probe.isReady("http://127.0.0.1:" + port));
    }
}
