package com.nevis.xray.infra;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

/**
 * Checks reachability by opening a TCP connection to a well-known host (public DNS by default).
 */
@Slf4j
public class SocketNetworkProbe implements NetworkProbe {

    private final String host;
    private final int port;
    private final Duration timeout;

    public SocketNetworkProbe(String host, int port, Duration timeout) {
        this.host = host;
        this.port = port;
        this.timeout = timeout;
    }

    @Override
    public boolean isOnline() {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), (int) timeout.toMillis());
            return true;
        } catch (IOException e) {
            log.warn("Connectivity probe to {}:{} failed: {}", host, port, e.getMessage());
            return false;
        }
    }
}
