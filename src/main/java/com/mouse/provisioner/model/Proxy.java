package com.mouse.provisioner.model;

import java.util.Objects;

/**
 * Authenticated HTTP proxy endpoint. Only {@link #label()} is safe to log.
 */
public record Proxy(String host, int port, String username, String password) {

    public Proxy {
        Objects.requireNonNull(host, "host is required");
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
    }

    public String label() {
        return host + ":" + port;
    }

    public String server() {
        return host.startsWith("http://") || host.startsWith("https://")
                ? label()
                : "http://" + label();
    }

    public boolean hasCredentials() {
        return username != null && !username.isEmpty();
    }

    @Override
    public String toString() {
        return "Proxy[" + label() + "]";
    }
}
