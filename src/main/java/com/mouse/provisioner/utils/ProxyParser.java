package com.mouse.provisioner.utils;

import com.mouse.provisioner.exception.InvalidProxyFormatException;
import com.mouse.provisioner.model.Proxy;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code host:port:username:password} lines. The password may itself contain colons.
 * A bare {@code host:port} is accepted for proxies without authentication.
 */
@Slf4j
public final class ProxyParser {

    private ProxyParser() {
    }

    public static Proxy parse(String line) {
        if (line == null || line.isBlank()) {
            throw new InvalidProxyFormatException("empty proxy line");
        }
        String[] parts = line.trim().split(":", 4);
        if (parts.length != 2 && parts.length != 4) {
            throw new InvalidProxyFormatException("expected host:port:username:password, got " + parts.length + " fields");
        }
        String host = parts[0].trim();
        if (host.isEmpty()) {
            throw new InvalidProxyFormatException("host must not be empty");
        }
        int port;
        try {
            port = Integer.parseInt(parts[1].trim());
        } catch (NumberFormatException e) {
            throw new InvalidProxyFormatException("port is not a number: " + parts[1], e);
        }
        if (port <= 0 || port > 65535) {
            throw new InvalidProxyFormatException("port out of range: " + port);
        }
        if (parts.length == 2) {
            return new Proxy(host, port, null, null);
        }
        String username = parts[2].trim();
        if (username.isEmpty()) {
            throw new InvalidProxyFormatException("username must not be empty");
        }
        return new Proxy(host, port, username, parts[3].trim());
    }

    /**
     * Parses every non-blank, non-comment line; malformed lines are skipped with a warning
     * (their content is not logged, it may hold credentials).
     */
    public static List<Proxy> parseAll(List<String> lines) {
        List<Proxy> proxies = new ArrayList<>();
        int lineNo = 0;
        for (String line : lines) {
            lineNo++;
            if (line.isBlank() || line.trim().startsWith("#")) {
                continue;
            }
            try {
                proxies.add(parse(line));
            } catch (InvalidProxyFormatException e) {
                log.warn("Skipping proxy line {} | Reason: {}", lineNo, e.getMessage());
            }
        }
        return proxies;
    }
}
