package com.mouse.provisioner.utils;

import com.mouse.provisioner.model.Identity;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads identity lines: {@code email} (default password applies) or {@code email:password}.
 * Duplicate emails keep their first occurrence.
 */
@Slf4j
public final class IdentityListParser {

    private IdentityListParser() {
    }

    public static List<Identity> parse(List<String> lines, String defaultPassword) {
        Map<String, Identity> byEmail = new LinkedHashMap<>();
        int lineNo = 0;
        for (String raw : lines) {
            lineNo++;
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            int sep = line.indexOf(':');
            String email = sep < 0 ? line : line.substring(0, sep).trim();
            String password = sep < 0 ? defaultPassword : line.substring(sep + 1);
            if (!email.contains("@")) {
                log.warn("Skipping identity line {} | Reason: not an email", lineNo);
                continue;
            }
            if (password == null || password.isEmpty()) {
                log.warn("Skipping identity line {} | Reason: no password and no default password", lineNo);
                continue;
            }
            byEmail.putIfAbsent(email.toLowerCase(), new Identity(email, password));
        }
        return new ArrayList<>(byEmail.values());
    }
}
