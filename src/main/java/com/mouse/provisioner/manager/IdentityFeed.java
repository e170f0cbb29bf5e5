package com.mouse.provisioner.manager;

import com.mouse.provisioner.model.Identity;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * One-pass source of identities. Each identity is handed to exactly one caller;
 * retries are the orchestrator's business.
 */
@Slf4j
public class IdentityFeed {

    private final List<Identity> identities;
    private int cursor;

    public IdentityFeed(List<Identity> identities) {
        this.identities = List.copyOf(identities);
    }

    public synchronized Optional<Identity> next() {
        if (cursor >= identities.size()) {
            return Optional.empty();
        }
        Identity identity = identities.get(cursor++);
        log.debug("Identity handed out | Email: {} | Remaining: {}", identity.email(), identities.size() - cursor);
        return Optional.of(identity);
    }

    public synchronized int remaining() {
        return identities.size() - cursor;
    }
}
