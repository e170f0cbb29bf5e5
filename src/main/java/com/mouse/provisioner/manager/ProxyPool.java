package com.mouse.provisioner.manager;

import com.mouse.provisioner.model.Proxy;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Exclusive proxy leases for the worker pool.
 *
 * <p>Free, leased and quarantined sets plus the failure counters are guarded by one lock so a
 * proxy can never be observed free by two workers, or leased after it was quarantined.
 * Free proxies rotate FIFO.
 */
@Slf4j
public class ProxyPool {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition released = lock.newCondition();

    private final Deque<Proxy> free = new ArrayDeque<>();
    private final Set<Proxy> leased = new HashSet<>();
    private final Set<Proxy> quarantined = new LinkedHashSet<>();
    private final Map<Proxy, Integer> failures = new HashMap<>();
    private final int failureThreshold;

    public ProxyPool(Collection<Proxy> proxies, int failureThreshold) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive");
        }
        this.failureThreshold = failureThreshold;
        // duplicates in the source list would otherwise be leasable twice
        new LinkedHashSet<>(proxies).forEach(free::addLast);
        log.info("Proxy pool ready | Proxies: {} | FailureThreshold: {}", free.size(), failureThreshold);
    }

    /** Non-blocking lease; empty when nothing is free right now. */
    public Optional<Proxy> lease() {
        lock.lock();
        try {
            return Optional.ofNullable(takeFree());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to {@code timeout} for a free proxy. Returns early when another worker releases
     * one, or immediately when every proxy is quarantined.
     */
    public Optional<Proxy> lease(Duration timeout) throws InterruptedException {
        long remainingNs = timeout.toNanos();
        lock.lock();
        try {
            Proxy proxy;
            while ((proxy = takeFree()) == null) {
                if (remainingNs <= 0 || usableCountLocked() == 0) {
                    return Optional.empty();
                }
                remainingNs = released.awaitNanos(remainingNs);
            }
            return Optional.of(proxy);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a leased proxy. A failed release bumps the cumulative failure counter and
     * quarantines the proxy once the counter reaches the threshold.
     */
    public void release(Proxy proxy, boolean success) {
        Objects.requireNonNull(proxy, "proxy is required");
        lock.lock();
        try {
            if (!leased.remove(proxy)) {
                throw new IllegalStateException("Proxy is not leased: " + proxy.label());
            }
            if (success) {
                free.addLast(proxy);
                log.debug("Proxy released | Proxy: {} | Success: true", proxy.label());
            } else {
                int count = failures.merge(proxy, 1, Integer::sum);
                if (count >= failureThreshold) {
                    quarantined.add(proxy);
                    log.warn("Proxy quarantined | Proxy: {} | Failures: {} | Usable left: {}",
                            proxy.label(), count, usableCountLocked());
                } else {
                    free.addLast(proxy);
                    log.debug("Proxy released | Proxy: {} | Success: false | Failures: {}", proxy.label(), count);
                }
            }
            released.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** Free plus leased; zero means no proxy will ever be handed out again. */
    public int usableCount() {
        lock.lock();
        try {
            return usableCountLocked();
        } finally {
            lock.unlock();
        }
    }

    public int freeCount() {
        lock.lock();
        try {
            return free.size();
        } finally {
            lock.unlock();
        }
    }

    public int leasedCount() {
        lock.lock();
        try {
            return leased.size();
        } finally {
            lock.unlock();
        }
    }

    public Set<Proxy> quarantined() {
        lock.lock();
        try {
            return Set.copyOf(quarantined);
        } finally {
            lock.unlock();
        }
    }

    public int failureCount(Proxy proxy) {
        lock.lock();
        try {
            return failures.getOrDefault(proxy, 0);
        } finally {
            lock.unlock();
        }
    }

    private Proxy takeFree() {
        Proxy proxy = free.pollFirst();
        if (proxy != null) {
            leased.add(proxy);
            log.trace("Proxy leased | Proxy: {} | Free: {} | Leased: {}", proxy.label(), free.size(), leased.size());
        }
        return proxy;
    }

    private int usableCountLocked() {
        return free.size() + leased.size();
    }
}
