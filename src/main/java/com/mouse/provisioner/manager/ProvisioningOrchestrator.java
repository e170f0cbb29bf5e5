package com.mouse.provisioner.manager;

import com.mouse.provisioner.config.ProvisioningConfig;
import com.mouse.provisioner.entity.Account;
import com.mouse.provisioner.enums.AccountStatus;
import com.mouse.provisioner.enums.FailureReason;
import com.mouse.provisioner.enums.SignupStage;
import com.mouse.provisioner.exception.ProvisioningException;
import com.mouse.provisioner.interfaces.ProvisioningListener;
import com.mouse.provisioner.model.*;
import com.mouse.provisioner.service.AccountStore;
import com.mouse.provisioner.service.SignupDriver;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size worker pool draining an {@link IdentityFeed} into stored accounts or permanent failures.
 *
 * <p>Each worker pulls a retry if one is waiting, otherwise the next identity, leases a proxy,
 * runs the {@link SignupDriver} and settles the outcome. A failed attempt is re-submitted as a
 * new task with the next attempt number until the retry bound is spent. The run is over when the
 * feed is empty and no identity is in flight.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProvisioningOrchestrator {

    private static final long IDLE_POLL_MS = 100;
    private static final long PROGRESS_LOG_SEC = 30;

    private final SignupDriver signupDriver;
    private final AccountStore accountStore;
    private final ProvisioningConfig config;
    private final List<ProvisioningListener> listeners;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    /**
     * Provisions every identity in the feed and blocks until the run is over.
     *
     * @throws ProvisioningException when there is nothing to provision or no proxy to do it with
     */
    public ProvisioningReport run(IdentityFeed feed, ProxyPool pool) {
        if (feed.remaining() == 0) {
            throw new ProvisioningException("No identities to provision");
        }
        if (pool.usableCount() == 0) {
            throw new ProvisioningException("No usable proxies");
        }
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A provisioning run is already in progress");
        }
        stopRequested.set(false);

        Run run = new Run(feed, pool);
        int workers = Math.max(1, config.getWorkers());
        log.info("Provisioning run starting | Identities: {} | Proxies: {} | Workers: {} | RetryBound: {}",
                feed.remaining(), pool.usableCount(), workers, config.getRetryBound());

        ExecutorService workerPool = Executors.newFixedThreadPool(workers, new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r);
                t.setName("provision-worker-" + counter.incrementAndGet());
                t.setDaemon(false);
                return t;
            }
        });

        try {
            for (int i = 0; i < workers; i++) {
                workerPool.submit(() -> workerLoop(run));
            }
            workerPool.shutdown();
            while (!workerPool.awaitTermination(PROGRESS_LOG_SEC, TimeUnit.SECONDS)) {
                log.info("Provisioning progress | Succeeded: {} | PermanentlyFailed: {} | InFlight: {} | FeedRemaining: {}",
                        run.succeeded.get(), run.permanentFailures.size(), run.inFlight.get(), feed.remaining());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Provisioning run interrupted, letting in-flight steps finish | Grace: {}s",
                    config.getShutdownGrace().toSeconds());
            requestStop();
            awaitGracefully(workerPool);
        } finally {
            running.set(false);
        }

        ProvisioningReport report = run.report();
        log.info("Provisioning run finished | {}", report);
        return report;
    }

    /**
     * Stops pulling new work. Tasks already in a step finish that step; identities not
     * settled by then are reported as in progress.
     */
    public void requestStop() {
        if (stopRequested.compareAndSet(false, true)) {
            log.warn("Provisioning stop requested | Running: {}", running.get());
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @PreDestroy
    void shutdown() {
        requestStop();
    }

    // ==================== WORKER ====================

    private void workerLoop(Run run) {
        log.debug("Worker started | Thread: {}", Thread.currentThread().getName());
        try {
            while (!stopRequested.get()) {
                ProvisioningTask task = nextTask(run);
                if (task == null) {
                    if (run.inFlight.get() == 0 && run.retries.isEmpty()) {
                        break;
                    }
                    continue;
                }
                process(run, task);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Worker interrupted | Thread: {}", Thread.currentThread().getName());
        } catch (Exception e) {
            log.error("Worker crashed | Thread: {} | Message: {}", Thread.currentThread().getName(), e.getMessage(), e);
        }
        log.debug("Worker stopped | Thread: {}", Thread.currentThread().getName());
    }

    /** A waiting retry first, then a fresh identity; null when neither is available right now. */
    private ProvisioningTask nextTask(Run run) throws InterruptedException {
        ProvisioningTask retry = run.retries.poll();
        if (retry != null) {
            return retry;
        }
        // counted before the feed hands the identity out, so an idle worker never sees zero in flight
        // while another is between next() and processing
        run.inFlight.incrementAndGet();
        Optional<Identity> identity = run.feed.next();
        if (identity.isPresent()) {
            return ProvisioningTask.first(identity.get());
        }
        run.inFlight.decrementAndGet();
        return run.retries.poll(IDLE_POLL_MS, TimeUnit.MILLISECONDS);
    }

    private void process(Run run, ProvisioningTask task) throws InterruptedException {
        Optional<Proxy> lease = leaseWithBackoff(run.pool, task);
        if (lease.isEmpty()) {
            if (!stopRequested.get()) {
                log.error("No usable proxy left | Email: {} | Quarantined: {}",
                        task.getIdentity().email(), run.pool.quarantined().size());
                settlePermanentFailure(run, task, FailureReason.PROXY_ERROR);
            }
            return;
        }

        Proxy proxy = lease.get();
        ProvisioningTask leased = task.withProxy(proxy);
        SignupResult result = null;
        try {
            result = runDriver(leased);
            if (result.isSuccess()) {
                settleSuccess(run, leased, result);
                return;
            }
        } finally {
            run.pool.release(proxy, result != null && result.isSuccess());
        }
        settleFailedAttempt(run, leased.withStatus(SignupStage.FAILED), result.failureReason());
    }

    /** Never throws: a task that escapes settlement keeps inFlight above zero and the run never ends. */
    private SignupResult runDriver(ProvisioningTask task) {
        try {
            return signupDriver.run(task);
        } catch (RuntimeException | Error e) {
            log.error("Signup driver threw | Email: {} | Message: {}", task.getIdentity().email(), e.getMessage(), e);
            SignupState failed = SignupState.started().fail(FailureReason.UNEXPECTED_RESPONSE, e.getMessage());
            return new SignupResult(failed, List.of(SignupStage.STARTED, SignupStage.FAILED), null);
        }
    }

    private Optional<Proxy> leaseWithBackoff(ProxyPool pool, ProvisioningTask task) throws InterruptedException {
        Duration backoff = config.getLeaseInitialBackoff();
        while (!stopRequested.get()) {
            Optional<Proxy> proxy = pool.lease(backoff);
            if (proxy.isPresent()) {
                return proxy;
            }
            if (pool.usableCount() == 0) {
                return Optional.empty();
            }
            log.debug("No free proxy, backing off | Email: {} | BackoffMs: {}", task.getIdentity().email(), backoff.toMillis());
            Duration doubled = backoff.multipliedBy(2);
            backoff = doubled.compareTo(config.getLeaseMaxBackoff()) > 0 ? config.getLeaseMaxBackoff() : doubled;
        }
        return Optional.empty();
    }

    // ==================== OUTCOMES ====================

    private void settleSuccess(Run run, ProvisioningTask task, SignupResult result) {
        Account account;
        try {
            account = accountStore.save(Account.builder()
                    .email(task.getIdentity().email())
                    .password(task.getIdentity().password())
                    .proxy(task.getProxy().label())
                    .sessionArtifact(result.artifact().storageState())
                    .status(AccountStatus.ACTIVE)
                    .createdAt(Instant.now())
                    .build());
        } catch (RuntimeException e) {
            log.error("Failed to store account | Email: {} | Message: {}", task.getIdentity().email(), e.getMessage(), e);
            run.recordAttemptFailure(FailureReason.PERSISTENCE_ERROR);
            settlePermanentFailure(run, task, FailureReason.PERSISTENCE_ERROR);
            return;
        }
        run.succeeded.incrementAndGet();
        run.inFlight.decrementAndGet();
        log.info("Account provisioned | Email: {} | Attempt: {} | Proxy: {}",
                task.getIdentity().email(), task.getAttempt(), task.getProxy().label());
        listeners.forEach(l -> notifySafely(() -> l.onAccountCreated(account)));
    }

    private void settleFailedAttempt(Run run, ProvisioningTask task, FailureReason reason) {
        run.recordAttemptFailure(reason);
        listeners.forEach(l -> notifySafely(() -> l.onAttemptFailed(task, reason)));

        boolean attemptsLeft = task.getAttempt() <= config.getRetryBound();
        if (reason.isRetryable() && attemptsLeft) {
            if (stopRequested.get()) {
                log.info("Stop requested, not retrying | Email: {} | Attempt: {}", task.getIdentity().email(), task.getAttempt());
                return;
            }
            ProvisioningTask retry = task.nextAttempt();
            run.retries.offer(retry);
            log.info("Attempt failed, retrying | Email: {} | Reason: {} | NextAttempt: {}/{}",
                    task.getIdentity().email(), reason, retry.getAttempt(), config.getRetryBound() + 1);
            return;
        }
        settlePermanentFailure(run, task, reason);
    }

    private void settlePermanentFailure(Run run, ProvisioningTask task, FailureReason reason) {
        run.permanentFailures.put(task.getIdentity().email(), reason);
        run.inFlight.decrementAndGet();
        log.warn("Identity permanently failed | Email: {} | Reason: {} | Attempts: {}",
                task.getIdentity().email(), reason, task.getAttempt());
        listeners.forEach(l -> notifySafely(() -> l.onPermanentFailure(task.getIdentity(), reason, task.getAttempt())));
    }

    private void notifySafely(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Provisioning listener failed | Message: {}", e.getMessage(), e);
        }
    }

    private void awaitGracefully(ExecutorService workerPool) {
        try {
            if (!workerPool.awaitTermination(config.getShutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                log.error("Workers did not finish within grace period, forcing shutdown");
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workerPool.shutdownNow();
        }
    }

    // ==================== RUN STATE ====================

    private static final class Run {
        private final IdentityFeed feed;
        private final ProxyPool pool;
        private final BlockingQueue<ProvisioningTask> retries = new LinkedBlockingQueue<>();
        /** Identities handed out and not yet settled, including those waiting for a retry. */
        private final AtomicInteger inFlight = new AtomicInteger(0);
        private final AtomicInteger succeeded = new AtomicInteger(0);
        private final ConcurrentMap<FailureReason, AtomicInteger> attemptFailures = new ConcurrentHashMap<>();
        private final ConcurrentMap<String, FailureReason> permanentFailures = new ConcurrentHashMap<>();
        private final Instant startedAt = Instant.now();

        private Run(IdentityFeed feed, ProxyPool pool) {
            this.feed = feed;
            this.pool = pool;
        }

        private void recordAttemptFailure(FailureReason reason) {
            attemptFailures.computeIfAbsent(reason, r -> new AtomicInteger()).incrementAndGet();
        }

        private ProvisioningReport report() {
            Map<FailureReason, Integer> reasons = new EnumMap<>(FailureReason.class);
            attemptFailures.forEach((reason, count) -> reasons.put(reason, count.get()));
            return new ProvisioningReport(
                    succeeded.get(),
                    permanentFailures.size(),
                    inFlight.get(),
                    reasons,
                    Map.copyOf(permanentFailures),
                    Duration.between(startedAt, Instant.now()));
        }
    }
}
