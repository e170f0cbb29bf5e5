package com.mouse.provisioner.model;

import com.mouse.provisioner.enums.ChannelOutcome;
import com.mouse.provisioner.enums.OtpChannelName;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One verification attempt shared by the mailbox and SMS polling loops.
 *
 * <p>Loops report into the request; the resolver waits until it is settled (a code arrived or
 * no channel is pending) and then {@link #close() closes} it. Closing picks the winning code and
 * wakes any loop sleeping in {@link #awaitCancellation(Duration)}. Reports arriving after
 * close are discarded.
 */
@Slf4j
public class OtpRequest {

    @Getter
    private final Identity identity;
    @Getter
    private final Instant createdAt;
    @Getter
    private final Instant deadline;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<OtpChannelName, ChannelOutcome> outcomes = new EnumMap<>(OtpChannelName.class);
    private final Map<OtpChannelName, String> codes = new EnumMap<>(OtpChannelName.class);
    private final CompletableFuture<Void> settled = new CompletableFuture<>();
    private final CountDownLatch cancellation = new CountDownLatch(1);
    private OtpResult result;

    public OtpRequest(Identity identity, Instant createdAt, Instant deadline) {
        this.identity = identity;
        this.createdAt = createdAt;
        this.deadline = deadline;
        for (OtpChannelName channel : OtpChannelName.values()) {
            outcomes.put(channel, ChannelOutcome.PENDING);
        }
    }

    /** @return false when the request is already closed and the code was discarded */
    public boolean recordCode(OtpChannelName channel, String code) {
        lock.lock();
        try {
            if (result != null) {
                log.debug("Discarding late code | Channel: {} | Email: {}", channel, identity.email());
                return false;
            }
            outcomes.put(channel, ChannelOutcome.CODE);
            codes.put(channel, code);
            settled.complete(null);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void recordFailure(OtpChannelName channel, String reason) {
        lock.lock();
        try {
            if (result != null) {
                return;
            }
            outcomes.put(channel, ChannelOutcome.FAILURE);
            log.debug("Channel failed | Channel: {} | Email: {} | Reason: {}", channel, identity.email(), reason);
            if (!outcomes.containsValue(ChannelOutcome.PENDING)) {
                settled.complete(null);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until a code was recorded, every channel failed, or the timeout elapsed.
     */
    public void awaitSettled(Duration timeout) throws InterruptedException {
        try {
            settled.get(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.debug("OTP request not settled within {}ms | Email: {}", timeout.toMillis(), identity.email());
        } catch (ExecutionException e) {
            throw new IllegalStateException("settled future never completes exceptionally", e);
        }
    }

    /**
     * Closes the request and returns the winning code. The mailbox code wins over a differing
     * SMS code when both were recorded before closing. Idempotent.
     */
    public OtpResult close() {
        lock.lock();
        try {
            if (result == null) {
                if (codes.containsKey(OtpChannelName.MAILBOX)) {
                    result = OtpResult.of(codes.get(OtpChannelName.MAILBOX), OtpChannelName.MAILBOX);
                    String smsCode = codes.get(OtpChannelName.SMS);
                    if (smsCode != null && !smsCode.equals(result.code())) {
                        log.info("Both channels delivered differing codes, keeping mailbox code | Email: {}",
                                identity.email());
                    }
                } else if (codes.containsKey(OtpChannelName.SMS)) {
                    result = OtpResult.of(codes.get(OtpChannelName.SMS), OtpChannelName.SMS);
                } else {
                    result = OtpResult.timeout();
                }
                cancellation.countDown();
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        return cancellation.getCount() == 0;
    }

    /**
     * Sleeps up to {@code wait}, returning early with {@code true} once the request is closed.
     */
    public boolean awaitCancellation(Duration wait) throws InterruptedException {
        if (wait.isNegative() || wait.isZero()) {
            return isClosed();
        }
        return cancellation.await(wait.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(deadline);
    }

    public Map<OtpChannelName, ChannelOutcome> outcomes() {
        lock.lock();
        try {
            return Collections.unmodifiableMap(new EnumMap<>(outcomes));
        } finally {
            lock.unlock();
        }
    }
}
