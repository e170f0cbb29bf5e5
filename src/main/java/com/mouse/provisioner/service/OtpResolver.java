package com.mouse.provisioner.service;

import com.mouse.provisioner.config.OtpConfig;
import com.mouse.provisioner.enums.OtpChannelName;
import com.mouse.provisioner.exception.ChannelException;
import com.mouse.provisioner.interfaces.MailboxChannel;
import com.mouse.provisioner.interfaces.SmsCodeChannel;
import com.mouse.provisioner.model.Identity;
import com.mouse.provisioner.model.OtpRequest;
import com.mouse.provisioner.model.OtpResult;
import com.mouse.provisioner.model.SmsOrder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Races a mailbox poller against an SMS poller for one verification code.
 *
 * <p>Both loops run on {@code otpPollerExecutor} and report into a shared {@link OtpRequest}.
 * The first code settles the request; closing it cancels the losing loop before its next poll.
 * A loop that hits its own channel failure just stops, the other keeps going until the deadline.
 *
 * <p>The SMS number is bought up front with {@link #orderNumber(Identity)} so the caller can
 * hand it to the page on its own thread before resolving.
 */
@Slf4j
@Service
public class OtpResolver {

    private final MailboxChannel mailboxChannel;
    private final SmsCodeChannel smsCodeChannel;
    private final OtpConfig otpConfig;
    private final Executor pollerExecutor;
    private final Clock clock;

    public OtpResolver(MailboxChannel mailboxChannel,
                       SmsCodeChannel smsCodeChannel,
                       OtpConfig otpConfig,
                       @Qualifier("otpPollerExecutor") Executor pollerExecutor,
                       Clock clock) {
        this.mailboxChannel = mailboxChannel;
        this.smsCodeChannel = smsCodeChannel;
        this.otpConfig = otpConfig;
        this.pollerExecutor = pollerExecutor;
        this.clock = clock;
    }

    /**
     * @return the reserved number, empty when SMS is disabled or no number could be bought
     */
    public Optional<SmsOrder> orderNumber(Identity identity) {
        if (!otpConfig.isSmsEnabled()) {
            return Optional.empty();
        }
        try {
            SmsOrder order = smsCodeChannel.order(identity);
            log.debug("SMS order placed | Email: {} | OrderId: {}", identity.email(), order.orderId());
            return Optional.of(order);
        } catch (ChannelException e) {
            log.warn("SMS order failed | Email: {} | Reason: {}", identity.email(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @param smsOrder number already given to the target, or null to race the mailbox alone
     */
    public OtpResult resolve(Identity identity, SmsOrder smsOrder) {
        Instant now = clock.instant();
        OtpRequest request = new OtpRequest(identity, now, now.plus(otpConfig.getDeadline()));
        log.info("Resolving OTP | Email: {} | Deadline: {}s | SmsOrder: {}",
                identity.email(), otpConfig.getDeadline().toSeconds(), smsOrder != null ? smsOrder.orderId() : "none");

        startLoop(request, OtpChannelName.MAILBOX, () -> pollMailbox(request));
        if (smsOrder != null) {
            startLoop(request, OtpChannelName.SMS, () -> pollSms(request, smsOrder));
        } else {
            request.recordFailure(OtpChannelName.SMS, otpConfig.isSmsEnabled() ? "no number" : "disabled");
        }

        try {
            Duration wait = Duration.between(clock.instant(), request.getDeadline())
                    .plus(otpConfig.longestPollInterval());
            request.awaitSettled(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("OTP resolution interrupted | Email: {}", identity.email());
        }

        OtpResult result = request.close();
        if (result.isTimeout()) {
            log.warn("OTP timed out | Email: {} | Channels: {}", identity.email(), request.outcomes());
        } else {
            log.info("OTP resolved | Email: {} | Channel: {} | ElapsedMs: {}", identity.email(), result.channel(),
                    Duration.between(request.getCreatedAt(), clock.instant()).toMillis());
        }
        return result;
    }

    private void startLoop(OtpRequest request, OtpChannelName channel, Runnable loop) {
        try {
            CompletableFuture.runAsync(loop, pollerExecutor)
                    .exceptionally(ex -> {
                        log.error("OTP poll loop crashed | Channel: {} | Email: {}", channel,
                                request.getIdentity().email(), ex);
                        request.recordFailure(channel, ex.getMessage());
                        return null;
                    });
        } catch (RejectedExecutionException e) {
            log.error("OTP poll loop rejected | Channel: {}", channel, e);
            request.recordFailure(channel, "rejected");
        }
    }

    private void pollMailbox(OtpRequest request) {
        Identity identity = request.getIdentity();
        pollUntilSettled(request, OtpChannelName.MAILBOX, otpConfig.getMailboxPollInterval(),
                () -> mailboxChannel.poll(identity, request.getCreatedAt()));
    }

    private void pollSms(OtpRequest request, SmsOrder order) {
        pollUntilSettled(request, OtpChannelName.SMS, otpConfig.getSmsPollInterval(),
                () -> smsCodeChannel.poll(order.orderId()));
    }

    /**
     * Polls until a code, a channel failure, the deadline, or cancellation.
     * Cancellation is checked before every poll and interrupts the sleep between polls.
     */
    private void pollUntilSettled(OtpRequest request, OtpChannelName channel, Duration interval,
                                  Supplier<Optional<String>> poller) {
        int polls = 0;
        try {
            while (!request.isClosed()) {
                if (request.isExpired(clock.instant())) {
                    request.recordFailure(channel, "deadline reached after " + polls + " polls");
                    return;
                }

                Optional<String> code;
                try {
                    code = poller.get();
                    polls++;
                } catch (ChannelException e) {
                    log.warn("OTP channel failed | Channel: {} | Email: {} | Reason: {}",
                            channel, request.getIdentity().email(), e.getMessage());
                    request.recordFailure(channel, e.getMessage());
                    return;
                }

                if (code.isPresent()) {
                    log.debug("Code received | Channel: {} | Email: {} | Polls: {}",
                            channel, request.getIdentity().email(), polls);
                    request.recordCode(channel, code.get());
                    return;
                }

                Duration remaining = Duration.between(clock.instant(), request.getDeadline());
                Duration sleep = remaining.compareTo(interval) < 0 ? remaining : interval;
                if (request.awaitCancellation(sleep)) {
                    break;
                }
            }
            log.debug("OTP poll loop cancelled | Channel: {} | Email: {} | Polls: {}",
                    channel, request.getIdentity().email(), polls);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            request.recordFailure(channel, "interrupted");
        }
    }
}
