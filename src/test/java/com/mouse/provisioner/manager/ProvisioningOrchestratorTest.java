package com.mouse.provisioner.manager;

import com.mouse.provisioner.config.OtpConfig;
import com.mouse.provisioner.config.ProvisioningConfig;
import com.mouse.provisioner.entity.Account;
import com.mouse.provisioner.enums.AccountStatus;
import com.mouse.provisioner.enums.FailureReason;
import com.mouse.provisioner.enums.OtpChannelName;
import com.mouse.provisioner.exception.ChannelException;
import com.mouse.provisioner.exception.ProvisioningException;
import com.mouse.provisioner.interfaces.MailboxChannel;
import com.mouse.provisioner.interfaces.ProvisioningListener;
import com.mouse.provisioner.interfaces.SmsCodeChannel;
import com.mouse.provisioner.model.*;
import com.mouse.provisioner.service.AccountStore;
import com.mouse.provisioner.service.OtpResolver;
import com.mouse.provisioner.service.SignupDriver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ProvisioningOrchestratorTest {

    private static final Proxy P1 = new Proxy("10.0.0.1", 8080, "u", "p");
    private static final Proxy P2 = new Proxy("10.0.0.2", 8080, "u", "p");

    @Mock
    private AccountStore accountStore;
    @Mock
    private OtpResolver otpResolver;

    private ScriptedBrowserEngine engine;
    private ProvisioningConfig config;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        engine = new ScriptedBrowserEngine();
        listener = new RecordingListener();

        config = new ProvisioningConfig();
        config.setWorkers(5);
        config.setRetryBound(1);
        config.setProxyFailureThreshold(3);
        config.setLeaseInitialBackoff(Duration.ofMillis(10));
        config.setLeaseMaxBackoff(Duration.ofMillis(50));
        config.setShutdownGrace(Duration.ofSeconds(5));

        when(accountStore.save(any(Account.class))).thenAnswer(inv -> inv.getArgument(0));
        when(otpResolver.resolve(any(Identity.class), any())).thenReturn(OtpResult.of("123456", OtpChannelName.MAILBOX));
    }

    private ProvisioningOrchestrator orchestrator(OtpResolver resolver) {
        return new ProvisioningOrchestrator(new SignupDriver(engine, resolver), accountStore, config, List.of(listener));
    }

    private static IdentityFeed feed(String... emails) {
        return new IdentityFeed(java.util.Arrays.stream(emails).map(e -> new Identity(e, "pw-" + e)).toList());
    }

    @Nested
    @DisplayName("end to end with a real OTP resolver")
    class EndToEnd {

        private ExecutorService pollers;

        @BeforeEach
        void startPollers() {
            pollers = Executors.newCachedThreadPool();
        }

        @AfterEach
        void stopPollers() {
            pollers.shutdownNow();
        }

        @Test
        @Timeout(20)
        @DisplayName("three identities over two proxies all end up stored, never more than two sessions at once")
        void threeIdentitiesTwoProxies() {
            MailboxChannel mailbox = mock(MailboxChannel.class);
            SmsCodeChannel sms = mock(SmsCodeChannel.class);
            Map<String, AtomicInteger> polls = new ConcurrentHashMap<>();
            when(mailbox.poll(any(Identity.class), any())).thenAnswer(inv -> {
                Identity identity = inv.getArgument(0);
                int n = polls.computeIfAbsent(identity.email(), k -> new AtomicInteger()).incrementAndGet();
                return n >= 2 ? Optional.of("765432") : Optional.empty();
            });
            when(sms.order(any(Identity.class))).thenThrow(new ChannelException("no numbers available"));

            OtpConfig otpConfig = new OtpConfig();
            otpConfig.setDeadline(Duration.ofSeconds(5));
            otpConfig.setMailboxPollInterval(Duration.ofMillis(20));
            otpConfig.setSmsPollInterval(Duration.ofMillis(20));
            otpConfig.setSmsEnabled(true);
            OtpResolver resolver = new OtpResolver(mailbox, sms, otpConfig, pollers, Clock.systemUTC());

            ProxyPool pool = new ProxyPool(List.of(P1, P2), 3);
            ProvisioningReport report = orchestrator(resolver)
                    .run(feed("a@example.com", "b@example.com", "c@example.com"), pool);

            assertThat(report.succeeded()).isEqualTo(3);
            assertThat(report.permanentlyFailed()).isZero();
            assertThat(report.inProgressAtShutdown()).isZero();
            assertThat(engine.maxOpen.get()).isLessThanOrEqualTo(2);
            assertThat(engine.proxyOverlaps.get()).isZero();

            ArgumentCaptor<Account> saved = ArgumentCaptor.forClass(Account.class);
            verify(accountStore, times(3)).save(saved.capture());
            assertThat(saved.getAllValues())
                    .extracting(Account::getEmail)
                    .containsExactlyInAnyOrder("a@example.com", "b@example.com", "c@example.com");
            assertThat(saved.getAllValues())
                    .allSatisfy(account -> {
                        assertThat(account.getProxy()).isIn("10.0.0.1:8080", "10.0.0.2:8080");
                        assertThat(account.getStatus()).isEqualTo(AccountStatus.ACTIVE);
                        assertThat(account.getSessionArtifact()).contains("sid");
                    });
            assertThat(pool.freeCount()).isEqualTo(2);
            assertThat(listener.created).hasSize(3);
        }
    }

    @Nested
    @DisplayName("retries")
    class Retries {

        @Test
        @Timeout(10)
        @DisplayName("a rejected identity is retried once and then recorded as permanently failed")
        void rejectedFormIsRetriedThenGivesUp() {
            config.setProxyFailureThreshold(2);
            engine.rejectRegistration = email -> true;
            ProxyPool pool = new ProxyPool(List.of(P1), 2);

            ProvisioningReport report = orchestrator(otpResolver).run(feed("x@example.com"), pool);

            assertThat(report.succeeded()).isZero();
            assertThat(report.permanentlyFailed()).isEqualTo(1);
            assertThat(report.permanentFailures()).containsEntry("x@example.com", FailureReason.FORM_REJECTED);
            assertThat(report.attemptFailures()).containsEntry(FailureReason.FORM_REJECTED, 2);
            assertThat(listener.failedAttempts).containsExactly(1, 2);
            assertThat(engine.opens.get()).isEqualTo(2);
            assertThat(pool.failureCount(P1)).isEqualTo(2);
            verify(accountStore, never()).save(any());
        }

        @Test
        @Timeout(10)
        void attemptsNeverExceedRetryBoundPlusOne() {
            config.setRetryBound(2);
            engine.failOpen = true;
            ProxyPool pool = new ProxyPool(List.of(P1, P2), 100);

            ProvisioningReport report = orchestrator(otpResolver).run(feed("y@example.com"), pool);

            assertThat(engine.opens.get()).isEqualTo(3);
            assertThat(listener.failedAttempts).containsExactly(1, 2, 3);
            assertThat(report.permanentFailures()).containsEntry("y@example.com", FailureReason.PROXY_ERROR);
            assertThat(listener.permanentAttempts).containsExactly(3);
        }

        @Test
        @Timeout(10)
        void exhaustedProxyPoolFailsRemainingIdentities() {
            config.setWorkers(1);
            engine.failOpen = true;
            ProxyPool pool = new ProxyPool(List.of(P1), 1);

            ProvisioningReport report = orchestrator(otpResolver).run(feed("a@example.com", "b@example.com"), pool);

            assertThat(report.permanentlyFailed()).isEqualTo(2);
            assertThat(report.permanentFailures().values()).containsOnly(FailureReason.PROXY_ERROR);
            assertThat(report.attemptFailures()).containsEntry(FailureReason.PROXY_ERROR, 1);
            assertThat(engine.opens.get()).isEqualTo(1);
            assertThat(pool.quarantined()).containsExactly(P1);
        }

        @Test
        @Timeout(10)
        @DisplayName("an Error from the driver settles the task and the run still ends")
        void driverErrorDoesNotHangTheRun() {
            config.setWorkers(2);
            SignupDriver driver = mock(SignupDriver.class);
            when(driver.run(any(ProvisioningTask.class))).thenThrow(new NoClassDefFoundError("com/microsoft/playwright/Playwright"));
            ProxyPool pool = new ProxyPool(List.of(P1, P2), 3);

            ProvisioningReport report = new ProvisioningOrchestrator(driver, accountStore, config, List.of(listener))
                    .run(feed("n@example.com"), pool);

            assertThat(report.permanentFailures()).containsEntry("n@example.com", FailureReason.UNEXPECTED_RESPONSE);
            assertThat(report.inProgressAtShutdown()).isZero();
            assertThat(listener.failedAttempts).containsExactly(1, 2);
            assertThat(pool.leasedCount()).isZero();
        }

        @Test
        @Timeout(10)
        void storeFailureIsPermanentAndProxyStaysHealthy() {
            when(accountStore.save(any(Account.class))).thenThrow(new IllegalStateException("disk full"));
            ProxyPool pool = new ProxyPool(List.of(P1), 3);

            ProvisioningReport report = orchestrator(otpResolver).run(feed("z@example.com"), pool);

            assertThat(report.permanentFailures()).containsEntry("z@example.com", FailureReason.PERSISTENCE_ERROR);
            assertThat(engine.opens.get()).isEqualTo(1);
            assertThat(pool.failureCount(P1)).isZero();
            assertThat(pool.freeCount()).isEqualTo(1);
        }
    }

    @Test
    @Timeout(10)
    void stopLetsTheCurrentStepFinishAndLeavesTheRestUntouched() throws Exception {
        config.setWorkers(1);
        engine.openGate = new CountDownLatch(1);
        engine.rejectRegistration = email -> true;
        ProvisioningOrchestrator orchestrator = orchestrator(otpResolver);
        IdentityFeed feed = feed("a@example.com", "b@example.com", "c@example.com");
        ProxyPool pool = new ProxyPool(List.of(P1), 3);

        CompletableFuture<ProvisioningReport> run = CompletableFuture.supplyAsync(() -> orchestrator.run(feed, pool));
        assertThat(engine.firstOpen.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(orchestrator.isRunning()).isTrue();
        assertThatThrownBy(() -> orchestrator.run(feed("d@example.com"), new ProxyPool(List.of(P2), 3)))
                .isInstanceOf(IllegalStateException.class);

        orchestrator.requestStop();
        engine.openGate.countDown();
        ProvisioningReport report = run.get(5, TimeUnit.SECONDS);

        assertThat(report.succeeded()).isZero();
        assertThat(report.permanentlyFailed()).isZero();
        assertThat(report.inProgressAtShutdown()).isEqualTo(1);
        assertThat(feed.remaining()).isEqualTo(2);
        assertThat(pool.leasedCount()).isZero();
        assertThat(orchestrator.isRunning()).isFalse();
    }

    @Test
    void refusesToStartWithoutIdentitiesOrProxies() {
        ProvisioningOrchestrator orchestrator = orchestrator(otpResolver);

        assertThatThrownBy(() -> orchestrator.run(new IdentityFeed(List.of()), new ProxyPool(List.of(P1), 3)))
                .isInstanceOf(ProvisioningException.class)
                .hasMessageContaining("identities");
        assertThatThrownBy(() -> orchestrator.run(feed("a@example.com"), new ProxyPool(List.of(), 3)))
                .isInstanceOf(ProvisioningException.class)
                .hasMessageContaining("proxies");
    }

    private static class RecordingListener implements ProvisioningListener {
        final List<Integer> failedAttempts = new CopyOnWriteArrayList<>();
        final List<Integer> permanentAttempts = new CopyOnWriteArrayList<>();
        final List<Account> created = new CopyOnWriteArrayList<>();

        @Override
        public void onAttemptFailed(ProvisioningTask task, FailureReason reason) {
            failedAttempts.add(task.getAttempt());
        }

        @Override
        public void onAccountCreated(Account account) {
            created.add(account);
        }

        @Override
        public void onPermanentFailure(Identity identity, FailureReason reason, int attempts) {
            permanentAttempts.add(attempts);
        }
    }
}
