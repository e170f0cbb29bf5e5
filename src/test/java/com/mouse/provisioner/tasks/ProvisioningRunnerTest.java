package com.mouse.provisioner.tasks;

import com.mouse.provisioner.config.ProvisioningConfig;
import com.mouse.provisioner.exception.ProvisioningException;
import com.mouse.provisioner.manager.IdentityFeed;
import com.mouse.provisioner.manager.ProvisioningOrchestrator;
import com.mouse.provisioner.manager.ProxyPool;
import com.mouse.provisioner.model.Identity;
import com.mouse.provisioner.model.ProvisioningReport;
import com.mouse.provisioner.model.Proxy;
import com.mouse.provisioner.service.AccountSessionVerifier;
import com.mouse.provisioner.service.AccountStore;
import com.mouse.provisioner.service.ProxyHealthChecker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ProvisioningRunnerTest {

    @TempDir
    Path dir;

    @Mock
    private ProvisioningOrchestrator orchestrator;
    @Mock
    private AccountStore accountStore;
    @Mock
    private ProxyHealthChecker healthChecker;
    @Mock
    private AccountSessionVerifier sessionVerifier;

    private ProvisioningConfig config;
    private ProvisioningRunner runner;

    @BeforeEach
    void setUp() throws IOException {
        Path identities = Files.write(dir.resolve("identities.txt"), List.of(
                "used@example.com:pw",
                "fresh1@example.com:pw",
                "fresh2@example.com",
                "fresh3@example.com:pw"));
        Path proxies = Files.write(dir.resolve("proxies.txt"), List.of(
                "10.0.0.1:8080:u:p",
                "10.0.0.2:8080:u:p",
                "bad line"));

        config = new ProvisioningConfig();
        config.setIdentitiesFile(identities.toString());
        config.setProxiesFile(proxies.toString());
        config.setDefaultPassword("default-pw");
        config.setShuffle(false);
        config.setAmount(0);
        config.setProxyFailureThreshold(3);

        when(accountStore.usedEmails()).thenReturn(Set.of("used@example.com"));
        when(accountStore.usedProxyLabels()).thenReturn(Set.of("10.0.0.1:8080"));

        runner = new ProvisioningRunner(config, orchestrator, accountStore, healthChecker, sessionVerifier);
    }

    @Test
    void dropsIdentitiesThatAlreadyHaveAnAccount() {
        List<Identity> identities = runner.loadIdentities();

        assertThat(identities).extracting(Identity::email)
                .containsExactly("fresh1@example.com", "fresh2@example.com", "fresh3@example.com");
        assertThat(identities.get(1).password()).isEqualTo("default-pw");
    }

    @Test
    void amountLimitsTheQueue() {
        config.setAmount(2);

        assertThat(runner.loadIdentities()).hasSize(2);
    }

    @Test
    void dropsProxiesAlreadyUsedAndSkipsHealthCheckByDefault() {
        List<Proxy> proxies = runner.selectProxies(runner.readProxies());

        assertThat(proxies).extracting(Proxy::label).containsExactly("10.0.0.2:8080");
        verifyNoInteractions(healthChecker);
    }

    @Test
    void healthCheckFiltersProxiesWhenEnabled() {
        config.setValidateProxies(true);
        when(healthChecker.filterHealthy(anyList())).thenReturn(List.of());

        assertThat(runner.selectProxies(runner.readProxies())).isEmpty();
    }

    @Test
    void provisionHandsFilteredInputsToTheOrchestrator() {
        ProvisioningReport report = new ProvisioningReport(3, 0, 0, Map.of(), Map.of(), Duration.ofSeconds(1));
        when(orchestrator.run(any(IdentityFeed.class), any(ProxyPool.class))).thenReturn(report);

        assertThat(runner.provision()).isSameAs(report);

        ArgumentCaptor<IdentityFeed> feed = ArgumentCaptor.forClass(IdentityFeed.class);
        ArgumentCaptor<ProxyPool> pool = ArgumentCaptor.forClass(ProxyPool.class);
        verify(orchestrator).run(feed.capture(), pool.capture());
        assertThat(feed.getValue().remaining()).isEqualTo(3);
        assertThat(pool.getValue().usableCount()).isEqualTo(1);
        verifyNoInteractions(sessionVerifier);
    }

    @Test
    void verifiesStoredSessionsAfterTheRunWhenEnabled() {
        config.setVerifySessions(true);
        when(orchestrator.run(any(IdentityFeed.class), any(ProxyPool.class)))
                .thenReturn(new ProvisioningReport(0, 0, 0, Map.of(), Map.of(), Duration.ZERO));

        runner.provision();

        verify(sessionVerifier).verifyActive(anyList());
    }

    @Test
    @DisplayName("session check gets the proxies of stored accounts even though the run skipped them")
    void sessionCheckSeesProxiesOfStoredAccounts() {
        config.setVerifySessions(true);
        when(orchestrator.run(any(IdentityFeed.class), any(ProxyPool.class)))
                .thenReturn(new ProvisioningReport(0, 0, 0, Map.of(), Map.of(), Duration.ZERO));

        runner.provision();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Collection<Proxy>> known = ArgumentCaptor.forClass(Collection.class);
        verify(sessionVerifier).verifyActive(known.capture());
        assertThat(known.getValue()).extracting(Proxy::label).containsExactly("10.0.0.1:8080", "10.0.0.2:8080");
        ArgumentCaptor<ProxyPool> pool = ArgumentCaptor.forClass(ProxyPool.class);
        verify(orchestrator).run(any(IdentityFeed.class), pool.capture());
        assertThat(pool.getValue().usableCount()).isEqualTo(1);
    }

    @Test
    void missingInputFileIsFatal() {
        config.setIdentitiesFile(dir.resolve("nope.txt").toString());

        assertThatThrownBy(() -> runner.loadIdentities())
                .isInstanceOf(ProvisioningException.class)
                .hasMessageContaining("nope.txt");
    }
}
