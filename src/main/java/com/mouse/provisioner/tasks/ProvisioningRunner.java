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
import com.mouse.provisioner.utils.IdentityListParser;
import com.mouse.provisioner.utils.ProxyParser;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Starts a provisioning run once the application is up: loads the identity and proxy lists,
 * drops the ones already used by stored accounts and hands the rest to the orchestrator.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "provisioning.autostart", havingValue = "true")
public class ProvisioningRunner implements ApplicationListener<ApplicationReadyEvent> {

    private final ProvisioningConfig config;
    private final ProvisioningOrchestrator orchestrator;
    private final AccountStore accountStore;
    private final ProxyHealthChecker proxyHealthChecker;
    private final AccountSessionVerifier sessionVerifier;

    private volatile Thread runnerThread;

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        log.info("═══════════════════════════════════════════════════════════");
        log.info("   ACCOUNT PROVISIONER - STARTING");
        log.info("═══════════════════════════════════════════════════════════");

        Thread t = new Thread(this::runSafely, "provisioning-runner");
        t.setDaemon(false);
        runnerThread = t;
        t.start();
    }

    private void runSafely() {
        try {
            ProvisioningReport report = provision();
            log.info("✅ Provisioning complete | {}", report);
            if (!report.permanentFailures().isEmpty()) {
                report.permanentFailures().forEach((email, reason) ->
                        log.warn("❌ Gave up | Email: {} | Reason: {}", email, reason));
            }
        } catch (ProvisioningException e) {
            log.error("❌ Provisioning cannot start: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("❌ Provisioning run crashed: {}", e.getMessage(), e);
        }
    }

    /**
     * Loads the inputs, runs the orchestrator to completion and optionally re-checks stored sessions.
     */
    public ProvisioningReport provision() {
        List<Proxy> parsedProxies = readProxies();
        List<Proxy> proxies = selectProxies(parsedProxies);
        List<Identity> identities = loadIdentities();

        ProvisioningReport report = orchestrator.run(new IdentityFeed(identities),
                new ProxyPool(proxies, config.getProxyFailureThreshold()));

        if (config.isVerifySessions()) {
            // stored accounts reopen through their own proxy, which the run itself skipped as used
            sessionVerifier.verifyActive(parsedProxies);
        }
        return report;
    }

    List<Identity> loadIdentities() {
        List<Identity> parsed = IdentityListParser.parse(readLines(config.getIdentitiesFile()), config.getDefaultPassword());
        Set<String> used = accountStore.usedEmails().stream()
                .map(email -> email.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());

        List<Identity> fresh = new ArrayList<>();
        for (Identity identity : parsed) {
            if (!used.contains(identity.email().toLowerCase(Locale.ROOT))) {
                fresh.add(identity);
            }
        }
        int alreadyProvisioned = parsed.size() - fresh.size();
        if (config.isShuffle()) {
            Collections.shuffle(fresh);
        }
        if (config.getAmount() > 0 && fresh.size() > config.getAmount()) {
            fresh = new ArrayList<>(fresh.subList(0, config.getAmount()));
        }
        log.info("Identities loaded | Parsed: {} | AlreadyProvisioned: {} | Queued: {}",
                parsed.size(), alreadyProvisioned, fresh.size());
        return fresh;
    }

    List<Proxy> readProxies() {
        return ProxyParser.parseAll(readLines(config.getProxiesFile()));
    }

    /** Proxies for new accounts: unused by stored ones, optionally shuffled and health checked. */
    List<Proxy> selectProxies(List<Proxy> parsed) {
        Set<String> used = accountStore.usedProxyLabels().stream()
                .map(label -> label.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());

        List<Proxy> fresh = parsed.stream()
                .filter(proxy -> !used.contains(proxy.label().toLowerCase(Locale.ROOT)))
                .collect(Collectors.toCollection(ArrayList::new));
        int alreadyUsed = parsed.size() - fresh.size();
        if (config.isShuffle()) {
            Collections.shuffle(fresh);
        }
        if (config.isValidateProxies()) {
            fresh = new ArrayList<>(proxyHealthChecker.filterHealthy(fresh));
        }
        log.info("Proxies loaded | Parsed: {} | AlreadyUsed: {} | Usable: {}",
                parsed.size(), alreadyUsed, fresh.size());
        return fresh;
    }

    private static List<String> readLines(String file) {
        Path path = Path.of(file);
        if (!Files.isRegularFile(path)) {
            throw new ProvisioningException("Input file not found: " + path.toAbsolutePath());
        }
        try {
            return Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ProvisioningException("Could not read " + path.toAbsolutePath(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        Thread t = runnerThread;
        if (t != null && t.isAlive()) {
            log.info("Stopping provisioning run...");
            orchestrator.requestStop();
        }
    }
}
