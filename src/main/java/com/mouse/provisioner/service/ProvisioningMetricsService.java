package com.mouse.provisioner.service;

import com.mouse.provisioner.entity.Account;
import com.mouse.provisioner.enums.FailureReason;
import com.mouse.provisioner.interfaces.ProvisioningListener;
import com.mouse.provisioner.model.Identity;
import com.mouse.provisioner.model.ProvisioningTask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

@Service
@Slf4j
public class ProvisioningMetricsService implements ProvisioningListener {

    private final AtomicInteger accountsCreated = new AtomicInteger(0);
    private final AtomicInteger failedAttempts = new AtomicInteger(0);
    private final AtomicInteger permanentFailures = new AtomicInteger(0);
    private final Map<FailureReason, AtomicInteger> failuresByReason = new EnumMap<>(FailureReason.class);

    public ProvisioningMetricsService() {
        for (FailureReason reason : FailureReason.values()) {
            failuresByReason.put(reason, new AtomicInteger(0));
        }
    }

    @Override
    public void onAttemptFailed(ProvisioningTask task, FailureReason reason) {
        failedAttempts.incrementAndGet();
        failuresByReason.get(reason).incrementAndGet();
    }

    @Override
    public void onAccountCreated(Account account) {
        accountsCreated.incrementAndGet();
    }

    @Override
    public void onPermanentFailure(Identity identity, FailureReason reason, int attempts) {
        permanentFailures.incrementAndGet();
    }

    public Map<String, Object> getMetrics() {
        int created = accountsCreated.get();
        int attempts = created + failedAttempts.get();

        return Map.of(
                "accountsCreated", created,
                "failedAttempts", failedAttempts.get(),
                "permanentFailures", permanentFailures.get(),
                "attemptSuccessRate", attempts > 0 ? (created * 100.0 / attempts) : 0.0,
                "otpTimeouts", failuresByReason.get(FailureReason.OTP_TIMEOUT).get(),
                "proxyErrors", failuresByReason.get(FailureReason.PROXY_ERROR).get()
        );
    }

    public int failuresFor(FailureReason reason) {
        return failuresByReason.get(reason).get();
    }

    @Scheduled(fixedRateString = "${provisioning.metrics.log-interval-ms:60000}")
    public void logMetrics() {
        Map<String, Object> metrics = getMetrics();
        if ((int) metrics.get("accountsCreated") == 0 && (int) metrics.get("failedAttempts") == 0) {
            return;
        }
        log.info("📊 Provisioning Metrics: {}", metrics);

        double successRate = (double) metrics.get("attemptSuccessRate");
        if ((int) metrics.get("failedAttempts") >= 10 && successRate < 20.0) {
            log.warn("⚠️ LOW ATTEMPT SUCCESS RATE: {}%", String.format("%.2f", successRate));
        }
    }
}
