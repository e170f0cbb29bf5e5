package com.mouse.provisioner.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@Data
public class ProvisioningConfig {

    // ==================== WORKER POOL ====================

    @Value("${provisioning.workers:5}")
    private int workers;

    /** Extra attempts allowed per identity after the first one. */
    @Value("${provisioning.retry.bound:1}")
    private int retryBound;

    @Value("${provisioning.shutdown.grace:PT2M}")
    private Duration shutdownGrace;

    // ==================== PROXY LEASING ====================

    @Value("${provisioning.proxy.failure-threshold:3}")
    private int proxyFailureThreshold;

    @Value("${provisioning.lease.initial-backoff:PT0.2S}")
    private Duration leaseInitialBackoff;

    @Value("${provisioning.lease.max-backoff:PT5S}")
    private Duration leaseMaxBackoff;

    // ==================== RUN INPUTS ====================

    @Value("${provisioning.autostart:false}")
    private boolean autostart;

    @Value("${provisioning.identities-file:identities.txt}")
    private String identitiesFile;

    @Value("${provisioning.proxies-file:proxies.txt}")
    private String proxiesFile;

    /** Used for identity lines that carry only an email. */
    @Value("${provisioning.default-password:}")
    private String defaultPassword;

    /** 0 means every remaining identity. */
    @Value("${provisioning.amount:0}")
    private int amount;

    @Value("${provisioning.shuffle:true}")
    private boolean shuffle;

    // ==================== PROXY HEALTH CHECK ====================

    @Value("${provisioning.proxy.validate:false}")
    private boolean validateProxies;

    @Value("${provisioning.proxy.check-url:https://www.example.com/}")
    private String proxyCheckUrl;

    @Value("${provisioning.proxy.check-timeout:PT4S}")
    private Duration proxyCheckTimeout;

    /** Re-checks stored sessions after each run and marks stale ones failed. */
    @Value("${provisioning.verify-sessions:false}")
    private boolean verifySessions;
}
