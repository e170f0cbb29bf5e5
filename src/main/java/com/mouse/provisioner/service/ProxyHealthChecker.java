package com.mouse.provisioner.service;

import com.mouse.provisioner.config.ProvisioningConfig;
import com.mouse.provisioner.model.Proxy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Credentials;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Optional pre-flight check: a proxy is healthy when a plain GET through it answers 200.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProxyHealthChecker {

    private static final int MAX_PARALLEL_CHECKS = 16;

    private final ProvisioningConfig config;

    public boolean isHealthy(Proxy proxy) {
        OkHttpClient client = clientFor(proxy);
        Request request = new Request.Builder()
                .url(config.getProxyCheckUrl())
                .get()
                .build();
        try (Response response = client.newCall(request).execute()) {
            boolean healthy = response.code() == 200;
            if (!healthy) {
                log.debug("Proxy check failed | Proxy: {} | Status: {}", proxy.label(), response.code());
            }
            return healthy;
        } catch (IOException e) {
            log.debug("Proxy check failed | Proxy: {} | Error: {}", proxy.label(), e.getMessage());
            return false;
        }
    }

    /**
     * Checks every proxy in parallel and keeps the healthy ones in their original order.
     */
    public List<Proxy> filterHealthy(Collection<Proxy> proxies) {
        if (proxies.isEmpty()) {
            return List.of();
        }
        AtomicInteger counter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(proxies.size(), MAX_PARALLEL_CHECKS), r -> {
            Thread t = new Thread(r, "proxy-check-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            List<CompletableFuture<Boolean>> checks = new ArrayList<>();
            for (Proxy proxy : proxies) {
                checks.add(CompletableFuture.supplyAsync(() -> isHealthy(proxy), pool));
            }

            List<Proxy> healthy = new ArrayList<>();
            int index = 0;
            for (Proxy proxy : proxies) {
                if (checks.get(index++).join()) {
                    healthy.add(proxy);
                }
            }
            log.info("Proxy health check | Healthy: {}/{}", healthy.size(), proxies.size());
            return healthy;
        } finally {
            pool.shutdownNow();
        }
    }

    private OkHttpClient clientFor(Proxy proxy) {
        OkHttpClient.Builder builder = new OkHttpClient.Builder()
                .proxy(new java.net.Proxy(java.net.Proxy.Type.HTTP, new InetSocketAddress(proxy.host(), proxy.port())))
                .callTimeout(config.getProxyCheckTimeout())
                .connectTimeout(config.getProxyCheckTimeout())
                .retryOnConnectionFailure(false);

        if (proxy.hasCredentials()) {
            String credential = Credentials.basic(proxy.username(), proxy.password() != null ? proxy.password() : "");
            builder.proxyAuthenticator((route, response) -> {
                if (response.request().header("Proxy-Authorization") != null) {
                    return null;
                }
                return response.request().newBuilder()
                        .header("Proxy-Authorization", credential)
                        .build();
            });
        }
        return builder.build();
    }
}
