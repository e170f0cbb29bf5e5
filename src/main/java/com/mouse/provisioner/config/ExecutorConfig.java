package com.mouse.provisioner.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ExecutorConfig {

    /**
     * Runs the mailbox and SMS polling loops, two per verification in flight.
     */
    @Bean(name = "otpPollerExecutor", destroyMethod = "shutdownNow")
    public ExecutorService otpPollerExecutor() {
        return Executors.newCachedThreadPool(new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r);
                t.setName("otp-poller-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        });
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
