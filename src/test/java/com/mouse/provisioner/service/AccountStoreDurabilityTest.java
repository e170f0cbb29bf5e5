package com.mouse.provisioner.service;

import com.mouse.provisioner.entity.Account;
import com.mouse.provisioner.repository.AccountRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the store against a file database, closes the context and opens a fresh one on the
 * same file, the way a process restart would.
 */
class AccountStoreDurabilityTest {

    @TempDir
    Path dataDir;

    private ConfigurableApplicationContext start() {
        String url = "jdbc:h2:file:" + dataDir.resolve("accounts").toAbsolutePath();
        return new SpringApplicationBuilder(StoreOnlyConfig.class)
                .run("--spring.datasource.url=" + url,
                        "--spring.jpa.hibernate.ddl-auto=update",
                        "--spring.main.web-application-type=none",
                        "--spring.main.banner-mode=off");
    }

    @Test
    void acknowledgedWritesSurviveARestart() throws Exception {
        try (ConfigurableApplicationContext context = start()) {
            AccountStore store = context.getBean(AccountStore.class);
            ExecutorService executor = Executors.newFixedThreadPool(4);
            List<Future<Account>> writes = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                String email = "user" + i + "@example.com";
                writes.add(executor.submit(() -> store.save(account(email))));
            }
            // same email from two threads at once
            writes.add(executor.submit(() -> store.save(account("shared@example.com"))));
            writes.add(executor.submit(() -> store.save(account("shared@example.com"))));
            for (Future<Account> write : writes) {
                write.get();
            }
            executor.shutdown();
        }

        try (ConfigurableApplicationContext context = start()) {
            AccountStore store = context.getBean(AccountStore.class);

            assertThat(store.all()).hasSize(9);
            assertThat(store.find("user7@example.com")).isPresent();
            assertThat(store.find("shared@example.com"))
                    .map(Account::getSessionArtifact)
                    .contains("{\"cookies\":[]}");
        }
    }

    private static Account account(String email) {
        return Account.builder()
                .email(email)
                .password("pw")
                .proxy("10.0.0.1:8080")
                .sessionArtifact("{\"cookies\":[]}")
                .build();
    }

    @Configuration(proxyBeanMethods = false)
    @EnableAutoConfiguration
    @EntityScan(basePackageClasses = Account.class)
    @EnableJpaRepositories(basePackageClasses = AccountRepository.class)
    @Import(AccountStore.class)
    static class StoreOnlyConfig {
    }
}
