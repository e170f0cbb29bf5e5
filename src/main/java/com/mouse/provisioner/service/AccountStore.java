package com.mouse.provisioner.service;

import com.mouse.provisioner.entity.Account;
import com.mouse.provisioner.enums.AccountStatus;
import com.mouse.provisioner.repository.AccountRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Durable repository of provisioned accounts keyed by email.
 *
 * <p>Writes for the same email are serialized and committed before the call returns;
 * writes for different emails do not wait on each other.
 */
@Slf4j
@Service
public class AccountStore {

    private final AccountRepository accountRepository;
    private final TransactionTemplate transactionTemplate;
    private final ConcurrentMap<String, ReentrantLock> emailLocks = new ConcurrentHashMap<>();

    public AccountStore(AccountRepository accountRepository, PlatformTransactionManager transactionManager) {
        this.accountRepository = accountRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Inserts the account, or overwrites the stored one with the same email.
     * The original creation time is kept on overwrite.
     */
    public Account save(Account account) {
        Objects.requireNonNull(account, "account is required");
        String email = normalize(account.getEmail());
        return withEmailLock(email, () -> transactionTemplate.execute(tx -> {
            Account stored = accountRepository.findByEmail(email)
                    .map(existing -> {
                        existing.setPassword(account.getPassword());
                        existing.setProxy(account.getProxy());
                        existing.setSessionArtifact(account.getSessionArtifact());
                        existing.setStatus(account.getStatus());
                        return existing;
                    })
                    .orElseGet(() -> account.toBuilder().email(email).version(null).build());
            Account saved = accountRepository.saveAndFlush(stored);
            log.info("Account saved | Email: {} | Status: {} | Proxy: {}", saved.getEmail(), saved.getStatus(), saved.getProxy());
            return saved;
        }));
    }

    public Optional<Account> find(String email) {
        return accountRepository.findByEmail(normalize(email));
    }

    public List<Account> all() {
        return accountRepository.findAllByOrderByCreatedAtAsc();
    }

    public List<Account> active() {
        return accountRepository.findByStatusOrderByCreatedAtAsc(AccountStatus.ACTIVE);
    }

    /**
     * Records that a stored session stopped authenticating.
     *
     * @return false when no account exists for the email
     */
    public boolean markFailed(String email) {
        String key = normalize(email);
        Boolean updated = withEmailLock(key, () -> transactionTemplate.execute(tx ->
                accountRepository.findByEmail(key)
                        .map(account -> {
                            account.setStatus(AccountStatus.FAILED);
                            accountRepository.saveAndFlush(account);
                            log.warn("Account marked failed | Email: {}", key);
                            return true;
                        })
                        .orElse(false)));
        return Boolean.TRUE.equals(updated);
    }

    public Set<String> usedEmails() {
        return new HashSet<>(accountRepository.findAllEmails());
    }

    public Set<String> usedProxyLabels() {
        return new HashSet<>(accountRepository.findAllProxyLabels());
    }

    private <T> T withEmailLock(String email, Supplier<T> work) {
        ReentrantLock lock = emailLocks.computeIfAbsent(email, k -> new ReentrantLock());
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    private static String normalize(String email) {
        Objects.requireNonNull(email, "email is required");
        return email.trim().toLowerCase();
    }
}
