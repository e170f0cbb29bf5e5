package com.mouse.provisioner.repository;

import com.mouse.provisioner.entity.Account;
import com.mouse.provisioner.enums.AccountStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AccountRepository extends JpaRepository<Account, String> {

    Optional<Account> findByEmail(String email);

    List<Account> findAllByOrderByCreatedAtAsc();

    List<Account> findByStatusOrderByCreatedAtAsc(AccountStatus status);

    @Query("select a.email from Account a")
    List<String> findAllEmails();

    /**
     * Proxy labels already used by stored accounts
     */
    @Query("select distinct a.proxy from Account a where a.proxy is not null")
    List<String> findAllProxyLabels();
}
