package com.mouse.provisioner.entity;

import com.mouse.provisioner.enums.AccountStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString(exclude = {"password", "sessionArtifact"})
@Entity
@Table(name = "account",
        indexes = {
                @Index(name = "idx_account_status", columnList = "status"),
                @Index(name = "idx_account_created_at", columnList = "createdAt")
        })
public class Account {

    /**
     * Email doubles as the key: one record per identity.
     */
    @Id
    @Column(length = 320, nullable = false)
    private String email;

    @Column(nullable = false)
    private String password;

    /**
     * host:port of the proxy the account was created through, never the credentials
     */
    @Column(length = 255)
    private String proxy;

    /**
     * Browser storage state captured once the session was authenticated
     */
    @Lob
    @Column(nullable = false)
    private String sessionArtifact;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private AccountStatus status = AccountStatus.ACTIVE;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @Version
    private Integer version;

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isActive() {
        return status == AccountStatus.ACTIVE;
    }
}
