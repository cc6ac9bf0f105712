package com.flagship.pocket_ledger.pocket;

import com.flagship.pocket_ledger.account.CurrencyCode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "pockets",
    uniqueConstraints = @UniqueConstraint(name = "uq_pockets_account_name", columnNames = {"account_id", "name"}),
    indexes = @Index(name = "idx_pockets_account_id", columnList = "account_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PocketEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private PocketType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3)
    private CurrencyCode currency;

    @Column(nullable = false, precision = 20, scale = 6)
    private BigDecimal balance;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }

    static PocketEntity fromDomain(Pocket pocket) {
        return new PocketEntity(
            pocket.getId(),
            pocket.getAccountId(),
            pocket.getName(),
            pocket.getType(),
            pocket.getCurrency(),
            pocket.getBalance(),
            pocket.getCreatedAt()
        );
    }

    public Pocket toDomain() {
        return new Pocket(id, accountId, name, type, currency, balance, createdAt);
    }

    void updateFromDomain(Pocket pocket) {
        this.name = pocket.getName();
        this.currency = pocket.getCurrency();
        this.balance = pocket.getBalance();
    }
}
