package com.flagship.pocket_ledger.account;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
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

/**
 * JPA entity for accounts.
 *
 * No setters: rows are created through {@link #fromDomain(Account)} and changed only
 * through {@link #updateFromDomain(Account)}.
 */
@Entity
@Table(
    name = "accounts",
    uniqueConstraints = @UniqueConstraint(name = "uq_accounts_name_currency", columnNames = {"name", "currency"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AccountEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private String color;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3)
    private CurrencyCode currency;

    @Column(nullable = false, precision = 20, scale = 6)
    private BigDecimal balance;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private AccountType type;

    @Column(name = "stock_symbol")
    private String stockSymbol;

    @Column(name = "invested_amount", precision = 20, scale = 6)
    private BigDecimal investedAmount;

    @Column(name = "share_count", precision = 20, scale = 6)
    private BigDecimal shareCount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "display_order", nullable = false)
    private int displayOrder;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }

    static AccountEntity fromDomain(Account account) {
        return new AccountEntity(
            account.getId(),
            account.getName(),
            account.getColor(),
            account.getCurrency(),
            account.getBalance(),
            account.getType(),
            account.getStockSymbol(),
            account.getInvestedAmount(),
            account.getShareCount(),
            account.getCreatedAt(),
            account.getDisplayOrder()
        );
    }

    public Account toDomain() {
        return new Account(id, name, color, currency, balance, type, stockSymbol,
            investedAmount, shareCount, createdAt, displayOrder);
    }

    /**
     * Copies the mutable fields. Identity, type and creation time never change.
     */
    void updateFromDomain(Account account) {
        this.name = account.getName();
        this.color = account.getColor();
        this.currency = account.getCurrency();
        this.balance = account.getBalance();
        this.stockSymbol = account.getStockSymbol();
        this.investedAmount = account.getInvestedAmount();
        this.shareCount = account.getShareCount();
        this.displayOrder = account.getDisplayOrder();
    }
}
