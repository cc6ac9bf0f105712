package com.flagship.pocket_ledger.movement;

import com.flagship.pocket_ledger.account.CurrencyCode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA row for a movement. Parent ids are plain columns without foreign keys so that
 * orphaned movements survive the deletion of their parents.
 */
@Entity
@Table(
    name = "movements",
    indexes = {
        @Index(name = "idx_movements_account_id", columnList = "account_id"),
        @Index(name = "idx_movements_pocket_id", columnList = "pocket_id"),
        @Index(name = "idx_movements_sub_pocket_id", columnList = "sub_pocket_id"),
        @Index(name = "idx_movements_displayed_date", columnList = "displayed_date")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MovementEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private MovementType type;

    @Column(name = "account_id", nullable = false)
    private UUID accountId;

    @Column(name = "pocket_id", nullable = false)
    private UUID pocketId;

    @Column(name = "sub_pocket_id")
    private UUID subPocketId;

    @Column(nullable = false, precision = 20, scale = 6)
    private BigDecimal amount;

    @Column(length = 1000)
    private String notes;

    @Column(name = "displayed_date", nullable = false)
    private LocalDate displayedDate;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private boolean pending;

    @Column(nullable = false)
    private boolean orphaned;

    @Enumerated(EnumType.STRING)
    @Column(name = "orphan_reason", length = 16)
    private OrphanReason orphanReason;

    @Column(name = "orphaned_account_name")
    private String orphanedAccountName;

    @Enumerated(EnumType.STRING)
    @Column(name = "orphaned_account_currency", length = 3)
    private CurrencyCode orphanedAccountCurrency;

    @Column(name = "orphaned_pocket_name")
    private String orphanedPocketName;

    @Column(name = "orphaned_sub_pocket_name")
    private String orphanedSubPocketName;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }

    static MovementEntity fromDomain(Movement movement) {
        return new MovementEntity(
            movement.getId(),
            movement.getType(),
            movement.getAccountId(),
            movement.getPocketId(),
            movement.getSubPocketId(),
            movement.getAmount(),
            movement.getNotes(),
            movement.getDisplayedDate(),
            movement.getCreatedAt(),
            movement.isPending(),
            movement.isOrphaned(),
            movement.getOrphanReason(),
            movement.getOrphanedAccountName(),
            movement.getOrphanedAccountCurrency(),
            movement.getOrphanedPocketName(),
            movement.getOrphanedSubPocketName()
        );
    }

    public Movement toDomain() {
        return new Movement(id, type, accountId, pocketId, subPocketId, amount, notes, displayedDate, createdAt,
            pending, orphaned, orphanReason, orphanedAccountName, orphanedAccountCurrency, orphanedPocketName,
            orphanedSubPocketName);
    }

    void updateFromDomain(Movement movement) {
        this.type = movement.getType();
        this.accountId = movement.getAccountId();
        this.pocketId = movement.getPocketId();
        this.subPocketId = movement.getSubPocketId();
        this.amount = movement.getAmount();
        this.notes = movement.getNotes();
        this.displayedDate = movement.getDisplayedDate();
        this.pending = movement.isPending();
        this.orphaned = movement.isOrphaned();
        this.orphanReason = movement.getOrphanReason();
        this.orphanedAccountName = movement.getOrphanedAccountName();
        this.orphanedAccountCurrency = movement.getOrphanedAccountCurrency();
        this.orphanedPocketName = movement.getOrphanedPocketName();
        this.orphanedSubPocketName = movement.getOrphanedSubPocketName();
    }
}
