package com.flagship.pocket_ledger.subpocket;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
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
import java.util.UUID;

@Entity
@Table(
    name = "sub_pockets",
    indexes = @Index(name = "idx_sub_pockets_pocket_id", columnList = "pocket_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SubPocketEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "pocket_id", nullable = false, updatable = false)
    private UUID pocketId;

    @Column(nullable = false)
    private String name;

    @Column(name = "target_value", nullable = false, precision = 20, scale = 6)
    private BigDecimal targetValue;

    @Column(name = "periodicity_months", nullable = false)
    private int periodicityMonths;

    @Column(nullable = false, precision = 20, scale = 6)
    private BigDecimal balance;

    @Column(nullable = false)
    private boolean enabled;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }

    static SubPocketEntity fromDomain(SubPocket subPocket) {
        return new SubPocketEntity(
            subPocket.getId(),
            subPocket.getPocketId(),
            subPocket.getName(),
            subPocket.getTargetValue(),
            subPocket.getPeriodicityMonths(),
            subPocket.getBalance(),
            subPocket.isEnabled(),
            subPocket.getCreatedAt()
        );
    }

    public SubPocket toDomain() {
        return new SubPocket(id, pocketId, name, targetValue, periodicityMonths, balance, enabled, createdAt);
    }

    void updateFromDomain(SubPocket subPocket) {
        this.name = subPocket.getName();
        this.targetValue = subPocket.getTargetValue();
        this.periodicityMonths = subPocket.getPeriodicityMonths();
        this.balance = subPocket.getBalance();
        this.enabled = subPocket.isEnabled();
    }
}
