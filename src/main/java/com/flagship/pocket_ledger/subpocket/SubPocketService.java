package com.flagship.pocket_ledger.subpocket;

import com.flagship.pocket_ledger.error.IntegrityViolationException;
import com.flagship.pocket_ledger.error.InvalidAmountException;
import com.flagship.pocket_ledger.error.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * SubPocket ledger: owns sub-pocket balances, terms and enablement.
 *
 * Sub-pockets are created through {@code PocketService.addSubPocket}, which checks that
 * the parent pocket is FIXED before delegating here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubPocketService {

    private final SubPocketStore subPocketStore;
    private final Clock clock;

    public SubPocket create(UUID pocketId, String name, BigDecimal targetValue, int periodicityMonths) {
        String trimmedName = requireName(name);
        validateTerms(targetValue, periodicityMonths);
        ensureUniqueName(pocketId, trimmedName, null);

        SubPocket created = subPocketStore.insert(
            SubPocket.create(UUID.randomUUID(), pocketId, trimmedName, targetValue, periodicityMonths,
                clock.instant()));
        log.info("Sub-pocket created: id={}, pocketId={}, target={}, months={}",
            created.getId(), pocketId, targetValue, periodicityMonths);
        return created;
    }

    /**
     * Changes name and/or amortization terms. Null arguments keep the current value.
     * The balance is untouched.
     */
    public SubPocket update(UUID id, String name, BigDecimal targetValue, Integer periodicityMonths) {
        SubPocket existing = get(id);

        String newName = existing.getName();
        if (name != null) {
            newName = requireName(name);
            if (!newName.equalsIgnoreCase(existing.getName())) {
                ensureUniqueName(existing.getPocketId(), newName, id);
            }
        }
        BigDecimal newTarget = targetValue != null ? targetValue : existing.getTargetValue();
        int newPeriodicity = periodicityMonths != null ? periodicityMonths : existing.getPeriodicityMonths();
        validateTerms(newTarget, newPeriodicity);

        return subPocketStore.update(existing.withTerms(newName, newTarget, newPeriodicity));
    }

    public SubPocket toggleEnabled(UUID id) {
        SubPocket toggled = subPocketStore.update(get(id).toggled());
        log.info("Sub-pocket {} enabled={}", id, toggled.isEnabled());
        return toggled;
    }

    /**
     * Applies a signed delta to a sub-pocket balance.
     *
     * @return the updated sub-pocket, or empty if it no longer exists
     */
    public Optional<SubPocket> applyDelta(UUID id, BigDecimal delta) {
        return subPocketStore.findById(id)
            .map(subPocket -> subPocketStore.update(subPocket.applyDelta(delta)));
    }

    public SubPocket get(UUID id) {
        return subPocketStore.findById(id)
            .orElseThrow(() -> NotFoundException.of("SubPocket", id));
    }

    public Optional<SubPocket> find(UUID id) {
        return subPocketStore.findById(id);
    }

    public List<SubPocket> findByPocket(UUID pocketId) {
        return subPocketStore.findByPocketId(pocketId);
    }

    public void delete(UUID id) {
        subPocketStore.delete(id);
    }

    /**
     * Totals over the enabled sub-pockets of a fixed pocket.
     */
    public FixedExpenseSummary monthlySummary(UUID pocketId) {
        List<SubPocket> enabled = subPocketStore.findByPocketId(pocketId).stream()
            .filter(SubPocket::isEnabled)
            .toList();
        BigDecimal totalMonthly = enabled.stream()
            .map(SubPocket::monthlyAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal totalRequired = enabled.stream()
            .map(SubPocket::requiredContribution)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        return new FixedExpenseSummary(pocketId, totalMonthly, totalRequired, enabled.size());
    }

    private String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Sub-pocket name cannot be empty");
        }
        return name.trim();
    }

    private void validateTerms(BigDecimal targetValue, int periodicityMonths) {
        if (targetValue == null || targetValue.signum() <= 0) {
            throw new InvalidAmountException("Sub-pocket target value must be greater than zero");
        }
        if (periodicityMonths <= 0) {
            throw new InvalidAmountException("Sub-pocket periodicity must be greater than zero");
        }
    }

    private void ensureUniqueName(UUID pocketId, String name, UUID excludeId) {
        boolean taken = subPocketStore.findByPocketId(pocketId).stream()
            .anyMatch(sp -> sp.getName().trim().equalsIgnoreCase(name) && !sp.getId().equals(excludeId));
        if (taken) {
            throw new IntegrityViolationException(
                String.format("A sub-pocket named \"%s\" already exists in pocket %s", name, pocketId));
        }
    }
}
