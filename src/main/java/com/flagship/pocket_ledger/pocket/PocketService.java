package com.flagship.pocket_ledger.pocket;

import com.flagship.pocket_ledger.account.CurrencyCode;
import com.flagship.pocket_ledger.error.IntegrityViolationException;
import com.flagship.pocket_ledger.error.NotFoundException;
import com.flagship.pocket_ledger.subpocket.SubPocket;
import com.flagship.pocket_ledger.subpocket.SubPocketService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Pocket ledger: owns pocket balances and the pocket-level integrity rules.
 *
 * Enforces:
 * 1. Pocket names are unique within an account
 * 2. At most one FIXED pocket exists across all accounts
 * 3. Sub-pockets can only be added to the FIXED pocket
 *
 * Pockets are created through {@code AccountService.addPocket}, which resolves the
 * parent account (currency, investment restriction) before delegating here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PocketService {

    private final PocketStore pocketStore;
    private final SubPocketService subPocketService;
    private final Clock clock;

    public Pocket create(UUID accountId, CurrencyCode currency, String name, PocketType type) {
        String trimmedName = requireName(name);
        ensureUniqueName(accountId, trimmedName, null);
        if (type == PocketType.FIXED) {
            findFixedPocket().ifPresent(existing -> {
                throw new IntegrityViolationException(String.format(
                    "A fixed pocket already exists (%s). Only one fixed pocket is allowed.", existing.getId()));
            });
        }

        Pocket created = pocketStore.insert(
            Pocket.create(UUID.randomUUID(), accountId, trimmedName, type, currency, clock.instant()));
        log.info("Pocket created: id={}, accountId={}, type={}", created.getId(), accountId, type);
        return created;
    }

    public Pocket rename(UUID id, String name) {
        Pocket pocket = get(id);
        String trimmedName = requireName(name);
        if (!trimmedName.equalsIgnoreCase(pocket.getName())) {
            ensureUniqueName(pocket.getAccountId(), trimmedName, id);
        }
        return pocketStore.update(pocket.withName(trimmedName));
    }

    /**
     * Adds a sub-pocket to the FIXED pocket.
     *
     * @throws NotFoundException if the pocket does not exist
     * @throws IntegrityViolationException if the pocket is not FIXED
     */
    public SubPocket addSubPocket(UUID pocketId, String name, BigDecimal targetValue, int periodicityMonths) {
        Pocket pocket = get(pocketId);
        if (!pocket.isFixed()) {
            throw new IntegrityViolationException(String.format(
                "Sub-pockets can only be created in the fixed pocket; pocket %s is %s", pocketId, pocket.getType()));
        }
        return subPocketService.create(pocketId, name, targetValue, periodicityMonths);
    }

    /**
     * Applies a signed delta to a NORMAL pocket balance.
     *
     * @return the updated pocket, or empty if it no longer exists
     */
    public Optional<Pocket> applyDelta(UUID id, BigDecimal delta) {
        return pocketStore.findById(id)
            .map(pocket -> pocketStore.update(pocket.applyDelta(delta)));
    }

    /**
     * Rewrites the currency of every pocket in an account.
     */
    public void changeCurrency(UUID accountId, CurrencyCode currency) {
        for (Pocket pocket : pocketStore.findByAccountId(accountId)) {
            if (pocket.getCurrency() != currency) {
                pocketStore.update(pocket.withCurrency(currency));
            }
        }
    }

    /**
     * Writes back a pocket whose balance was derived elsewhere.
     */
    public Pocket save(Pocket pocket) {
        return pocketStore.update(pocket);
    }

    public Pocket get(UUID id) {
        return pocketStore.findById(id)
            .orElseThrow(() -> NotFoundException.of("Pocket", id));
    }

    public Optional<Pocket> find(UUID id) {
        return pocketStore.findById(id);
    }

    public List<Pocket> findByAccount(UUID accountId) {
        return pocketStore.findByAccountId(accountId);
    }

    public List<Pocket> findAll() {
        return pocketStore.findAll();
    }

    public Optional<Pocket> findFixedPocket() {
        return pocketStore.findAll().stream().filter(Pocket::isFixed).findFirst();
    }

    public List<SubPocket> subPocketsOf(UUID pocketId) {
        return subPocketService.findByPocket(pocketId);
    }

    public void delete(UUID id) {
        pocketStore.delete(id);
    }

    private String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Pocket name cannot be empty");
        }
        return name.trim();
    }

    private void ensureUniqueName(UUID accountId, String name, UUID excludeId) {
        boolean taken = pocketStore.findByAccountId(accountId).stream()
            .anyMatch(p -> p.getName().equalsIgnoreCase(name) && !p.getId().equals(excludeId));
        if (taken) {
            throw new IntegrityViolationException(
                String.format("A pocket named \"%s\" already exists in account %s", name, accountId));
        }
    }
}
